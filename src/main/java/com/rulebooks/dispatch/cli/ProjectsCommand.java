package com.rulebooks.dispatch.cli;

import com.rulebooks.core.persistence.ProjectRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: rulebooks projects
 * <p>
 * Lists imported projects, oldest first.
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List imported projects")
@Component
public class ProjectsCommand implements Runnable {

    private final ProjectRepository repository;

    public ProjectsCommand(ProjectRepository repository) {
        this.repository = repository;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var projects = repository.listProjects();
        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects imported yet");
            return;
        }
        projects.forEach(ConsoleOutput::project);
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(projects.size() + " project" + (projects.size() != 1 ? "s" : ""));
    }
}
