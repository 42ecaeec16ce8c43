package com.rulebooks.dispatch.cli;

import com.rulebooks.core.importer.ProjectImportService;
import com.rulebooks.core.model.Project;
import com.rulebooks.core.persistence.ProjectRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: rulebooks import --name &lt;name&gt; &lt;url&gt;
 * <p>
 * Clones the repository, imports its rulebooks and prints what was stored.
 * Exits with 1 when the import fails.
 */
@Command(name = "import", mixinStandardHelpOptions = true, description = "Import a git repository as a project")
@Component
public class ImportCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Git URL of the repository to import")
    private String url;

    @Option(names = {"--name", "-n"}, required = true, description = "Project name")
    private String name;

    @Option(names = {"--description", "-d"}, defaultValue = "", description = "Project description")
    private String description;

    private final ProjectImportService importService;
    private final ProjectRepository repository;

    public ImportCommand(ProjectImportService importService, ProjectRepository repository) {
        this.importService = importService;
        this.repository = repository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Importing " + url + " ...");

        Project project;
        try {
            project = importService.importProject(name, url, description);
        } catch (Exception e) {
            ConsoleOutput.error("Import failed: " + rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.success("Project " + project.id() + " '" + project.name() + "' imported at "
                + ConsoleOutput.shortHash(project.gitHash()));
        var rulebooks = repository.findRulebooks(project.id());
        for (var rulebook : rulebooks) {
            ConsoleOutput.rulebook(rulebook.name(), repository.findRulesets(rulebook.id()).size());
        }
        if (rulebooks.isEmpty()) {
            ConsoleOutput.info("No rulebooks found");
        }
        ConsoleOutput.info("Archive: " + project.archiveFile());
        return 0;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (cause != e && e.getMessage() != null) {
            return e.getMessage() + " (" + (message != null ? message : cause.getClass().getSimpleName()) + ")";
        }
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
