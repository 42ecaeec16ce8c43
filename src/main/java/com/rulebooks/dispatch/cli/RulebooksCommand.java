package com.rulebooks.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: import, projects.
 */
@Command(
        name = "rulebooks",
        mixinStandardHelpOptions = true,
        version = "Rulebooks Importer 0.1.0",
        description = "Imports event-driven automation rulebooks from git repositories",
        subcommands = {
                ImportCommand.class,
                ProjectsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RulebooksCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
