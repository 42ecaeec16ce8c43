package com.rulebooks.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the matching subcommand and keeps its
 * exit code for {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * Exceptions escaping a command (a database that is down while listing
 * projects, for example) are printed as a single error line and exit with 1
 * instead of a picocli stack trace.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final RulebooksCommand rulebooksCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(RulebooksCommand rulebooksCommand, IFactory factory) {
        this.rulebooksCommand = rulebooksCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = newCommandLine(rulebooksCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine newCommandLine(RulebooksCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    log.debug("Command '{}' failed", commandLine.getCommandName(), e);
                    ConsoleOutput.error(commandLine.getCommandName() + " failed: " + e.getMessage());
                    return EXIT_FAILURE;
                });
    }
}
