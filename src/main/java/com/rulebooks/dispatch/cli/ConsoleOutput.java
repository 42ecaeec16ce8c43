package com.rulebooks.dispatch.cli;

import com.rulebooks.core.model.Project;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the importer CLI.
 */
public class ConsoleOutput {

    private static final int SHORT_HASH_LENGTH = 12;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) RULEBOOKS IMPORTER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RULEBOOKS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void rulebook(String name, int rulesets) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + name + " (" + rulesets + " ruleset" + (rulesets != 1 ? "s" : "") + ")"));
    }

    public static void project(Project project) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + project.id() + "|@ " + project.name()
                        + " @|fg(yellow) " + shortHash(project.gitHash()) + "|@ "
                        + project.url()
                        + (project.archiveFile() != null ? " @|faint [" + project.archiveFile() + "]|@" : "")));
    }

    static String shortHash(String gitHash) {
        if (gitHash == null) {
            return "-";
        }
        return gitHash.length() > SHORT_HASH_LENGTH ? gitHash.substring(0, SHORT_HASH_LENGTH) : gitHash;
    }
}
