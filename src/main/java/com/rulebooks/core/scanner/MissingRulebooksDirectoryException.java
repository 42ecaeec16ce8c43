package com.rulebooks.core.scanner;

import com.rulebooks.core.importer.ProjectImportException;

import java.nio.file.Path;

/**
 * Thrown when a repository has no top-level {@code rulebooks} directory.
 */
public class MissingRulebooksDirectoryException extends ProjectImportException {

    private final Path repositoryRoot;

    public MissingRulebooksDirectoryException(Path repositoryRoot) {
        super("The '" + RulebookScanner.RULEBOOKS_DIR + "' directory doesn't exist within the project root.");
        this.repositoryRoot = repositoryRoot;
    }

    public Path repositoryRoot() {
        return repositoryRoot;
    }
}
