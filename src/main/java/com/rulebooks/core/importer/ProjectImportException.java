package com.rulebooks.core.importer;

/**
 * Thrown when a project import cannot complete. The import's transaction is
 * rolled back before this reaches the caller.
 */
public class ProjectImportException extends RuntimeException {
    public ProjectImportException(String message) {
        super(message);
    }

    public ProjectImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
