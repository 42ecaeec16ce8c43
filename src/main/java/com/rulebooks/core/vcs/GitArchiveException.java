package com.rulebooks.core.vcs;

/**
 * Thrown when an archive of a ref's tree cannot be written.
 */
public class GitArchiveException extends GitException {
    public GitArchiveException(String message) {
        super(message);
    }

    public GitArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
