package com.rulebooks.core.vcs;

/**
 * Thrown when a repository cannot be cloned (network, authentication or bad URL).
 */
public class GitTransferException extends GitException {
    public GitTransferException(String message) {
        super(message);
    }

    public GitTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
