package com.rulebooks.core.vcs;

/**
 * Thrown when a ref cannot be resolved to a commit.
 */
public class GitResolutionException extends GitException {
    public GitResolutionException(String message) {
        super(message);
    }

    public GitResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
