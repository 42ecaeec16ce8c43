package com.rulebooks.core.vcs;

/**
 * Base class for failures reported by a {@link GitClient} or {@link GitRepository}.
 */
public class GitException extends RuntimeException {
    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
