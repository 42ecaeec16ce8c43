package com.rulebooks.core.vcs;

import java.nio.file.Path;

/**
 * Clones remote repositories.
 * <p>
 * Implementations create filesystem artifacts under {@code destination};
 * the caller owns their lifecycle.
 */
public interface GitClient {

    /**
     * Clones {@code url} into {@code destination}.
     *
     * @param url         remote repository URL
     * @param destination directory to clone into, must not exist or be empty
     * @param depth       history depth, {@code 0} or less for a full clone
     * @return a handle on the cloned checkout
     * @throws GitTransferException if the clone fails
     */
    GitRepository clone(String url, Path destination, int depth);
}
