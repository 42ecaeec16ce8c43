package com.rulebooks.core.persistence;

import java.nio.file.Path;

/**
 * Blob storage for project archive snapshots.
 */
public interface ArchiveStorage {

    /**
     * Copies {@code source} into storage under {@code filename}.
     *
     * @return the name the blob was stored under
     */
    String store(String filename, Path source);

    /** Removes a stored blob; a missing blob is not an error. */
    void delete(String storedName);

    /** Location of a stored blob. */
    Path resolve(String storedName);
}
