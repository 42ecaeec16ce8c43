package com.rulebooks.core.model;

import java.time.Instant;

/**
 * An imported source repository.
 *
 * @param id          generated identifier, {@code null} before the row is created
 * @param name        project name supplied by the caller
 * @param description free-form description, empty when not given
 * @param url         remote git URL the project was cloned from
 * @param gitHash     commit the import resolved {@code HEAD} to
 * @param archiveFile stored name of the archived snapshot, {@code null} until attached
 * @param createdAt   creation time of the row
 */
public record Project(
    Long id,
    String name,
    String description,
    String url,
    String gitHash,
    String archiveFile,
    Instant createdAt
) {

    public Project withArchiveFile(String storedName) {
        return new Project(id, name, description, url, gitHash, storedName, createdAt);
    }
}
