package com.rulebooks.core.model;

/**
 * A rulebook file discovered in a project.
 *
 * @param id        generated identifier, {@code null} before the row is created
 * @param projectId owning project
 * @param name      path of the file relative to the repository root
 * @param content   raw YAML text of the file
 */
public record Rulebook(
    Long id,
    long projectId,
    String name,
    String content
) {

    public Rulebook withId(long newId) {
        return new Rulebook(newId, projectId, name, content);
    }
}
