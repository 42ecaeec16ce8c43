package com.rulebooks.core.model;

import java.util.List;
import java.util.Map;

/**
 * A named group of rules inside a rulebook, together with its expanded event sources.
 *
 * @param id         generated identifier, {@code null} before the row is created
 * @param rulebookId owning rulebook
 * @param name       ruleset name as written in the rulebook
 * @param sources    expanded source configurations, {@code null} when the expansion had no entry
 */
public record Ruleset(
    Long id,
    long rulebookId,
    String name,
    List<Map<String, Object>> sources
) {

    public Ruleset withId(long newId) {
        return new Ruleset(newId, rulebookId, name, sources);
    }
}
