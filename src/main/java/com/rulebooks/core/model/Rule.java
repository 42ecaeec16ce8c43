package com.rulebooks.core.model;

/**
 * A single name/action pair of a ruleset.
 *
 * @param id        generated identifier, {@code null} before the row is created
 * @param rulesetId owning ruleset
 * @param name      rule name
 * @param action    opaque action payload as parsed from YAML
 */
public record Rule(
    Long id,
    long rulesetId,
    String name,
    Object action
) {

    public Rule withId(long newId) {
        return new Rule(newId, rulesetId, name, action);
    }
}
