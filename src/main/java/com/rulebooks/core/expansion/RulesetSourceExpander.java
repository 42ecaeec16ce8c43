package com.rulebooks.core.expansion;

import java.util.List;
import java.util.Map;

/**
 * Turns the short-hand event source declarations of a rulebook into fully
 * qualified source configurations.
 * <p>
 * Implementations must be pure: the same content always expands to the same
 * result and the input is never modified.
 */
public interface RulesetSourceExpander {

    /**
     * Expands the sources of every ruleset in a rulebook.
     *
     * @param rulebookContent parsed ruleset entries of one rulebook, may be {@code null}
     * @return expanded sources keyed by ruleset name; a ruleset with no
     *         {@code sources} maps to an empty list
     */
    Map<String, List<Map<String, Object>>> expand(List<Map<String, Object>> rulebookContent);
}
