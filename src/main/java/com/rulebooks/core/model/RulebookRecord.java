package com.rulebooks.core.model;

import java.util.List;
import java.util.Map;

/**
 * A rulebook file found by the scanner, before it is persisted.
 * <p>
 * {@link #relativePath()} is relative to the repository root, e.g.
 * {@code rulebooks/alerts/disk.yml}; {@link #name()} drops the leading
 * rulebooks directory and is what the persisted rulebook is called.
 *
 * @param relativePath path relative to the repository root, always using {@code /}
 * @param rawContent   file text as read from disk
 * @param content      parsed ruleset entries, each a map carrying a {@code rules} key
 */
public record RulebookRecord(
    String relativePath,
    String rawContent,
    List<Map<String, Object>> content
) {

    private static final String RULEBOOKS_PREFIX = "rulebooks/";

    /** Path relative to the rulebooks directory, e.g. {@code alerts/disk.yml}. */
    public String name() {
        if (relativePath.startsWith(RULEBOOKS_PREFIX)) {
            return relativePath.substring(RULEBOOKS_PREFIX.length());
        }
        return relativePath;
    }
}
