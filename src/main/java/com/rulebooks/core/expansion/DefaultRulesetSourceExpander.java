package com.rulebooks.core.expansion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands source declarations of the form
 * <pre>
 *   sources:
 *     - name: range
 *       ansible.eda.range:
 *         limit: 5
 * </pre>
 * into {@code {name: range, type: range, source: ansible.eda.range, config: {limit: 5}}}.
 * <p>
 * The declaration key that is neither {@code name} nor {@code filters} names the
 * source plugin; {@code type} is its last dotted segment. An unnamed source is
 * called {@value #UNNAMED_SOURCE}. Entries that are not maps are skipped.
 * <p>
 * Ruleset names are not required to be unique. When two rulesets share a name
 * the later one's expansion replaces the earlier, and both end up with it.
 */
@Component
public class DefaultRulesetSourceExpander implements RulesetSourceExpander {

    private static final Logger log = LoggerFactory.getLogger(DefaultRulesetSourceExpander.class);

    static final String UNNAMED_SOURCE = "<unnamed>";

    @Override
    public Map<String, List<Map<String, Object>>> expand(List<Map<String, Object>> rulebookContent) {
        var expanded = new LinkedHashMap<String, List<Map<String, Object>>>();
        if (rulebookContent == null) {
            return expanded;
        }

        for (Map<String, Object> ruleset : rulebookContent) {
            String name = String.valueOf(ruleset.get("name"));
            if (expanded.containsKey(name)) {
                log.warn("Duplicate ruleset name '{}'; its sources replace those of the earlier ruleset", name);
            }
            expanded.put(name, expandSources(ruleset.get("sources")));
        }
        return expanded;
    }

    private List<Map<String, Object>> expandSources(Object sources) {
        var result = new ArrayList<Map<String, Object>>();
        if (!(sources instanceof List<?> declarations)) {
            return result;
        }

        for (Object declaration : declarations) {
            if (!(declaration instanceof Map<?, ?> source)) {
                log.debug("Skipping source declaration that is not a map: {}", declaration);
                continue;
            }
            result.add(expandSource(source));
        }
        return result;
    }

    private Map<String, Object> expandSource(Map<?, ?> source) {
        var expanded = new LinkedHashMap<String, Object>();
        expanded.put("name", UNNAMED_SOURCE);

        for (var entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            switch (key) {
                case "name" -> expanded.put("name", entry.getValue());
                case "filters" -> expanded.put("filters", entry.getValue());
                default -> {
                    expanded.put("type", key.substring(key.lastIndexOf('.') + 1));
                    expanded.put("source", key);
                    expanded.put("config", entry.getValue());
                }
            }
        }
        return expanded;
    }
}
