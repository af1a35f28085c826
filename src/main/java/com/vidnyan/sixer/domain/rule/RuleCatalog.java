package com.vidnyan.sixer.domain.rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of rewrite rules, keyed by operation name.
 *
 * <p>Registration order is the order in which the engine applies rules. {@code all} is a
 * selector for every registered rule, not a rule itself.
 */
public class RuleCatalog {

    public static final String ALL = "all";

    private final Map<String, RewriteRule> rules = new LinkedHashMap<>();

    public RuleCatalog(List<? extends RewriteRule> orderedRules) {
        for (RewriteRule rule : orderedRules) {
            if (ALL.equals(rule.name())) {
                throw new IllegalArgumentException("'" + ALL + "' is a reserved operation name");
            }
            if (rules.putIfAbsent(rule.name(), rule) != null) {
                throw new IllegalArgumentException("duplicate operation name: " + rule.name());
            }
        }
    }

    public List<RewriteRule> rules() {
        return List.copyOf(rules.values());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    /**
     * Rules selected by the given names, in engine order. Duplicates are ignored.
     *
     * @throws UnknownRuleException for a name that is neither a rule nor {@code all}
     */
    public List<RewriteRule> resolve(Collection<String> names) {
        for (String name : names) {
            if (!ALL.equals(name) && !rules.containsKey(name)) {
                throw new UnknownRuleException(name, knownNames());
            }
        }
        if (names.contains(ALL)) {
            return rules();
        }
        List<RewriteRule> selected = new ArrayList<>();
        for (RewriteRule rule : rules.values()) {
            if (names.contains(rule.name())) {
                selected.add(rule);
            }
        }
        return selected;
    }

    private List<String> knownNames() {
        List<String> known = new ArrayList<>(rules.keySet());
        known.add(ALL);
        return known;
    }
}
