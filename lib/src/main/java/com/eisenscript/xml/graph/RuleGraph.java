package com.eisenscript.xml.graph;

import com.eisenscript.xml.loader.EisenScriptAstBuilder;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Document-level result of a translation: the default recursion depth and all rules in output order. */
public final class RuleGraph {
    public static final String ENTRY_RULE = EisenScriptAstBuilder.RESERVED_RULE_NAME;
    public static final String DEFAULT_MAX_DEPTH = "1000";

    private final String maxDepth;
    private final List<RuleRecord> rules;

    public RuleGraph(String maxDepth, List<RuleRecord> rules) {
        this.maxDepth = Objects.requireNonNull(maxDepth, "maxDepth");
        this.rules = List.copyOf(rules);
    }

    public String getMaxDepth() {
        return maxDepth;
    }

    public List<RuleRecord> getRules() {
        return rules;
    }

    public RuleRecord getEntryRule() {
        return rules.get(0);
    }

    /** First rule carrying {@code name}; explicit rules may share a name as weighted alternatives. */
    public Optional<RuleRecord> findRule(String name) {
        for (RuleRecord rule : rules) {
            if (rule.getName().equals(name)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
