package com.eisenscript.xml.graph;

import java.util.Objects;

public final class RuleCallRecord extends CallRecord {
    private final String rule;

    public RuleCallRecord(String rule, String transforms, String count) {
        super(transforms, count);
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public String getRule() {
        return rule;
    }

    @Override
    public String getTarget() {
        return rule;
    }

    @Override
    public String toString() {
        return "call " + rule + " [" + getTransforms() + "]" + getCount().map(c -> " x" + c).orElse("");
    }
}
