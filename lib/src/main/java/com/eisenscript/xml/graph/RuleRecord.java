package com.eisenscript.xml.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named rule of the graph. Optional attributes are copied verbatim from the source and left
 * empty when the definition does not set them; defaulting is up to the consumer.
 */
public final class RuleRecord {
    private final String name;
    private final String weight;
    private final String maxDepth;
    private final String successor;
    private final List<CallRecord> calls;

    public RuleRecord(String name, String weight, String maxDepth, String successor, List<CallRecord> calls) {
        this.name = Objects.requireNonNull(name, "name");
        this.weight = weight;
        this.maxDepth = maxDepth;
        this.successor = successor;
        this.calls = List.copyOf(calls);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getWeight() {
        return Optional.ofNullable(weight);
    }

    public Optional<String> getMaxDepth() {
        return Optional.ofNullable(maxDepth);
    }

    public Optional<String> getSuccessor() {
        return Optional.ofNullable(successor);
    }

    public List<CallRecord> getCalls() {
        return calls;
    }
}
