package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

public final class RuleDefinitionNode {
    private final SourceLocation location;
    private final String name;
    private final String maxDepth;
    private final String successor;
    private final String weight;
    private final List<CallNode> calls;

    public RuleDefinitionNode(
            SourceLocation location,
            String name,
            String maxDepth,
            String successor,
            String weight,
            List<CallNode> calls) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.maxDepth = maxDepth;
        this.successor = successor;
        this.weight = weight;
        this.calls = List.copyOf(calls);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public String getMaxDepth() {
        return maxDepth;
    }

    public String getSuccessor() {
        return successor;
    }

    public String getWeight() {
        return weight;
    }

    public List<CallNode> getCalls() {
        return calls;
    }
}
