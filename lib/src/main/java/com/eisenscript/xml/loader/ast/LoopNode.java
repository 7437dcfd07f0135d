package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

public final class LoopNode {
    private final SourceLocation location;
    private final String count;
    private final List<TransformNode> transforms;

    public LoopNode(SourceLocation location, String count, List<TransformNode> transforms) {
        this.location = Objects.requireNonNull(location, "location");
        this.count = count;
        this.transforms = List.copyOf(transforms);
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Multiplier literal in front of the braces, {@code null} when the loop has none. */
    public String getCount() {
        return count;
    }

    /** Geometry transforms only; color and material clauses are dropped while parsing. */
    public List<TransformNode> getTransforms() {
        return transforms;
    }
}
