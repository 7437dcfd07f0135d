package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

/** A call site: zero or more loop wrappers, outermost first, around a shape or rule target. */
public sealed abstract class CallNode permits ShapeCallNode, RuleCallNode {

    private final SourceLocation location;
    private final List<LoopNode> loops;

    protected CallNode(SourceLocation location, List<LoopNode> loops) {
        this.location = Objects.requireNonNull(location, "location");
        this.loops = List.copyOf(loops);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<LoopNode> getLoops() {
        return loops;
    }

    /** Shape keyword or rule name this call invokes. */
    public abstract String getTarget();
}
