package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

public final class ShapeCallNode extends CallNode {
    private final String shape;

    public ShapeCallNode(SourceLocation location, List<LoopNode> loops, String shape) {
        super(location, loops);
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public String getShape() {
        return shape;
    }

    @Override
    public String getTarget() {
        return shape;
    }
}
