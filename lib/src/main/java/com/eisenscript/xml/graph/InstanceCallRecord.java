package com.eisenscript.xml.graph;

import java.util.Objects;

public final class InstanceCallRecord extends CallRecord {
    private final String shape;

    public InstanceCallRecord(String shape, String transforms, String count) {
        super(transforms, count);
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public String getShape() {
        return shape;
    }

    @Override
    public String getTarget() {
        return shape;
    }

    @Override
    public String toString() {
        return "instance " + shape + " [" + getTransforms() + "]" + getCount().map(c -> " x" + c).orElse("");
    }
}
