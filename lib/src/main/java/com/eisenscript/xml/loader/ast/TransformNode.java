package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

public final class TransformNode {
    private final SourceLocation location;
    private final String id;
    private final List<String> values;

    public TransformNode(SourceLocation location, String id, List<String> values) {
        this.location = Objects.requireNonNull(location, "location");
        this.id = Objects.requireNonNull(id, "id");
        this.values = List.copyOf(values);
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Mnemonic as written in the source, e.g. {@code X} or {@code rz}. */
    public String getId() {
        return id;
    }

    public List<String> getValues() {
        return values;
    }
}
