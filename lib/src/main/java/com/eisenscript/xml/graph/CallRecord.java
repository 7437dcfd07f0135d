package com.eisenscript.xml.graph;

import java.util.Objects;
import java.util.Optional;

/** One child of a rule: an instance of a primitive shape or a call to another rule. */
public sealed abstract class CallRecord permits InstanceCallRecord, RuleCallRecord {
    private final String transforms;
    private final String count;

    protected CallRecord(String transforms, String count) {
        this.transforms = Objects.requireNonNull(transforms, "transforms");
        this.count = count;
    }

    /** Normalized transform string, empty when the call had no loop wrapper. */
    public String getTransforms() {
        return transforms;
    }

    public Optional<String> getCount() {
        return Optional.ofNullable(count);
    }

    /** Shape or rule name invoked by this call. */
    public abstract String getTarget();
}
