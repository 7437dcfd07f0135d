package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

public final class RuleCallNode extends CallNode {
    private final String ruleName;

    public RuleCallNode(SourceLocation location, List<LoopNode> loops, String ruleName) {
        super(location, loops);
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName");
    }

    public String getRuleName() {
        return ruleName;
    }

    @Override
    public String getTarget() {
        return ruleName;
    }
}
