package com.eisenscript.xml.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root of an EisenScript parse tree: the file-level depth setting, the implicit entry block and
 * the explicit rule definitions, each in source order.
 */
public final class ScriptNode {
    private final String sourceName;
    private final String globalMaxDepth;
    private final List<CallNode> entryCalls;
    private final List<RuleDefinitionNode> ruleDefinitions;

    public ScriptNode(
            String sourceName,
            String globalMaxDepth,
            List<CallNode> entryCalls,
            List<RuleDefinitionNode> ruleDefinitions) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.globalMaxDepth = globalMaxDepth;
        this.entryCalls = List.copyOf(entryCalls);
        this.ruleDefinitions = List.copyOf(ruleDefinitions);
    }

    public String getSourceName() {
        return sourceName;
    }

    /** Literal of the last {@code set maxdepth} statement, or {@code null} when the script has none. */
    public String getGlobalMaxDepth() {
        return globalMaxDepth;
    }

    public List<CallNode> getEntryCalls() {
        return entryCalls;
    }

    public List<RuleDefinitionNode> getRuleDefinitions() {
        return ruleDefinitions;
    }
}
