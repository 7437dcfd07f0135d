package com.eisenscript.xml;

import com.eisenscript.xml.graph.RuleGraph;
import java.nio.file.Path;
import java.util.List;

/** Outcome of translating one source file. Failed results carry no graph and no output path. */
public final class TranslationResult {
    private final Path sourcePath;
    private final Path outputPath;
    private final RuleGraph ruleGraph;
    private final List<TranslationMessage> messages;

    public TranslationResult(Path sourcePath, Path outputPath, RuleGraph ruleGraph, List<TranslationMessage> messages) {
        this.sourcePath = sourcePath;
        this.outputPath = outputPath;
        this.ruleGraph = ruleGraph;
        this.messages = List.copyOf(messages);
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public RuleGraph getRuleGraph() {
        return ruleGraph;
    }

    public List<TranslationMessage> getMessages() {
        return messages;
    }

    public boolean isSuccess() {
        return outputPath != null;
    }
}
