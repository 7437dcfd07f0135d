package com.eisenscript.xml;

import com.eisenscript.xml.graph.CallRecord;
import com.eisenscript.xml.graph.RuleCallRecord;
import com.eisenscript.xml.graph.RuleGraph;
import com.eisenscript.xml.graph.RuleGraphBuilder;
import com.eisenscript.xml.graph.RuleRecord;
import com.eisenscript.xml.loader.DebugFlags;
import com.eisenscript.xml.loader.EisenScriptAstBuilder;
import com.eisenscript.xml.loader.EisenScriptParseException;
import com.eisenscript.xml.loader.ast.ScriptNode;
import com.eisenscript.xml.writer.RuleGraphXmlWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for translating EisenScript files into EisenXML.
 *
 * <p>A file is read, parsed and built into a {@link RuleGraph} completely before anything is
 * written, so a failed translation leaves no output behind.</p>
 */
public final class EisenScriptTranslator {
    public static final String SOURCE_EXTENSION = ".es";
    public static final String OUTPUT_EXTENSION = ".xml";
    private static final int RECENT_DEBUG_LINES = 10;
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final EisenScriptAstBuilder astBuilder = new EisenScriptAstBuilder();
    private final RuleGraphXmlWriter xmlWriter = new RuleGraphXmlWriter();

    public RuleGraph translateSource(String sourceName, String source) throws EisenScriptParseException {
        ScriptNode script = astBuilder.parse(sourceName, source);
        return new RuleGraphBuilder().build(script);
    }

    public TranslationResult translate(Path sourcePath) throws TranslationException {
        return translate(sourcePath, null);
    }

    /**
     * Translates {@code sourcePath} into {@code <file name>.xml}, written beside the source or, when
     * {@code outputDir} is not {@code null}, inside that directory (created if missing).
     */
    public TranslationResult translate(Path sourcePath, Path outputDir) throws TranslationException {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Path file = sourcePath.toAbsolutePath().normalize();
        List<TranslationMessage> messages = new ArrayList<>();
        String contents;
        try {
            contents = stripByteOrderMark(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new TranslationException("Failed to read EisenScript: " + file, ex);
        }

        RuleGraph graph;
        try {
            graph = translateSource(file.toString(), contents);
            drainDebugOutput(file, messages);
        } catch (EisenScriptParseException ex) {
            List<TranslationMessage> debugMessages = new ArrayList<>();
            drainDebugOutput(file, debugMessages);
            StringBuilder message = new StringBuilder(ex.getMessage());
            if (!debugMessages.isEmpty()) {
                message.append("\nRecent debug output:\n");
                int start = Math.max(0, debugMessages.size() - RECENT_DEBUG_LINES);
                for (int i = start; i < debugMessages.size(); i++) {
                    message.append("  ").append(debugMessages.get(i).getMessage()).append('\n');
                }
            }
            throw new TranslationException(
                    "[Version " + Version.FULL + "] Failed to parse EisenScript: "
                            + file
                            + " ("
                            + message.toString().trim()
                            + ")",
                    ex);
        }
        messages.addAll(checkRuleReferences(file, graph));

        Path outputPath = resolveOutputPath(file, outputDir);
        try {
            if (outputDir != null) {
                Files.createDirectories(outputPath.getParent());
            }
            xmlWriter.write(graph, outputPath);
        } catch (IOException ex) {
            throw new TranslationException("Failed to write EisenXML: " + outputPath, ex);
        }
        messages.add(
                new TranslationMessage(
                        TranslationMessage.Level.INFO,
                        "Wrote " + graph.getRules().size() + " rules to " + outputPath,
                        file.toString(),
                        0));
        return new TranslationResult(file, outputPath, graph, messages);
    }

    /**
     * Translates every {@code *.es} file of {@code sourceDir} in name order. A file that fails is
     * reported as an unsuccessful result with an ERROR message and does not stop the others.
     */
    public List<TranslationResult> translateDirectory(Path sourceDir, Path outputDir) throws TranslationException {
        Objects.requireNonNull(sourceDir, "sourceDir");
        List<Path> sources = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sourceDir, "*" + SOURCE_EXTENSION)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    sources.add(path);
                }
            }
        } catch (IOException ex) {
            throw new TranslationException("Failed to list EisenScript directory: " + sourceDir, ex);
        }
        sources.sort(null);

        List<TranslationResult> results = new ArrayList<>(sources.size());
        for (Path source : sources) {
            try {
                results.add(translate(source, outputDir));
            } catch (TranslationException ex) {
                TranslationMessage error =
                        new TranslationMessage(
                                TranslationMessage.Level.ERROR,
                                ex.getMessage(),
                                source.toString(),
                                ex.getCause() instanceof EisenScriptParseException parseError
                                                && parseError.getLocation() != null
                                        ? parseError.getLocation().getLine()
                                        : 0);
                results.add(new TranslationResult(source, null, null, List.of(error)));
            }
        }
        return results;
    }

    /** {@code spiral.es} becomes {@code spiral.es.xml}, beside the source unless a directory is given. */
    public static Path resolveOutputPath(Path sourcePath, Path outputDir) {
        String outputName = sourcePath.getFileName().toString() + OUTPUT_EXTENSION;
        if (outputDir != null) {
            return outputDir.resolve(outputName);
        }
        return sourcePath.resolveSibling(outputName);
    }

    static String stripByteOrderMark(String contents) {
        return contents.startsWith(BYTE_ORDER_MARK) ? contents.substring(1) : contents;
    }

    private static List<TranslationMessage> checkRuleReferences(Path file, RuleGraph graph) {
        Set<String> defined = new HashSet<>();
        for (RuleRecord rule : graph.getRules()) {
            defined.add(rule.getName());
        }
        List<TranslationMessage> warnings = new ArrayList<>();
        for (RuleRecord rule : graph.getRules()) {
            for (CallRecord call : rule.getCalls()) {
                if (call instanceof RuleCallRecord ruleCall && !defined.contains(ruleCall.getRule())) {
                    warnings.add(
                            new TranslationMessage(
                                    TranslationMessage.Level.WARNING,
                                    "Rule '" + rule.getName() + "' calls undefined rule '" + ruleCall.getRule() + "'",
                                    file.toString(),
                                    0));
                }
            }
        }
        return warnings;
    }

    private static void drainDebugOutput(Path file, List<TranslationMessage> messages) {
        if (DebugFlags.isTokenDebugEnabled()) {
            for (String tokenLine : DebugFlags.drainCapturedTokens()) {
                messages.add(
                        new TranslationMessage(
                                TranslationMessage.Level.INFO, "[tokens] " + tokenLine, file.toString(), 0));
            }
        }
        if (DebugFlags.isParserTraceEnabled()) {
            for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
                messages.add(
                        new TranslationMessage(
                                TranslationMessage.Level.INFO, "[diagnostic] " + diagnostic, file.toString(), 0));
            }
        }
    }
}
