package com.eisenscript.xml.loader;

import com.eisenscript.xml.loader.ast.CallNode;
import com.eisenscript.xml.loader.ast.LoopNode;
import com.eisenscript.xml.loader.ast.RuleCallNode;
import com.eisenscript.xml.loader.ast.RuleDefinitionNode;
import com.eisenscript.xml.loader.ast.ScriptNode;
import com.eisenscript.xml.loader.ast.ShapeCallNode;
import com.eisenscript.xml.loader.ast.SourceLocation;
import com.eisenscript.xml.loader.ast.TransformNode;
import com.eisenscript.xml.loader.grammar.EisenScriptLexer;
import com.eisenscript.xml.loader.grammar.EisenScriptParser;
import com.eisenscript.xml.loader.grammar.EisenScriptParserBaseVisitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Parses EisenScript source into a {@link ScriptNode}. Only syntax is checked: rule references are
 * not resolved and numeric literals are kept as written.
 */
public final class EisenScriptAstBuilder {

    private static final List<String> SHAPE_KEYWORDS = List.of("sphere", "grid", "line", "box");

    /** Name of the rule synthesized from the entry block; scripts may not define it. */
    public static final String RESERVED_RULE_NAME = "entry";

    public ScriptNode parse(String sourceName, String input) throws EisenScriptParseException {
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public ScriptNode parse(String sourceName, CharStream input) throws EisenScriptParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        EisenScriptLexer lexer = new EisenScriptLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        EisenScriptParser parser = new EisenScriptParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            EisenScriptParser.ScriptContext context = parser.script();
            return new AstBuildingVisitor(sourceName).build(context);
        } catch (SyntaxErrorCancellation ex) {
            throw new EisenScriptParseException(ex.getMessage(), ex.getLocation(), ex);
        } catch (ParseCancellationException ex) {
            throw new EisenScriptParseException(ex.getMessage(), null, ex);
        }
    }

    static String normalizeShape(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : SHAPE_KEYWORDS) {
            if (lower.startsWith(keyword)) {
                return keyword + text.substring(keyword.length());
            }
        }
        return text;
    }

    private static final class AstBuildingVisitor extends EisenScriptParserBaseVisitor<Void> {
        private final String sourceName;
        private final TransformVisitor transformVisitor;
        private final List<CallNode> entryCalls = new ArrayList<>();
        private final List<RuleDefinitionNode> ruleDefinitions = new ArrayList<>();
        private String globalMaxDepth;

        AstBuildingVisitor(String sourceName) {
            this.sourceName = sourceName;
            this.transformVisitor = new TransformVisitor(this);
        }

        ScriptNode build(EisenScriptParser.ScriptContext context) {
            visitScript(context);
            return new ScriptNode(sourceName, globalMaxDepth, entryCalls, ruleDefinitions);
        }

        @Override
        public Void visitScript(EisenScriptParser.ScriptContext ctx) {
            for (EisenScriptParser.GlobalSettingContext setting : ctx.globalSetting()) {
                visit(setting);
            }
            for (EisenScriptParser.CallContext call : ctx.call()) {
                entryCalls.add(buildCall(call));
            }
            for (EisenScriptParser.RuleDefinitionContext definition : ctx.ruleDefinition()) {
                visit(definition);
            }
            return null;
        }

        @Override
        public Void visitGlobalSetting(EisenScriptParser.GlobalSettingContext ctx) {
            // Settings come back in source order, so the last one wins.
            globalMaxDepth = ctx.NUMBER().getText();
            return null;
        }

        @Override
        public Void visitRuleDefinition(EisenScriptParser.RuleDefinitionContext ctx) {
            String maxDepth = null;
            String successor = null;
            String weight = null;
            boolean seenMaxDepth = false;
            boolean seenWeight = false;
            for (EisenScriptParser.RuleModifierContext modifier : ctx.ruleModifier()) {
                if (modifier instanceof EisenScriptParser.MaxDepthModifierContext depth) {
                    if (seenMaxDepth) {
                        throw duplicateModifier(depth, "maxdepth");
                    }
                    seenMaxDepth = true;
                    maxDepth = depth.NUMBER().getText();
                    if (depth.definitionName() != null) {
                        successor = depth.definitionName().getText();
                    }
                } else if (modifier instanceof EisenScriptParser.WeightModifierContext weightModifier) {
                    if (seenWeight) {
                        throw duplicateModifier(weightModifier, "weight");
                    }
                    seenWeight = true;
                    weight = weightModifier.NUMBER().getText();
                }
            }
            String name = ctx.definitionName().getText();
            if (RESERVED_RULE_NAME.equals(name)) {
                Token token = ctx.definitionName().getStart();
                throw new SyntaxErrorCancellation(
                        "line "
                                + token.getLine()
                                + ":"
                                + (token.getCharPositionInLine() + 1)
                                + " rule name '"
                                + name
                                + "' is reserved",
                        toLocation(token),
                        null);
            }
            List<CallNode> calls = new ArrayList<>();
            for (EisenScriptParser.CallContext call : ctx.call()) {
                calls.add(buildCall(call));
            }
            ruleDefinitions.add(
                    new RuleDefinitionNode(
                            toLocation(ctx.getStart()),
                            name,
                            maxDepth,
                            successor,
                            weight,
                            calls));
            return null;
        }

        private CallNode buildCall(EisenScriptParser.CallContext ctx) {
            List<LoopNode> loops = new ArrayList<>();
            for (EisenScriptParser.LoopContext loop : ctx.loop()) {
                loops.add(buildLoop(loop));
            }
            SourceLocation location = toLocation(ctx.getStart());
            if (ctx.SHAPE() != null) {
                return new ShapeCallNode(location, loops, normalizeShape(ctx.SHAPE().getText()));
            }
            return new RuleCallNode(location, loops, ctx.ruleName().getText());
        }

        private LoopNode buildLoop(EisenScriptParser.LoopContext ctx) {
            if (ctx instanceof EisenScriptParser.GroupedLoopContext grouped) {
                return buildLoop(grouped.loop());
            }
            EisenScriptParser.TransformLoopContext loop = (EisenScriptParser.TransformLoopContext) ctx;
            String count = loop.NUMBER() != null ? loop.NUMBER().getText() : null;
            List<TransformNode> transforms = new ArrayList<>();
            for (EisenScriptParser.TransformContext transform : loop.transform()) {
                TransformNode node = transformVisitor.visit(transform);
                if (node != null) {
                    transforms.add(node);
                }
            }
            return new LoopNode(toLocation(loop.getStart()), count, transforms);
        }

        private SyntaxErrorCancellation duplicateModifier(ParserRuleContext ctx, String modifier) {
            Token token = ctx.getStart();
            return new SyntaxErrorCancellation(
                    "line "
                            + token.getLine()
                            + ":"
                            + (token.getCharPositionInLine() + 1)
                            + " duplicate "
                            + modifier
                            + " modifier '"
                            + ctx.getText()
                            + "'",
                    toLocation(token),
                    null);
        }

        SourceLocation toLocation(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }
    }

    /** Geometry transforms become nodes; color and material clauses yield {@code null} and are dropped. */
    private static final class TransformVisitor extends EisenScriptParserBaseVisitor<TransformNode> {
        private final AstBuildingVisitor owner;

        TransformVisitor(AstBuildingVisitor owner) {
            this.owner = owner;
        }

        @Override
        public TransformNode visitGeometryTransform(EisenScriptParser.GeometryTransformContext ctx) {
            List<String> values = new ArrayList<>();
            for (TerminalNode number : ctx.NUMBER()) {
                values.add(number.getText());
            }
            return new TransformNode(
                    owner.toLocation(ctx.getStart()), ctx.GEOMETRY_OP().getText(), values);
        }

        @Override
        public TransformNode visitColorTransform(EisenScriptParser.ColorTransformContext ctx) {
            return null;
        }

        @Override
        public TransformNode visitColorAssignment(EisenScriptParser.ColorAssignmentContext ctx) {
            return null;
        }

        @Override
        public TransformNode visitColorBlend(EisenScriptParser.ColorBlendContext ctx) {
            return null;
        }
    }
}
