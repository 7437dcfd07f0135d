package com.eisenscript.xml.loader;

import com.eisenscript.xml.loader.grammar.EisenScriptLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Switches for grammar debugging output. System properties take precedence over the environment.
 *
 * <ul>
 *   <li>{@code eisenxml.debugTokens} / {@code EISENXML_DEBUG_TOKENS}: dump the token stream</li>
 *   <li>{@code eisenxml.debugParser} / {@code EISENXML_DEBUG_PARSER}: capture prediction diagnostics</li>
 * </ul>
 */
public final class DebugFlags {
    static final String TOKENS_PROPERTY = "eisenxml.debugTokens";
    static final String PARSER_PROPERTY = "eisenxml.debugParser";
    private static final String TOKENS_ENV = "EISENXML_DEBUG_TOKENS";
    private static final String PARSER_ENV = "EISENXML_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String environmentVariable) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(environmentVariable));
    }

    static void logTokens(CommonTokenStream tokens, EisenScriptLexer lexer) {
        System.err.println("[EisenXML] Token dump for debugging:");
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-15s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine() + 1,
                            token.getText());
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    static void captureDiagnostic(String message) {
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
