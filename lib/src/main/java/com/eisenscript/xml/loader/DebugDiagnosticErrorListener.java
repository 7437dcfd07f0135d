package com.eisenscript.xml.loader;

import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records prediction diagnostics instead of reporting them as syntax errors.
 *
 * <p>{@link DiagnosticErrorListener} reports through {@link Parser#notifyErrorListeners(String)},
 * which would reach {@link ThrowingErrorListener} and abort a valid script. The messages are
 * captured through {@link DebugFlags} instead.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        String decision = getDecisionDescription(recognizer, dfa);
        BitSet conflicting = getConflictingAlts(ambigAlts, configs);
        DebugFlags.captureDiagnostic(
                String.format(
                        "ambiguity in %s: alternatives %s, input '%s'",
                        decision,
                        conflicting,
                        inputText(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "full-context prediction in %s, input '%s'",
                        getDecisionDescription(recognizer, dfa),
                        inputText(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "context sensitivity in %s, input '%s'",
                        getDecisionDescription(recognizer, dfa),
                        inputText(recognizer, startIndex, stopIndex)));
    }

    private static String inputText(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
    }
}
