package com.eisenscript.xml;

import com.eisenscript.xml.loader.EisenScriptParseException;

/**
 * Checked exception signalling that a translation could not complete: the source was unreadable,
 * did not match the grammar, or the output could not be written. Nothing is written on failure.
 */
public final class TranslationException extends Exception {
    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when the source text was rejected by the grammar rather than by the file system. */
    public boolean isGrammarError() {
        return getCause() instanceof EisenScriptParseException;
    }
}
