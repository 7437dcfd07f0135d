package com.eisenscript.xml.loader;

import com.eisenscript.xml.loader.ast.SourceLocation;

/** Raised when source text does not match the EisenScript grammar. */
public final class EisenScriptParseException extends Exception {
    private final SourceLocation location;

    public EisenScriptParseException(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /** Position of the offending input, or {@code null} when the failure has none. */
    public SourceLocation getLocation() {
        return location;
    }
}
