package com.eisenscript.xml.loader;

import com.eisenscript.xml.loader.ast.SourceLocation;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Unwinds the ANTLR recognizers on the first error while keeping the failing position. */
final class SyntaxErrorCancellation extends ParseCancellationException {
    private final SourceLocation location;

    SyntaxErrorCancellation(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    SourceLocation getLocation() {
        return location;
    }
}
