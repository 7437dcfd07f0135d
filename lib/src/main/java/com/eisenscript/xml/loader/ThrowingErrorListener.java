package com.eisenscript.xml.loader;

import com.eisenscript.xml.loader.ast.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.RecognitionException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        String sourceName = recognizer.getInputStream() != null ? recognizer.getInputStream().getSourceName() : null;
        throw new SyntaxErrorCancellation(
                "line " + line + ":" + (charPositionInLine + 1) + " " + msg,
                new SourceLocation(sourceName, line, charPositionInLine + 1),
                e);
    }
}
