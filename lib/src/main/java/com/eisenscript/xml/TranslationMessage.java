package com.eisenscript.xml;

/** A diagnostic produced while translating one EisenScript file. */
public final class TranslationMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public TranslationMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    /** 1-based line the message refers to, 0 when it concerns the whole file. */
    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        return level + " " + sourceFilename + ":" + sourceLineno + " " + message;
    }
}
