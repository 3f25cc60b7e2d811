package com.grim.script.parser;

/** Source text (or a serialized tree) that does not describe a well-formed program. */
public class ParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseException(int line, String message) {
        super(line > 0 ? "[line " + line + "] " + message : message);
        this.line = line;
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    /** 1-based source line, or 0 when unknown. */
    public int getLine() {
        return line;
    }
}
