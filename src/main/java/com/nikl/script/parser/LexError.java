package com.nikl.script.parser;

public class LexError extends NiklException {
    private static final long serialVersionUID = 1L;

    public enum Kind { UNEXPECTED_CHARACTER, UNTERMINATED_STRING, INVALID_NUMBER }

    public final Kind kind;
    /** Offending character or number text; empty for unterminated strings. */
    public final String text;
    public final int line;
    public final int column;

    LexError(Kind kind, String text, int line, int column) {
        super(describe(kind, text, line, column));
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    private static String describe(Kind kind, String text, int line, int column) {
        String where = " at line " + line + ", column " + column;
        switch (kind) {
            case UNEXPECTED_CHARACTER:
                return "Unexpected character '" + text + "'" + where;
            case UNTERMINATED_STRING:
                return "Unterminated string starting" + where;
            default:
                return "Invalid number '" + text + "'" + where;
        }
    }
}
