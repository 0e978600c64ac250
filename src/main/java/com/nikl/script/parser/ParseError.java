package com.nikl.script.parser;

public class ParseError extends NiklException {
    private static final long serialVersionUID = 1L;

    public final Token token;

    ParseError(Token token, String message) {
        super(message + " Found " + token + " at line " + token.line + ", column " + token.column);
        this.token = token;
    }
}
