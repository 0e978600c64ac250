package com.nikl.script.parser;

/** Base type of every failure surfaced by the lexer, parser or interpreter. */
public class NiklException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public NiklException(String message) {
        super(message);
    }

    public NiklException(String message, Throwable cause) {
        super(message, cause);
    }
}
