package com.nikl.script.parser;

/**
 * Fatal error raised while executing a program. It unwinds every enclosing
 * loop, branch and call up to the host caller; scripts cannot catch it.
 */
public class RuntimeError extends NiklException {
    private static final long serialVersionUID = 1L;

    public RuntimeError(String message) {
        super(message);
    }

    public RuntimeError(String message, Throwable cause) {
        super(message, cause);
    }
}
