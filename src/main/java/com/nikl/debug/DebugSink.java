package com.nikl.debug;

import java.io.PrintStream;

/** Destination for records that pass the {@link Debug} threshold. */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /** One line per record, {@code [LEVEL] tag: message}, with the stack trace after it when present. */
    static DebugSink printing(PrintStream out) {
        return (level, tag, message, error) -> {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }
}
