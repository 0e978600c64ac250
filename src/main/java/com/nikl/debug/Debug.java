package com.nikl.debug;

/**
 * Process-wide log hub used by the lexer, interpreter, modules and runner.
 *
 * Records below the installed threshold are dropped before they reach the
 * sink. With no sink installed every call is a no-op.
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private volatile DebugSink sink;
    private volatile DebugLevel threshold = DebugLevel.WARN;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code sink} for records at or above {@code threshold}; a null sink silences the hub. */
    public void setSink(DebugSink sink, DebugLevel threshold) {
        this.threshold = threshold == null ? DebugLevel.WARN : threshold;
        this.sink = sink;
    }

    public boolean enabled(DebugLevel level) {
        return sink != null && level.ordinal() >= threshold.ordinal();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        DebugSink s = sink;
        if (s == null || level.ordinal() < threshold.ordinal()) return;
        s.log(level, tag, message, error);
    }
}
