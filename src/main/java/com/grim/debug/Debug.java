package com.grim.debug;

/**
 * Process-wide log hub for the interpreter, the facade and the CLI.
 *
 * Messages go to a single {@link DebugSink}. Until a host installs one the hub
 * drops everything, so embedding the library prints nothing by default.
 */
public final class Debug {

    // Must be initialised before HUB: the constructor reads it.
    private static final DebugSink SILENT = (level, tag, message, error) -> { };

    private static final Debug HUB = new Debug();

    private volatile DebugSink sink;

    private Debug() {
        this.sink = SILENT;
    }

    public static Debug get() {
        return HUB;
    }

    /** Installs {@code sink}; null restores the silent default. */
    public void setSink(DebugSink sink) {
        this.sink = (sink == null) ? SILENT : sink;
    }

    public DebugSink getSink() {
        return sink;
    }

    public boolean isSilent() {
        return sink == SILENT;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sink.log(level, tag, message, error);
    }
}
