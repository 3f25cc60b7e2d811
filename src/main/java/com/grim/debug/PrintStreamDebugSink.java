package com.grim.debug;

import java.io.PrintStream;

/** Writes "LEVEL tag: message" lines at or above a minimum level. */
public final class PrintStreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public PrintStreamDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minLevel.ordinal()) return;
        out.println(level + " " + tag + ": " + message);
        if (error != null) {
            error.printStackTrace(out);
        }
    }
}
