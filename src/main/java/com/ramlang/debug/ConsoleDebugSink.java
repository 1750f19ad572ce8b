package com.ramlang.debug;

import java.io.PrintStream;

/** Writes "[LEVEL] tag: message" lines, followed by the stack trace of any error. */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;

    public ConsoleDebugSink(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out is null");
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) {
            error.printStackTrace(out);
        }
    }
}
