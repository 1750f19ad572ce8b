package com.ramlang.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide debug hub for the Ram parser and tools.
 *
 * Messages below the hub's level never reach the sink. Until a sink is
 * installed every call is a no-op. Callers building costly trace text should
 * check {@link #isEnabled(DebugLevel)} first.
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel level = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink; null restores the no-op sink and the TRACE level. */
    public void setSink(DebugSink sink) {
        if (sink == null) {
            sinkRef.set(NOOP);
            level = DebugLevel.TRACE;
        } else {
            sinkRef.set(sink);
        }
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setLevel(DebugLevel level) {
        this.level = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getLevel() { return level; }

    public boolean isEnabled(DebugLevel candidate) {
        return sinkRef.get() != NOOP && candidate.isAtLeast(level);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.isAtLeast(this.level)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
