package com.ramlang.debug;

/** Pluggable debug output target (stderr, file, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
