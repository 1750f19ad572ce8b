package com.ramlang.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean isAtLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
