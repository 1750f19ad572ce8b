package com.ramlang.script.error;

/** Malformed block construction: unterminated or unmatched braces, misplaced dividers. */
public final class RamBlockException extends RamException {

    public RamBlockException(String detail) {
        this(null, 0, detail, null);
    }

    public RamBlockException(String line, int lineNumber, String detail) {
        this(line, lineNumber, detail, null);
    }

    public RamBlockException(String line, int lineNumber, String detail, Throwable cause) {
        super(line, lineNumber, detail, cause);
    }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamBlockException(line, lineNumber, getDetail(), getCause());
    }
}
