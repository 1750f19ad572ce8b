package com.ramlang.script.error;

/** Generic malformed construct: short lines, bad headers, unbalanced parentheses. */
public final class RamSyntaxException extends RamException {

    public RamSyntaxException(String detail) {
        this(null, 0, detail, null);
    }

    public RamSyntaxException(String line, int lineNumber, String detail) {
        this(line, lineNumber, detail, null);
    }

    public RamSyntaxException(String line, int lineNumber, String detail, Throwable cause) {
        super(line, lineNumber, detail, cause);
    }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamSyntaxException(line, lineNumber, getDetail(), getCause());
    }
}
