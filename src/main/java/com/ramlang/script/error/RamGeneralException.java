package com.ramlang.script.error;

/** Wrapper for any failure outside the taxonomy. Keeps the underlying message. */
public final class RamGeneralException extends RamException {

    public RamGeneralException(String detail) {
        this(null, 0, detail, null);
    }

    public RamGeneralException(String line, int lineNumber, String detail) {
        this(line, lineNumber, detail, null);
    }

    public RamGeneralException(String line, int lineNumber, String detail, Throwable cause) {
        super(line, lineNumber, detail, cause);
    }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamGeneralException(line, lineNumber, getDetail(), getCause());
    }
}
