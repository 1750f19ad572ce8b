package com.ramlang.script.error;

/**
 * Base of the Ram error taxonomy.
 *
 * An error is either located (raw line text plus 1-based line number) or not yet located.
 * Parsing code deep in the pipeline (expressions, headers) throws unlocated errors; the
 * enclosing line or block step attaches its own location via {@link #locatedAt(String, int)}.
 * A located error is never relocated, so the innermost location survives.
 */
public abstract class RamException extends RuntimeException {

    private final String line;
    private final int lineNumber;
    private final String detail;

    protected RamException(String line, int lineNumber, String detail, Throwable cause) {
        super(render(line, lineNumber, detail), cause);
        this.line = line;
        this.lineNumber = lineNumber;
        this.detail = detail;
    }

    /** Raw text of the offending line, or null when unlocated. */
    public String getLine() { return line; }

    /** 1-based line number, or 0 when unlocated. */
    public int getLineNumber() { return lineNumber; }

    /** Human readable detail, may be null. */
    public String getDetail() { return detail; }

    public boolean isLocated() { return line != null; }

    /** Returns this error if it already has a location, otherwise a located copy of the same kind. */
    public RamException locatedAt(String line, int lineNumber) {
        if (isLocated()) return this;
        return copyAt(line, lineNumber);
    }

    protected abstract RamException copyAt(String line, int lineNumber);

    private static String render(String line, int lineNumber, String detail) {
        if (line == null) {
            return detail == null ? "" : detail;
        }
        String head = "Line " + lineNumber + ": '" + line + "'";
        return detail == null ? head : head + "\n     " + detail;
    }
}
