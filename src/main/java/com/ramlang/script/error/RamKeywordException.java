package com.ramlang.script.error;

/** Unrecognized or misplaced keyword. */
public final class RamKeywordException extends RamException {

    private final String keyword;

    public RamKeywordException(String keyword) {
        this(null, 0, keyword, null);
    }

    public RamKeywordException(String line, int lineNumber, String keyword) {
        this(line, lineNumber, keyword, null);
    }

    private RamKeywordException(String line, int lineNumber, String keyword, Throwable cause) {
        super(line, lineNumber, "Keyword '" + keyword + "' invalid.", cause);
        this.keyword = keyword;
    }

    public String getKeyword() { return keyword; }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamKeywordException(line, lineNumber, keyword, getCause());
    }
}
