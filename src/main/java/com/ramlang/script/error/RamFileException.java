package com.ramlang.script.error;

/** Source file could not be found. */
public final class RamFileException extends RamException {

    private final String path;

    public RamFileException(String path) {
        this(null, 0, path, null);
    }

    public RamFileException(String path, Throwable cause) {
        this(null, 0, path, cause);
    }

    public RamFileException(String line, int lineNumber, String path) {
        this(line, lineNumber, path, null);
    }

    private RamFileException(String line, int lineNumber, String path, Throwable cause) {
        super(line, lineNumber, "File '" + path + "' not found.", cause);
        this.path = path;
    }

    public String getPath() { return path; }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamFileException(line, lineNumber, path, getCause());
    }
}
