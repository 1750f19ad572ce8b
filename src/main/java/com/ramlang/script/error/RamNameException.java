package com.ramlang.script.error;

/** Reference to an undefined variable. Raised by evaluators, not by the parser. */
public final class RamNameException extends RamException {

    private final String name;

    public RamNameException(String name) {
        this(null, 0, name, null);
    }

    public RamNameException(String line, int lineNumber, String name) {
        this(line, lineNumber, name, null);
    }

    private RamNameException(String line, int lineNumber, String name, Throwable cause) {
        super(line, lineNumber, "Variable '" + name + "' not defined.", cause);
        this.name = name;
    }

    public String getName() { return name; }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamNameException(line, lineNumber, name, getCause());
    }
}
