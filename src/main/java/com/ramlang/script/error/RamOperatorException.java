package com.ramlang.script.error;

/** Unrecognized operator, or an operator where an operand belongs (and the reverse). */
public final class RamOperatorException extends RamException {

    private final String operator;

    public RamOperatorException(String operator) {
        this(null, 0, operator, null);
    }

    public RamOperatorException(String line, int lineNumber, String operator) {
        this(line, lineNumber, operator, null);
    }

    private RamOperatorException(String line, int lineNumber, String operator, Throwable cause) {
        super(line, lineNumber, "Operator '" + operator + "' invalid.", cause);
        this.operator = operator;
    }

    public String getOperator() { return operator; }

    @Override
    protected RamException copyAt(String line, int lineNumber) {
        return new RamOperatorException(line, lineNumber, operator, getCause());
    }
}
