package com.ramlang.script.parser;

public enum Operator {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    NOT("not"),
    AND("and"),
    OR("or"),
    IS("is");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    /** Binary operator for a token, or null when the token is not one. */
    static Operator binary(TokenType type) {
        switch (type) {
            case PLUS: return PLUS;
            case MINUS: return MINUS;
            case STAR: return STAR;
            case SLASH: return SLASH;
            case AND: return AND;
            case OR: return OR;
            case IS: return IS;
            default: return null;
        }
    }
}
