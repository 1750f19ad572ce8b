package com.ramlang.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    public boolean is(TokenType other) { return type == other; }

    /** True for bare words such as "to" or "with" that headers match by spelling. */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && lexeme.equals(word);
    }

    @Override
    public String toString() { return lexeme; }
}
