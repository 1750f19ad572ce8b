package com.ramlang.script.parser;

public enum TokenType {
    // Literals and names
    NUMBER, TEXT, IDENTIFIER, TRUE, FALSE,

    // Operators
    PLUS, MINUS, STAR, SLASH, NOT, AND, OR, IS,

    // Structure
    LEFT_PAREN, RIGHT_PAREN, COMMA
}
