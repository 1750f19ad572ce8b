package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ramlang.script.error.RamOperatorException;
import com.ramlang.script.error.RamSyntaxException;

/**
 * Splits one expression substring into tokens.
 *
 * Quoted text is a single TEXT token. Parentheses and commas are emitted as
 * structural tokens and left for the expression parser. Empty input yields an
 * empty list, which callers treat as "no expression".
 */
public class Lexer {
    private final String source;
    private final int line;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("not", TokenType.NOT);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("is", TokenType.IS);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, int line) {
        this.source = (source == null) ? "" : source;
        this.line = line;
    }

    public static List<Token> tokenize(String source, int line) {
        return new Lexer(source, line).tokenize();
    }

    public static boolean isReserved(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '-':
                if (isDigit(peek()) && expectsOperand()) number();
                else addToken(TokenType.MINUS);
                break;
            case ' ': case '\r': case '\t':
                break;
            case '"':
                text();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw new RamOperatorException(String.valueOf(c));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        Object literal = null;
        if (type == TokenType.TRUE) literal = Boolean.TRUE;
        if (type == TokenType.FALSE) literal = Boolean.FALSE;
        addToken(type, literal);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void text() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) throw new RamSyntaxException("Unterminated text literal.");
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.TEXT, value);
    }

    // A leading '-' is a sign only where an operand is due.
    private boolean expectsOperand() {
        if (tokens.isEmpty()) return true;
        switch (tokens.get(tokens.size() - 1).type) {
            case NUMBER: case TEXT: case IDENTIFIER: case TRUE: case FALSE: case RIGHT_PAREN:
                return false;
            default:
                return true;
        }
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }
}
