package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.script.error.RamKeywordException;
import com.ramlang.script.error.RamSyntaxException;
import com.ramlang.script.parser.Expr.Binary;
import com.ramlang.script.parser.Expr.ExprInterface;

/**
 * Recursive-descent grammar for block headers (the text before "{").
 *
 * <pre>
 * loop     := "loop" "with" NAME "from" expr "to" expr
 * function := "new" "function" NAME "takes" "(" [NAME ("," NAME)*] ")"
 * if       := "if" expr ["is" expr]
 * </pre>
 *
 * A wrong structural word fails with {@link RamKeywordException} naming it;
 * a missing or extra piece fails with {@link RamSyntaxException}. Errors are unlocated.
 */
public final class HeaderParser {

    public static final class LoopHeader {
        public final String variable;
        public final ExprInterface start;
        public final ExprInterface stop;

        LoopHeader(String variable, ExprInterface start, ExprInterface stop) {
            this.variable = variable;
            this.start = start;
            this.stop = stop;
        }
    }

    public static final class FunctionHeader {
        public final String name;
        public final List<String> params;

        FunctionHeader(String name, List<String> params) {
            this.name = name;
            this.params = List.copyOf(params);
        }
    }

    private final List<Token> tokens;
    private final String what;
    private int current = 0;

    private HeaderParser(List<Token> tokens, String what) {
        this.tokens = tokens;
        this.what = what;
    }

    public static LoopHeader loop(String header, int line) {
        return new HeaderParser(Lexer.tokenize(header, line), "Loop").loopHeader();
    }

    public static FunctionHeader function(String header, int line) {
        return new HeaderParser(Lexer.tokenize(header, line), "Function").functionHeader();
    }

    public static ExprInterface condition(String header, int line) {
        return new HeaderParser(Lexer.tokenize(header, line), "If").conditionHeader();
    }

    private LoopHeader loopHeader() {
        word("loop");
        word("with");
        String variable = name();
        word("from");

        List<Token> bounds = rest();
        int to = topLevelIndex(bounds, TokenType.IDENTIFIER, "to");
        if (to < 0) {
            throw new RamSyntaxException(what + " header is missing 'to'.");
        }
        ExprInterface start = ExpressionParser.parse(bounds.subList(0, to));
        ExprInterface stop = ExpressionParser.parse(bounds.subList(to + 1, bounds.size()));
        return new LoopHeader(variable, start, stop);
    }

    private FunctionHeader functionHeader() {
        word("new");
        word("function");
        String name = name();
        word("takes");
        symbol(TokenType.LEFT_PAREN, "(");

        List<String> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(name());
            } while (match(TokenType.COMMA));
        }
        symbol(TokenType.RIGHT_PAREN, ")");

        if (!isAtEnd()) {
            throw new RamSyntaxException(what + " header cannot be parsed.");
        }
        return new FunctionHeader(name, params);
    }

    private ExprInterface conditionHeader() {
        word("if");
        List<Token> rest = rest();
        int is = topLevelIndex(rest, TokenType.IS, null);
        if (is < 0) {
            return ExpressionParser.parse(rest);
        }
        ExprInterface left = ExpressionParser.parse(rest.subList(0, is));
        ExprInterface right = ExpressionParser.parse(rest.subList(is + 1, rest.size()));
        return new Binary(left, Operator.IS, right);
    }

    private void word(String expected) {
        Token token = next();
        if (!token.isWord(expected)) {
            throw new RamKeywordException(token.lexeme);
        }
    }

    private String name() {
        Token token = next();
        if (!token.is(TokenType.IDENTIFIER)) {
            throw new RamSyntaxException("Expected a name but found '" + token.lexeme + "'.");
        }
        return token.lexeme;
    }

    private void symbol(TokenType type, String lexeme) {
        Token token = next();
        if (!token.is(type)) {
            throw new RamSyntaxException(what + " header expected '" + lexeme + "' but found '" + token.lexeme + "'.");
        }
    }

    private Token next() {
        if (isAtEnd()) {
            throw new RamSyntaxException(what + " header is incomplete.");
        }
        return tokens.get(current++);
    }

    private List<Token> rest() {
        List<Token> rest = tokens.subList(current, tokens.size());
        current = tokens.size();
        return rest;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && tokens.get(current).type == type;
    }

    private boolean isAtEnd() { return current >= tokens.size(); }

    // First token of the given type (and spelling, when given) outside parentheses.
    private static int topLevelIndex(List<Token> tokens, TokenType type, String lexeme) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(TokenType.LEFT_PAREN)) depth++;
            else if (t.is(TokenType.RIGHT_PAREN)) depth--;
            else if (depth == 0 && t.is(type) && (lexeme == null || t.lexeme.equals(lexeme))) return i;
        }
        return -1;
    }
}
