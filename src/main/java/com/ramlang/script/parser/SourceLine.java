package com.ramlang.script.parser;

import java.util.List;

/**
 * A classified statement line: the leading words kept verbatim
 * (keyword first) and the tokenized expression that follows them.
 */
public final class SourceLine {
    public final String text;
    public final int number;
    public final LineKeyword keyword;
    public final List<String> words;
    public final List<Token> expression;

    SourceLine(String text, int number, LineKeyword keyword, List<String> words, List<Token> expression) {
        this.text = text;
        this.number = number;
        this.keyword = keyword;
        this.words = List.copyOf(words);
        this.expression = List.copyOf(expression);
    }

    public boolean hasExpression() { return !expression.isEmpty(); }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
