package com.ramlang.script.parser;

/** One trimmed physical line and its 1-based line number. */
public final class SourceText {
    public final String text;
    public final int number;

    public SourceText(String text, int number) {
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
        this.number = number;
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
