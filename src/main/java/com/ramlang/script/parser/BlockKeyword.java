package com.ramlang.script.parser;

/** Opening keyword of a block header. */
public enum BlockKeyword {
    LOOP("loop"),
    FUNCTION("new"),
    IF("if");

    private final String word;

    BlockKeyword(String word) {
        this.word = word;
    }

    public static BlockKeyword fromWord(String word) {
        for (BlockKeyword k : values()) {
            if (k.word.equals(word)) return k;
        }
        return null;
    }
}
