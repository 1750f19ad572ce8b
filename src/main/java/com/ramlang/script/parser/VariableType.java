package com.ramlang.script.parser;

/** Declared kinds accepted by set/reset. */
public enum VariableType {
    INTEGER("integer"),
    TEXT("text");

    private final String keyword;

    VariableType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() { return keyword; }

    public static VariableType fromKeyword(String word) {
        for (VariableType t : values()) {
            if (t.keyword.equals(word)) return t;
        }
        return null;
    }
}
