package com.ramlang.script.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Leading keywords of single-line statements. */
public enum LineKeyword {
    SET("set"),
    RESET("reset"),
    SEND("send"),
    DISPLAY("display"),
    CALL("call");

    private static final Map<String, LineKeyword> byWord;
    static {
        Map<String, LineKeyword> map = new HashMap<>();
        for (LineKeyword k : values()) map.put(k.word, k);
        byWord = Collections.unmodifiableMap(map);
    }

    private final String word;

    LineKeyword(String word) {
        this.word = word;
    }

    public String word() { return word; }

    public static LineKeyword fromWord(String word) {
        return byWord.get(word);
    }
}
