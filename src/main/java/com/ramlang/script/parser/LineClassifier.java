package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamKeywordException;
import com.ramlang.script.error.RamSyntaxException;

/**
 * Classifies a statement line by its first word.
 *
 * set/reset keep the words up to the first "to" (at most four), send keeps
 * "send back", display/call keep only the keyword. The rest of the line is
 * tokenized as one expression.
 */
public final class LineClassifier {

    private static final int ASSIGN_WORDS = 4;

    private LineClassifier() {}

    public static SourceLine classify(SourceText source) {
        return classify(source.text, source.number);
    }

    public static SourceLine classify(String text, int number) {
        String[] split = text.trim().split("\\s+");
        if (split.length < 2) {
            throw new RamSyntaxException(text, number, "Expected a keyword followed by its arguments.");
        }

        LineKeyword keyword = LineKeyword.fromWord(split[0]);
        if (keyword == null) {
            throw new RamKeywordException(text, number, split[0]);
        }

        int kept = leadingWordCount(keyword, split);
        List<String> words = new ArrayList<>(Arrays.asList(split).subList(0, kept));

        List<Token> expression;
        try {
            expression = Lexer.tokenize(remainderAfter(text, kept), number);
        } catch (RamException e) {
            throw e.locatedAt(text, number);
        }
        return new SourceLine(text, number, keyword, words, expression);
    }

    private static int leadingWordCount(LineKeyword keyword, String[] split) {
        switch (keyword) {
            case SET:
            case RESET: {
                int limit = Math.min(ASSIGN_WORDS, split.length);
                for (int i = 1; i < limit; i++) {
                    if (split[i].equals("to")) return i + 1;
                }
                return limit;
            }
            case SEND:
                return 2;
            case DISPLAY:
            case CALL:
                return 1;
            default:
                throw new IllegalStateException("Unhandled keyword " + keyword);
        }
    }

    // Text after the first n whitespace-separated words, spacing inside it untouched.
    static String remainderAfter(String text, int n) {
        int i = 0;
        int len = text.length();
        for (int word = 0; word < n; word++) {
            while (i < len && Character.isWhitespace(text.charAt(i))) i++;
            while (i < len && !Character.isWhitespace(text.charAt(i))) i++;
        }
        return text.substring(i).trim();
    }
}
