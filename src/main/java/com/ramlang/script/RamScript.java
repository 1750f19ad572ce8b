package com.ramlang.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ramlang.debug.Debug;
import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamFileException;
import com.ramlang.script.error.RamGeneralException;
import com.ramlang.script.parser.Parser;
import com.ramlang.script.parser.SourceText;

/**
 * Ram parsing engine.
 *
 * - Line-oriented statements: set / reset / display / call / send back
 * - Brace-delimited blocks: loop, new function, if / else if / else
 * - Comment lines start with '%' (configurable); blank lines are ignored
 * - Mode:
 *     - STRICT (default): stray '}' and one-line "header { }" blocks are errors
 *     - LENIENT: stray '}' is skipped, one-line blocks get an empty body
 *
 * Every failure surfaces as a {@link RamException}; anything else is wrapped
 * in {@link RamGeneralException}.
 */
public class RamScript {

    /** Block handling mode. Default STRICT. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    private static final String TAG = "ram.parser";

    private Mode mode = Mode.STRICT;
    private int maxNestingDepth = 64;
    private String commentPrefix = "%";

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }

    public Mode getMode() { return mode; }

    public void setMaxNestingDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("depth must be positive");
        this.maxNestingDepth = depth;
    }

    public int getMaxNestingDepth() { return maxNestingDepth; }

    public void setCommentPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) throw new IllegalArgumentException("prefix is empty");
        this.commentPrefix = prefix;
    }

    public String getCommentPrefix() { return commentPrefix; }

    /** Parses a whole source text. */
    public RamModule parse(String source) {
        return guarded(() -> parseLines(prepare(source.split("\\R", -1))));
    }

    /** Reads and parses a UTF-8 source file. */
    public RamModule parseFile(Path path) {
        List<String> raw;
        try {
            raw = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new RamFileException(path.toString(), e);
        } catch (IOException e) {
            throw new RamGeneralException(null, 0, "Failed to read " + path + ": " + e.getMessage(), e);
        }
        Debug.get().i(TAG, "Loaded " + path + " (" + raw.size() + " lines)");
        return guarded(() -> parseLines(prepare(raw.toArray(new String[0]))));
    }

    /** Parses lines that are already trimmed and free of blanks and comments. */
    public RamModule parseLines(List<SourceText> lines) {
        return guarded(() -> new RamModule(new Parser(mode == Mode.LENIENT, maxNestingDepth).parse(lines)));
    }

    /** Numbers lines from 1, trims them, and drops blank and comment lines. */
    List<SourceText> prepare(String[] rawLines) {
        List<SourceText> lines = new ArrayList<>();
        for (int i = 0; i < rawLines.length; i++) {
            String text = rawLines[i].trim();
            if (text.isEmpty() || text.startsWith(commentPrefix)) continue;
            lines.add(new SourceText(text, i + 1));
        }
        return lines;
    }

    private interface ParseStep {
        RamModule run();
    }

    private static RamModule guarded(ParseStep step) {
        try {
            return step.run();
        } catch (RamException e) {
            throw e;
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Unexpected parser failure", e);
            throw new RamGeneralException(null, 0, String.valueOf(e.getMessage()), e);
        } catch (StackOverflowError e) {
            Debug.get().e(TAG, "Parser recursion overflowed", e);
            throw new RamGeneralException(null, 0, "Source is nested too deeply to parse.", e);
        }
    }
}
