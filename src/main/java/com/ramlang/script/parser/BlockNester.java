package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.debug.Debug;
import com.ramlang.debug.DebugLevel;
import com.ramlang.script.error.RamBlockException;
import com.ramlang.script.parser.Nested.BlockNode;
import com.ramlang.script.parser.Nested.Divider;
import com.ramlang.script.parser.Nested.LineNode;
import com.ramlang.script.parser.Nested.Node;

/**
 * Groups a flat line list into lines and brace-delimited blocks.
 *
 * Depth comes from braces only, never from indentation. Each recursive scan
 * returns the index to resume from, so no line is visited twice.
 * Braces inside quoted text are ignored.
 */
public final class BlockNester {

    private static final String TAG = "ram.nester";

    private final boolean lenient;
    private final int maxDepth;

    public BlockNester(boolean lenient, int maxDepth) {
        this.lenient = lenient;
        this.maxDepth = maxDepth;
    }

    public List<Node> nest(List<SourceText> lines) {
        Level top = scan(lines, 0, 0);
        return top.children;
    }

    /** Result of one level's scan: its children, where to resume, and the closer (null at end of input). */
    private static final class Level {
        final List<Node> children;
        final int next;
        final SourceText closer;

        Level(List<Node> children, int next, SourceText closer) {
            this.children = children;
            this.next = next;
            this.closer = closer;
        }
    }

    private Level scan(List<SourceText> lines, int start, int depth) {
        List<Node> children = new ArrayList<>();
        int i = start;

        while (i < lines.size()) {
            SourceText line = lines.get(i);
            boolean opens = braceIndex(line.text, '{') >= 0;
            boolean closes = braceIndex(line.text, '}') >= 0;

            if (opens && closes) {
                if (isDivider(line.text)) {
                    if (depth == 0) {
                        throw new RamBlockException(line.text, line.number, "'}' without an open block.");
                    }
                    children.add(new Divider(line));
                } else if (lenient) {
                    Debug.get().w(TAG, "Line " + line.number + ": one-line block parsed with an empty body");
                    children.add(new BlockNode(line, List.of(), line));
                } else {
                    throw new RamBlockException(line.text, line.number, "Block opened and closed on the same line.");
                }
                i++;
            } else if (opens) {
                if (depth + 1 > maxDepth) {
                    throw new RamBlockException(line.text, line.number, "Blocks nested deeper than " + maxDepth + ".");
                }
                if (Debug.get().isEnabled(DebugLevel.TRACE)) {
                    Debug.get().t(TAG, "open block at line " + line.number + " (depth " + (depth + 1) + ")");
                }
                Level child = scan(lines, i + 1, depth + 1);
                if (child.closer == null) {
                    throw new RamBlockException(line.text, line.number, "Block is never closed.");
                }
                children.add(new BlockNode(line, child.children, child.closer));
                i = child.next;
            } else if (closes) {
                if (depth > 0) {
                    if (!line.text.trim().equals("}")) {
                        if (!lenient) {
                            throw new RamBlockException(line.text, line.number, "'}' must stand alone on its line.");
                        }
                        Debug.get().w(TAG, "Line " + line.number + ": ignoring text around '}'");
                    }
                    Debug.get().t(TAG, "close block at line " + line.number);
                    return new Level(children, i + 1, line);
                }
                if (!lenient) {
                    throw new RamBlockException(line.text, line.number, "'}' without an open block.");
                }
                Debug.get().w(TAG, "Line " + line.number + ": skipping unmatched '}'");
                i++;
            } else {
                children.add(new LineNode(LineClassifier.classify(line)));
                i++;
            }
        }
        return new Level(children, i, null);
    }

    static boolean isDivider(String text) {
        String t = text.trim();
        return t.startsWith("}") && t.endsWith("{");
    }

    /** Index of the first brace outside quoted text, or -1. */
    static int braceIndex(String text, char brace) {
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (c == brace && !quoted) return i;
        }
        return -1;
    }
}
