package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.debug.Debug;
import com.ramlang.script.parser.Nested.Node;
import com.ramlang.script.parser.Statement.Stmt;

/**
 * Parses prepared source lines (trimmed, no blanks or comments) into
 * top-level statements. One-shot: a parser keeps no state between calls.
 */
public class Parser {
    private static final String TAG = "ram.parser";

    private final BlockNester nester;

    public Parser(boolean lenient, int maxDepth) {
        this.nester = new BlockNester(lenient, maxDepth);
    }

    public List<Stmt> parse(List<SourceText> lines) {
        Debug.get().d(TAG, "Parsing " + lines.size() + " lines");

        List<Node> nodes = nester.nest(lines);
        List<Stmt> statements = new ArrayList<>();
        for (Node node : nodes) {
            statements.add(BlockParser.parseNode(node));
        }

        Debug.get().d(TAG, "Parsed " + statements.size() + " top-level statements");
        return statements;
    }
}
