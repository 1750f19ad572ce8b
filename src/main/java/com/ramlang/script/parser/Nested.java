package com.ramlang.script.parser;

import java.util.List;

/** Raw tree produced by {@link BlockNester} and consumed once by {@link BlockParser}. */
public class Nested {

    public interface Node {}

    /** An ordinary classified statement line. */
    public static final class LineNode implements Node {
        public final SourceLine line;
        LineNode(SourceLine line) { this.line = line; }
    }

    /** A mid-block divider such as "} else {" or "} else if x is 1 {". */
    public static final class Divider implements Node {
        public final SourceText source;
        Divider(SourceText source) { this.source = source; }
    }

    /** Opener line, children in document order, and the matching closer line. */
    public static final class BlockNode implements Node {
        public final SourceText opener;
        public final List<Node> body;
        public final SourceText closer;

        BlockNode(SourceText opener, List<Node> body, SourceText closer) {
            this.opener = opener;
            this.body = List.copyOf(body);
            this.closer = closer;
        }
    }
}
