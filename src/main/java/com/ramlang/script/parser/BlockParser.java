package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.debug.Debug;
import com.ramlang.script.error.RamBlockException;
import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamKeywordException;
import com.ramlang.script.error.RamSyntaxException;
import com.ramlang.script.parser.Expr.ExprInterface;
import com.ramlang.script.parser.Nested.BlockNode;
import com.ramlang.script.parser.Nested.Divider;
import com.ramlang.script.parser.Nested.LineNode;
import com.ramlang.script.parser.Nested.Node;
import com.ramlang.script.parser.Statement.Branch;
import com.ramlang.script.parser.Statement.FunctionStmt;
import com.ramlang.script.parser.Statement.If;
import com.ramlang.script.parser.Statement.Loop;
import com.ramlang.script.parser.Statement.Stmt;

/**
 * Turns nested blocks into loop, function and if statements.
 *
 * The header keyword picks the statement kind up front; each kind is built
 * directly from its header and body.
 */
public final class BlockParser {

    private static final String TAG = "ram.block";

    /** Most branches one if / else if chain may have. */
    public static final int MAX_CHAIN = 256;

    private BlockParser() {}

    /** Parses a top-level or nested node. */
    public static Stmt parseNode(Node node) {
        if (node instanceof LineNode) {
            return LineParser.parse(((LineNode) node).line);
        }
        if (node instanceof BlockNode) {
            return parse((BlockNode) node);
        }
        SourceText divider = ((Divider) node).source;
        throw new RamBlockException(divider.text, divider.number, "'} else' without a matching if.");
    }

    public static Stmt parse(BlockNode block) {
        SourceText opener = block.opener;
        String header = headerOf(opener.text);
        if (header.isEmpty()) {
            throw new RamBlockException(opener.text, opener.number, "Block has no header.");
        }
        String[] words = header.split("\\s+");

        BlockKeyword keyword = BlockKeyword.fromWord(words[0]);
        if (keyword == null) {
            throw new RamKeywordException(opener.text, opener.number, words[0]);
        }
        Debug.get().t(TAG, keyword + " block at line " + opener.number);

        switch (keyword) {
            case LOOP:
                return loop(block, header);
            case FUNCTION:
                return function(block, header);
            case IF:
                return ifChain(header, opener, block.body, 1);
            default:
                throw new IllegalStateException("Unhandled block keyword " + keyword);
        }
    }

    private static Loop loop(BlockNode block, String header) {
        HeaderParser.LoopHeader h;
        try {
            h = HeaderParser.loop(header, block.opener.number);
        } catch (RamException e) {
            throw e.locatedAt(block.opener.text, block.opener.number);
        }
        return new Loop(h.variable, h.start, h.stop, plainBody(block.body, "loop"));
    }

    private static FunctionStmt function(BlockNode block, String header) {
        HeaderParser.FunctionHeader h;
        try {
            h = HeaderParser.function(header, block.opener.number);
        } catch (RamException e) {
            throw e.locatedAt(block.opener.text, block.opener.number);
        }

        List<Node> body = block.body;
        ExprInterface returnValue = Expr.Empty.INSTANCE;
        if (!body.isEmpty() && isSendLine(body.get(body.size() - 1))) {
            SourceLine send = ((LineNode) body.get(body.size() - 1)).line;
            try {
                returnValue = LineParser.returnValue(send);
            } catch (RamException e) {
                throw e.locatedAt(send.text, send.number);
            }
            body = body.subList(0, body.size() - 1);
        }
        return new FunctionStmt(h.name, h.params, plainBody(body, "function"), returnValue);
    }

    /**
     * Builds an if from its header and the children that follow it, up to the
     * block's closer. A "} else if" divider turns the remaining children into a
     * nested if (the sole else statement); a "} else" divider makes them the
     * flat else body.
     */
    private static If ifChain(String header, SourceText where, List<Node> children, int branch) {
        if (branch > MAX_CHAIN) {
            throw new RamBlockException(where.text, where.number, "If chain has more than " + MAX_CHAIN + " branches.");
        }
        ExprInterface condition;
        try {
            condition = HeaderParser.condition(header, where.number);
        } catch (RamException e) {
            throw e.locatedAt(where.text, where.number);
        }

        int split = firstDivider(children, 0);
        List<Branch> branches = List.of(new Branch(condition, parseAll(children.subList(0, split))));
        if (split == children.size()) {
            return new If(branches, List.of());
        }

        SourceText divider = ((Divider) children.get(split)).source;
        List<Node> rest = children.subList(split + 1, children.size());
        String elseText = dividerText(divider);

        if (!elseText.equals("else")) {
            // "else if <cond>" continues the chain
            return new If(branches, List.of(ifChain(elseText.substring("else".length()).trim(), divider, rest, branch + 1)));
        }

        int stray = firstDivider(rest, 0);
        if (stray < rest.size()) {
            SourceText s = ((Divider) rest.get(stray)).source;
            throw new RamBlockException(s.text, s.number, "Nothing may follow a final 'else'.");
        }
        return new If(branches, parseAll(rest));
    }

    // Text between the leading '}' and trailing '{', checked to be "else" or "else if ...".
    private static String dividerText(SourceText divider) {
        String t = divider.text.trim();
        String inner = t.substring(1, t.length() - 1).trim();
        String[] words = inner.split("\\s+");
        if (inner.isEmpty()) {
            throw new RamSyntaxException(divider.text, divider.number, "Expected 'else' after '}'.");
        }
        if (!words[0].equals("else")) {
            throw new RamKeywordException(divider.text, divider.number, words[0]);
        }
        if (words.length > 1 && !words[1].equals("if")) {
            throw new RamKeywordException(divider.text, divider.number, words[1]);
        }
        return inner;
    }

    private static List<Stmt> plainBody(List<Node> children, String kind) {
        int d = firstDivider(children, 0);
        if (d < children.size()) {
            SourceText s = ((Divider) children.get(d)).source;
            throw new RamBlockException(s.text, s.number, "'} else' is not allowed inside a " + kind + ".");
        }
        return parseAll(children);
    }

    private static List<Stmt> parseAll(List<Node> children) {
        List<Stmt> out = new ArrayList<>();
        for (Node child : children) {
            out.add(parseNode(child));
        }
        return out;
    }

    private static int firstDivider(List<Node> children, int from) {
        for (int i = from; i < children.size(); i++) {
            if (children.get(i) instanceof Divider) return i;
        }
        return children.size();
    }

    private static boolean isSendLine(Node node) {
        return node instanceof LineNode && ((LineNode) node).line.keyword == LineKeyword.SEND;
    }

    private static String headerOf(String opener) {
        int brace = BlockNester.braceIndex(opener, '{');
        return (brace < 0 ? opener : opener.substring(0, brace)).trim();
    }
}
