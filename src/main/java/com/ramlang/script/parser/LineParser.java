package com.ramlang.script.parser;

import java.util.List;

import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamKeywordException;
import com.ramlang.script.error.RamSyntaxException;
import com.ramlang.script.parser.Expr.ExprInterface;
import com.ramlang.script.parser.Statement.Assign;
import com.ramlang.script.parser.Statement.CallStmt;
import com.ramlang.script.parser.Statement.Display;
import com.ramlang.script.parser.Statement.ReturnStmt;
import com.ramlang.script.parser.Statement.Stmt;

/** Builds the statement for one classified line. */
public final class LineParser {

    private LineParser() {}

    public static Stmt parse(SourceLine line) {
        try {
            switch (line.keyword) {
                case SET:
                    return assignment(line, false);
                case RESET:
                    return assignment(line, true);
                case DISPLAY:
                    return new Display(ExpressionParser.parse(line.expression));
                case CALL:
                    return call(line);
                case SEND:
                    return new ReturnStmt(returnValue(line));
                default:
                    throw new RamKeywordException(line.keyword.word());
            }
        } catch (RamException e) {
            throw e.locatedAt(line.text, line.number);
        }
    }

    /** Value of a "send back" line; {@link Expr.Empty} when nothing follows "back". */
    static ExprInterface returnValue(SourceLine line) {
        String back = line.words.get(1);
        if (!back.equals("back")) {
            throw new RamKeywordException(back);
        }
        return ExpressionParser.parseOptional(line.expression);
    }

    // set <type> <name> to <expr> | reset [<type>] <name> to <expr>
    private static Stmt assignment(SourceLine line, boolean reset) {
        List<String> words = line.words;
        if (words.size() < 3) {
            throw new RamSyntaxException("Incomplete assignment.");
        }

        String to = words.get(words.size() - 1);
        if (!to.equals("to")) {
            throw new RamKeywordException(to);
        }

        VariableType type = null;
        String name;
        if (words.size() == 4) {
            type = VariableType.fromKeyword(words.get(1));
            if (type == null) throw new RamKeywordException(words.get(1));
            name = words.get(2);
        } else if (reset) {
            name = words.get(1);
        } else {
            // "set" always declares a type
            throw new RamKeywordException(words.get(1));
        }

        if (!isValidName(name)) {
            throw new RamSyntaxException("Invalid variable name '" + name + "'.");
        }
        return new Assign(name, type, ExpressionParser.parse(line.expression), reset);
    }

    private static Stmt call(SourceLine line) {
        ExprInterface expr = ExpressionParser.parse(line.expression);
        if (!(expr instanceof Expr.Call)) {
            throw new RamSyntaxException("Expected a function call such as f(x).");
        }
        return new CallStmt((Expr.Call) expr);
    }

    static boolean isValidName(String name) {
        return name.matches("[A-Za-z_][A-Za-z0-9_]*") && !Lexer.isReserved(name);
    }
}
