package com.ramlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamOperatorException;
import com.ramlang.script.error.RamSyntaxException;
import com.ramlang.script.parser.Expr.Binary;
import com.ramlang.script.parser.Expr.Call;
import com.ramlang.script.parser.Expr.ExprInterface;
import com.ramlang.script.parser.Expr.Literal;
import com.ramlang.script.parser.Expr.Unary;
import com.ramlang.script.parser.Expr.Variable;

/**
 * Turns a token sequence into an expression tree.
 *
 * Binary operators have no relative precedence: outside parentheses they bind
 * strictly left to right, so "1 + 2 * 3" is ((1 + 2) * 3). A parenthesized
 * group binds tighter than its surroundings. "not" applies to the operand
 * right after it. An identifier directly followed by "(" is a call.
 *
 * Errors are thrown unlocated; the caller attaches the line.
 */
public class ExpressionParser {
    /** Deepest allowed nesting of groups, calls and "not". */
    public static final int MAX_DEPTH = 256;

    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;

    public ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Parses a required expression. */
    public static ExprInterface parse(List<Token> tokens) {
        return new ExpressionParser(tokens).parse();
    }

    /** Parses an expression that may be absent; no tokens yields {@link Expr.Empty}. */
    public static ExprInterface parseOptional(List<Token> tokens) {
        if (tokens.isEmpty()) return Expr.Empty.INSTANCE;
        return parse(tokens);
    }

    public ExprInterface parse() {
        if (tokens.isEmpty()) {
            throw new RamSyntaxException("Missing expression.");
        }
        ExprInterface expr = sequence();
        if (!isAtEnd()) {
            throw unexpected(peek());
        }
        return expr;
    }

    // operand (binary-operator operand)*, folded to the left
    private ExprInterface sequence() {
        ExprInterface expr = operand();
        while (!isAtEnd()) {
            Operator op = Operator.binary(peek().type);
            if (op == null) break;
            advance();
            ExprInterface right = operand();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface operand() {
        if (isAtEnd()) {
            if (previous().is(TokenType.LEFT_PAREN)) throw new RamSyntaxException("Missing ')'.");
            // ran out right after an operator
            throw new RamOperatorException(previous().lexeme);
        }

        Token token = advance();
        switch (token.type) {
            case NUMBER:
            case TEXT:
            case TRUE:
            case FALSE:
                return new Literal(token.literal);
            case NOT: {
                descend();
                ExprInterface negated = operand();
                depth--;
                return new Unary(Operator.NOT, negated);
            }
            case LEFT_PAREN: {
                descend();
                ExprInterface inner = sequence();
                closeGroup();
                depth--;
                return inner;
            }
            case IDENTIFIER:
                if (check(TokenType.LEFT_PAREN)) {
                    advance();
                    return finishCall(token);
                }
                return new Variable(token.lexeme);
            case RIGHT_PAREN:
                throw new RamSyntaxException("Unexpected ')'.");
            case COMMA:
                throw new RamSyntaxException("Unexpected ','.");
            default:
                // binary operator where an operand belongs
                throw new RamOperatorException(token.lexeme);
        }
    }

    private ExprInterface finishCall(Token name) {
        descend();
        List<ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(sequence());
            } while (match(TokenType.COMMA));
        }
        closeGroup();
        depth--;
        return new Call(name.lexeme, arguments);
    }

    private void descend() {
        if (++depth > MAX_DEPTH) {
            throw new RamSyntaxException("Expression nested deeper than " + MAX_DEPTH + ".");
        }
    }

    private void closeGroup() {
        if (match(TokenType.RIGHT_PAREN)) return;
        if (isAtEnd()) throw new RamSyntaxException("Missing ')'.");
        throw unexpected(peek());
    }

    // Something other than an operator after a complete operand.
    private RamException unexpected(Token token) {
        if (token.is(TokenType.RIGHT_PAREN)) return new RamSyntaxException("Unmatched ')'.");
        if (token.is(TokenType.COMMA)) return new RamSyntaxException("Unexpected ','.");
        return new RamOperatorException(token.lexeme);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type == type;
    }

    private Token advance() { return tokens.get(current++); }
    private boolean isAtEnd() { return current >= tokens.size(); }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }
}
