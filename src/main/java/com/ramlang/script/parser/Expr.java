package com.ramlang.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitCallExpr(Call expr);
        R visitEmptyExpr(Empty expr);
    }

    /** Number (Double), text (String) or boolean (Boolean). */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Operator operator;
        public final ExprInterface operand;

        public Unary(Operator operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Operator operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Operator operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final String name;
        public final List<ExprInterface> arguments;

        public Call(String name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** Absent value, e.g. a function without "send back". */
    public static final class Empty implements ExprInterface {
        public static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitEmptyExpr(this);
        }
    }
}
