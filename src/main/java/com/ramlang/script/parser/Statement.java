package com.ramlang.script.parser;

import java.util.List;

import com.ramlang.script.parser.Expr.ExprInterface;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitDisplayStmt(Display stmt);
        R visitAssignStmt(Assign stmt);
        R visitCallStmt(CallStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitLoopStmt(Loop stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitIfStmt(If stmt);
    }

    public static final class Display implements Stmt {
        public final ExprInterface value;
        public Display(ExprInterface value) { this.value = value; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDisplayStmt(this); }
    }

    public static final class Assign implements Stmt {
        public final String name;
        public final VariableType declaredType; // null for "reset x to ..."
        public final ExprInterface value;
        public final boolean reset;

        public Assign(String name, VariableType declaredType, ExprInterface value, boolean reset) {
            this.name = name;
            this.declaredType = declaredType;
            this.value = value;
            this.reset = reset;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class CallStmt implements Stmt {
        public final Expr.Call call;
        public CallStmt(Expr.Call call) { this.call = call; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCallStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final ExprInterface value; // Expr.Empty when nothing is sent back
        public ReturnStmt(ExprInterface value) { this.value = value; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class Loop implements Stmt {
        public final String variable;
        public final ExprInterface start;
        public final ExprInterface stop;
        public final List<Stmt> body;

        public Loop(String variable, ExprInterface start, ExprInterface stop, List<Stmt> body) {
            this.variable = variable;
            this.start = start;
            this.stop = stop;
            this.body = List.copyOf(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLoopStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final String name;
        public final List<String> params;
        public final List<Stmt> body;
        public final ExprInterface returnValue;

        public FunctionStmt(String name, List<String> params, List<Stmt> body, ExprInterface returnValue) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
            this.returnValue = returnValue;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    /** One condition/body pair of an if chain. */
    public static final class Branch {
        public final ExprInterface condition;
        public final List<Stmt> body;

        public Branch(ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = List.copyOf(body);
        }
    }

    /**
     * An "else if" continuation is stored as a single nested If in elseBody,
     * so a chain is right-nested and ends in a flat else body.
     */
    public static final class If implements Stmt {
        public final List<Branch> branches;
        public final List<Stmt> elseBody;

        public If(List<Branch> branches, List<Stmt> elseBody) {
            this.branches = List.copyOf(branches);
            this.elseBody = List.copyOf(elseBody);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }
}
