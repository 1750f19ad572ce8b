package com.ramlang.script;

import java.util.ArrayList;
import java.util.List;

import com.ramlang.script.parser.Statement.Stmt;
import com.ramlang.script.parser.Statement.StmtVisitor;

/** Ordered top-level statements of one parsed source, ready for an evaluator. */
public final class RamModule {
    private final List<Stmt> statements;

    public RamModule(List<Stmt> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Stmt> statements() { return statements; }

    public int size() { return statements.size(); }

    /** Visits every top-level statement in order and collects the results. */
    public <R> List<R> accept(StmtVisitor<R> visitor) {
        List<R> results = new ArrayList<>(statements.size());
        for (Stmt s : statements) {
            results.add(s.accept(visitor));
        }
        return results;
    }
}
