package com.ramlang.script.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.ramlang.script.RamModule;
import com.ramlang.script.error.RamGeneralException;
import com.ramlang.script.parser.Expr;
import com.ramlang.script.parser.Expr.ExprInterface;
import com.ramlang.script.parser.Statement;
import com.ramlang.script.parser.Statement.Stmt;

import java.util.List;

/**
 * Renders the AST as a Jackson tree. Each node is an object whose "node"
 * field names its kind.
 */
public final class AstJsonWriter implements Statement.StmtVisitor<ObjectNode>, Expr.ExprVisitor<ObjectNode> {

    private static final ObjectMapper om = new ObjectMapper();

    public ArrayNode write(RamModule module) {
        return statements(module.statements());
    }

    public ObjectNode write(Stmt stmt) {
        return stmt.accept(this);
    }

    public ObjectNode write(ExprInterface expr) {
        return expr.accept(this);
    }

    public String toJson(RamModule module, boolean pretty) {
        try {
            if (pretty) {
                return om.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(write(module));
            }
            return om.writeValueAsString(write(module));
        } catch (JsonProcessingException e) {
            throw new RamGeneralException(null, 0, "Failed to render AST: " + e.getOriginalMessage(), e);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public ObjectNode visitDisplayStmt(Statement.Display stmt) {
        ObjectNode n = node("Display");
        n.set("value", write(stmt.value));
        return n;
    }

    @Override
    public ObjectNode visitAssignStmt(Statement.Assign stmt) {
        ObjectNode n = node("Assign");
        n.put("name", stmt.name);
        if (stmt.declaredType == null) n.putNull("type");
        else n.put("type", stmt.declaredType.keyword());
        n.put("reset", stmt.reset);
        n.set("value", write(stmt.value));
        return n;
    }

    @Override
    public ObjectNode visitCallStmt(Statement.CallStmt stmt) {
        ObjectNode n = node("CallStmt");
        n.set("call", write(stmt.call));
        return n;
    }

    @Override
    public ObjectNode visitReturnStmt(Statement.ReturnStmt stmt) {
        ObjectNode n = node("Return");
        n.set("value", write(stmt.value));
        return n;
    }

    @Override
    public ObjectNode visitLoopStmt(Statement.Loop stmt) {
        ObjectNode n = node("Loop");
        n.put("variable", stmt.variable);
        n.set("start", write(stmt.start));
        n.set("stop", write(stmt.stop));
        n.set("body", statements(stmt.body));
        return n;
    }

    @Override
    public ObjectNode visitFunctionStmt(Statement.FunctionStmt stmt) {
        ObjectNode n = node("Function");
        n.put("name", stmt.name);
        ArrayNode params = n.putArray("params");
        for (String p : stmt.params) params.add(p);
        n.set("body", statements(stmt.body));
        n.set("returns", write(stmt.returnValue));
        return n;
    }

    @Override
    public ObjectNode visitIfStmt(Statement.If stmt) {
        ObjectNode n = node("If");
        ArrayNode branches = n.putArray("branches");
        for (Statement.Branch b : stmt.branches) {
            ObjectNode branch = branches.addObject();
            branch.set("condition", write(b.condition));
            branch.set("body", statements(b.body));
        }
        n.set("else", statements(stmt.elseBody));
        return n;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public ObjectNode visitLiteralExpr(Expr.Literal expr) {
        ObjectNode n = node("Literal");
        Object v = expr.value;
        if (v instanceof Double) n.put("value", (Double) v);
        else if (v instanceof Boolean) n.put("value", (Boolean) v);
        else n.put("value", String.valueOf(v));
        return n;
    }

    @Override
    public ObjectNode visitVariableExpr(Expr.Variable expr) {
        ObjectNode n = node("Variable");
        n.put("name", expr.name);
        return n;
    }

    @Override
    public ObjectNode visitUnaryExpr(Expr.Unary expr) {
        ObjectNode n = node("Unary");
        n.put("op", expr.operator.symbol());
        n.set("operand", write(expr.operand));
        return n;
    }

    @Override
    public ObjectNode visitBinaryExpr(Expr.Binary expr) {
        ObjectNode n = node("Binary");
        n.put("op", expr.operator.symbol());
        n.set("left", write(expr.left));
        n.set("right", write(expr.right));
        return n;
    }

    @Override
    public ObjectNode visitCallExpr(Expr.Call expr) {
        ObjectNode n = node("Call");
        n.put("name", expr.name);
        ArrayNode args = n.putArray("args");
        for (ExprInterface a : expr.arguments) args.add(write(a));
        return n;
    }

    @Override
    public ObjectNode visitEmptyExpr(Expr.Empty expr) {
        return node("Empty");
    }

    private ArrayNode statements(List<Stmt> body) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : body) arr.add(write(s));
        return arr;
    }

    private static ObjectNode node(String kind) {
        ObjectNode n = om.createObjectNode();
        n.put("node", kind);
        return n;
    }
}
