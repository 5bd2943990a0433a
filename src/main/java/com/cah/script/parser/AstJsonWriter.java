package com.cah.script.parser;

import java.util.List;

import com.cah.script.parser.Expr.Assign;
import com.cah.script.parser.Expr.Binary;
import com.cah.script.parser.Expr.ExprVisitor;
import com.cah.script.parser.Expr.Grouping;
import com.cah.script.parser.Expr.Literal;
import com.cah.script.parser.Expr.Logical;
import com.cah.script.parser.Expr.Postfix;
import com.cah.script.parser.Expr.Unary;
import com.cah.script.parser.Expr.Variable;
import com.cah.script.parser.Statement.Block;
import com.cah.script.parser.Statement.ExprStmt;
import com.cah.script.parser.Statement.If;
import com.cah.script.parser.Statement.PrintStmt;
import com.cah.script.parser.Statement.Stmt;
import com.cah.script.parser.Statement.StmtVisitor;
import com.cah.script.parser.Statement.VarStmt;
import com.cah.script.parser.Statement.While;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON view of tokens and parsed programs. Every node is an object with a
 * {@code "node"} discriminator; statements also carry their line when one is known.
 */
public final class AstJsonWriter implements ExprVisitor<JsonNode>, StmtVisitor {

    private static final ObjectMapper om = new ObjectMapper();

    // result slot for the void statement visitor
    private ObjectNode lastStmt;

    public static ArrayNode toJson(List<Stmt> program) {
        AstJsonWriter w = new AstJsonWriter();
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : program) arr.add(w.stmt(s));
        return arr;
    }

    public static JsonNode toJson(Expr.ExprInterface expr) {
        return expr.accept(new AstJsonWriter());
    }

    public static ArrayNode tokensToJson(List<Token> tokens) {
        ArrayNode arr = om.createArrayNode();
        for (Token t : tokens) {
            ObjectNode n = om.createObjectNode();
            n.put("type", t.type.name());
            n.put("lexeme", t.lexeme);
            if (t.literal != null) n.set("literal", valueToJson(t.literal));
            n.put("line", t.line);
            arr.add(n);
        }
        return arr;
    }

    public static String pretty(JsonNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON", e);
        }
    }

    static JsonNode valueToJson(Value v) {
        switch (v.getType()) {
            case NUMBER: return om.getNodeFactory().numberNode(v.asNumber());
            case BOOL:   return om.getNodeFactory().booleanNode(v.asBool());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            default:     return om.getNodeFactory().nullNode();
        }
    }

    private ObjectNode node(String kind) {
        ObjectNode n = om.createObjectNode();
        n.put("node", kind);
        return n;
    }

    private ObjectNode stmt(Stmt s) {
        s.accept(this);
        return lastStmt;
    }

    private ArrayNode stmts(List<Stmt> list) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : list) arr.add(stmt(s));
        return arr;
    }

    // -------------------------
    // Statements
    // -------------------------

    public void visitExprStmt(ExprStmt s) {
        ObjectNode n = node("expression");
        n.set("expression", s.expression.accept(this));
        lastStmt = n;
    }

    public void visitPrintStmt(PrintStmt s) {
        ObjectNode n = node("print");
        n.set("expression", s.expression.accept(this));
        lastStmt = n;
    }

    public void visitVarStmt(VarStmt s) {
        ObjectNode n = node("var");
        n.put("name", s.name.lexeme);
        n.put("line", s.name.line);
        if (s.initializer != null) n.set("initializer", s.initializer.accept(this));
        lastStmt = n;
    }

    public void visitBlockStmt(Block s) {
        ObjectNode n = node("block");
        n.set("statements", stmts(s.statements));
        lastStmt = n;
    }

    public void visitIfStmt(If s) {
        ObjectNode n = node("if");
        n.set("condition", s.condition.accept(this));
        n.set("then", stmt(s.thenBranch));
        if (s.elseBranch != null) n.set("else", stmt(s.elseBranch));
        lastStmt = n;
    }

    public void visitWhileStmt(While s) {
        ObjectNode n = node("while");
        n.set("condition", s.condition.accept(this));
        n.set("body", stmt(s.body));
        lastStmt = n;
    }

    // -------------------------
    // Expressions
    // -------------------------

    public JsonNode visitLiteralExpr(Literal e) {
        ObjectNode n = node("literal");
        n.put("type", e.value.getType().name().toLowerCase());
        n.set("value", valueToJson(e.value));
        return n;
    }

    public JsonNode visitGroupingExpr(Grouping e) {
        ObjectNode n = node("grouping");
        n.set("expression", e.expression.accept(this));
        return n;
    }

    public JsonNode visitUnaryExpr(Unary e) {
        ObjectNode n = node("unary");
        n.put("operator", e.operator.lexeme);
        n.set("right", e.right.accept(this));
        return n;
    }

    public JsonNode visitBinaryExpr(Binary e) {
        ObjectNode n = node("binary");
        n.put("operator", e.operator.lexeme);
        n.set("left", e.left.accept(this));
        n.set("right", e.right.accept(this));
        return n;
    }

    public JsonNode visitLogicalExpr(Logical e) {
        ObjectNode n = node("logical");
        n.put("operator", e.operator.lexeme);
        n.set("left", e.left.accept(this));
        n.set("right", e.right.accept(this));
        return n;
    }

    public JsonNode visitVariableExpr(Variable e) {
        ObjectNode n = node("variable");
        n.put("name", e.name.lexeme);
        return n;
    }

    public JsonNode visitAssignExpr(Assign e) {
        ObjectNode n = node("assign");
        n.put("name", e.name.lexeme);
        n.set("value", e.value.accept(this));
        return n;
    }

    public JsonNode visitPostfixExpr(Postfix e) {
        ObjectNode n = node("postfix");
        n.put("operator", e.operator.lexeme);
        n.set("target", e.target.accept(this));
        return n;
    }
}
