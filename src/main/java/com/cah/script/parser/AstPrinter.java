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

/** Lisp-style dump of a parsed program: {@code (+ 1 (* 2 3))}. */
public class AstPrinter implements ExprVisitor<String>, StmtVisitor {

    private final StringBuilder out = new StringBuilder();

    public static String print(Expr.ExprInterface expr) {
        return expr.accept(new AstPrinter());
    }

    public static String print(Stmt stmt) {
        AstPrinter printer = new AstPrinter();
        stmt.accept(printer);
        return printer.out.toString();
    }

    /** One line per top-level statement. */
    public static String print(List<Stmt> program) {
        StringBuilder sb = new StringBuilder();
        for (Stmt stmt : program) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(print(stmt));
        }
        return sb.toString();
    }

    private String parenthesize(String name, Expr.ExprInterface... exprs) {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(name);
        for (Expr.ExprInterface expr : exprs) {
            sb.append(' ').append(expr.accept(this));
        }
        return sb.append(')').toString();
    }

    private String body(String head, List<Stmt> statements) {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(head);
        for (Stmt s : statements) sb.append(' ').append(print(s));
        return sb.append(')').toString();
    }

    // -------------------------
    // Statements
    // -------------------------

    public void visitExprStmt(ExprStmt stmt) { out.append(stmt.expression.accept(this)); }

    public void visitPrintStmt(PrintStmt stmt) { out.append(parenthesize("print", stmt.expression)); }

    public void visitVarStmt(VarStmt stmt) {
        if (stmt.initializer == null) {
            out.append("(var ").append(stmt.name.lexeme).append(')');
        } else {
            out.append(parenthesize("var " + stmt.name.lexeme, stmt.initializer));
        }
    }

    public void visitBlockStmt(Block stmt) { out.append(body("block", stmt.statements)); }

    public void visitIfStmt(If stmt) {
        out.append("(if ").append(stmt.condition.accept(this))
           .append(' ').append(print(stmt.thenBranch));
        if (stmt.elseBranch != null) out.append(' ').append(print(stmt.elseBranch));
        out.append(')');
    }

    public void visitWhileStmt(While stmt) {
        out.append("(while ").append(stmt.condition.accept(this))
           .append(' ').append(print(stmt.body)).append(')');
    }

    // -------------------------
    // Expressions
    // -------------------------

    public String visitLiteralExpr(Literal expr) { return expr.value.debugString(); }

    public String visitGroupingExpr(Grouping expr) { return parenthesize("group", expr.expression); }

    public String visitUnaryExpr(Unary expr) { return parenthesize(expr.operator.lexeme, expr.right); }

    public String visitBinaryExpr(Binary expr) { return parenthesize(expr.operator.lexeme, expr.left, expr.right); }

    public String visitLogicalExpr(Logical expr) { return parenthesize(expr.operator.lexeme, expr.left, expr.right); }

    public String visitVariableExpr(Variable expr) { return expr.name.lexeme; }

    public String visitAssignExpr(Assign expr) { return parenthesize("= " + expr.name.lexeme, expr.value); }

    public String visitPostfixExpr(Postfix expr) { return parenthesize("postfix " + expr.operator.lexeme, expr.target); }
}
