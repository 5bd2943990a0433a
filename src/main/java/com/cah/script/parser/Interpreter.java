package com.cah.script.parser;

import java.util.List;

import com.cah.debug.Debug;
import com.cah.script.CahScript.DiagnosticReporter;
import com.cah.script.CahScript.OutputWriter;
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

/**
 * Tree-walking evaluator. Exactly one frame is current at a time; blocks
 * push a child of it and always restore it on the way out.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {

    private final Environment globals;
    private Environment env;
    private final DiagnosticReporter reporter;
    private final OutputWriter output;

    public Interpreter(Environment globals, DiagnosticReporter reporter, OutputWriter output) {
        this.globals = (globals == null) ? new Environment() : globals;
        this.env = this.globals;
        this.reporter = reporter;
        this.output = output;
    }

    public Environment globals() { return globals; }

    public Environment currentEnvironment() { return env; }

    /**
     * Runs each top-level statement in order. A runtime error aborts only the
     * statement that raised it.
     */
    public void interpret(List<Stmt> program) {
        for (Stmt stmt : program) {
            try {
                execute(stmt);
            } catch (RuntimeError e) {
                reportRuntimeError(e);
            }
        }
    }

    public void execute(Stmt stmt) { stmt.accept(this); }

    public Value evaluate(Expr.ExprInterface expr) { return expr.accept(this); }

    /** Executes {@code statements} with {@code frame} current, then restores the previous frame. */
    public void executeBlock(List<Stmt> statements, Environment frame) {
        Environment previous = this.env;
        this.env = frame;
        try {
            for (Stmt s : statements) execute(s);
        } finally {
            this.env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    public void visitExprStmt(ExprStmt stmt) { evaluate(stmt.expression); }

    public void visitPrintStmt(PrintStmt stmt) {
        Value value = evaluate(stmt.expression);
        if (output != null) output.write(value.toString());
    }

    public void visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.none() : evaluate(stmt.initializer);
        env.define(stmt.name.lexeme, value);
    }

    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt.statements, new Environment(env));
    }

    public void visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).isTruthy()) {
            execute(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            execute(stmt.elseBranch);
        }
    }

    public void visitWhileStmt(While stmt) {
        while (evaluate(stmt.condition).isTruthy()) {
            execute(stmt.body);
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value visitLiteralExpr(Literal expr) { return expr.value; }

    public Value visitGroupingExpr(Grouping expr) { return evaluate(expr.expression); }

    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (!right.isNumber()) {
                    throw typeMismatch(expr.operator, "Operand of unary '-' must be a number.");
                }
                return Value.number(-right.asNumber());
            default:
                throw typeMismatch(expr.operator, "Unsupported unary operator '" + expr.operator.lexeme + "'.");
        }
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.isString()) {
                    return Value.string(left.asString() + right);
                }
                if (left.isNumber()) {
                    if (!right.isNumber()) throw typeMismatch(op, "Cannot add " + typeName(right) + " to number.");
                    return Value.number(left.asNumber() + right.asNumber());
                }
                throw typeMismatch(op, "Operator '+' expects a string or number on the left, got " + typeName(left) + ".");
            case MINUS:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() <= right.asNumber());

            case IS:
                return Value.bool(left.equals(right));
            case NOT:
                return Value.bool(!left.equals(right));

            default:
                throw typeMismatch(op, "Unsupported binary operator '" + op.lexeme + "'.");
        }
    }

    /** Returns the deciding operand itself, not a coerced bool. */
    public Value visitLogicalExpr(Logical expr) {
        Value left = evaluate(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return evaluate(expr.right);
    }

    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name);
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = evaluate(expr.value);
        env.assign(expr.name, value);
        return value;
    }

    /** Writes old +/- 1 back to the variable and yields the new value. */
    public Value visitPostfixExpr(Postfix expr) {
        if (!(expr.target instanceof Variable)) {
            throw new RuntimeError(expr.operator, RuntimeError.Kind.INVALID_TARGET,
                    "Operand of '" + expr.operator.lexeme + "' must be a variable.");
        }
        Token name = ((Variable) expr.target).name;
        Value current = env.get(name);
        if (!current.isNumber()) {
            throw typeMismatch(expr.operator, "Operand of '" + expr.operator.lexeme + "' must be a number.");
        }
        double delta = (expr.operator.type == TokenType.PLUS_PLUS) ? 1 : -1;
        Value updated = Value.number(current.asNumber() + delta);
        env.assign(name, updated);
        return updated;
    }

    // -------------------------
    // Helpers
    // -------------------------

    public void requireNumber(Value a, Value b, Token op) {
        if (!a.isNumber() || !b.isNumber()) {
            throw typeMismatch(op, "Operator '" + op.lexeme + "' expects numbers.");
        }
    }

    private static RuntimeError typeMismatch(Token op, String message) {
        return new RuntimeError(op, RuntimeError.Kind.TYPE_MISMATCH, message);
    }

    private static String typeName(Value v) {
        return v.getType().name().toLowerCase();
    }

    private void reportRuntimeError(RuntimeError e) {
        Debug.get().w(Debug.INTERPRETER, "[line " + e.line() + "] " + e.kind + ": " + e.getMessage());
        if (reporter != null) reporter.report(e.line(), e.getMessage());
    }
}
