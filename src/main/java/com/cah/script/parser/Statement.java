package com.cah.script.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public PrintStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer; // may be null
        public VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = Collections.unmodifiableList(statements); }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Block elseBranch; // may be null
        public If(Expr.ExprInterface condition, Block thenBranch, Block elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;
        public While(Expr.ExprInterface condition, Block body) {
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }
}
