package com.cah.script.parser;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitGroupingExpr(Grouping expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitPostfixExpr(Postfix expr);
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Grouping implements ExprInterface {
        public final ExprInterface expression;

        public Grouping(ExprInterface expression) {
            this.expression = expression;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** {@code and} / {@code or}; the right side is only evaluated when needed. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    /** {@code x++} / {@code x--}. The target is checked at run time, not here. */
    public static final class Postfix implements ExprInterface {
        public final ExprInterface target;
        public final Token operator;

        public Postfix(ExprInterface target, Token operator) {
            this.target = target;
            this.operator = operator;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPostfixExpr(this);
        }
    }
}
