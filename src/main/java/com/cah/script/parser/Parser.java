package com.cah.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.cah.debug.Debug;
import com.cah.script.CahScript.DiagnosticReporter;
import com.cah.script.parser.Expr.Assign;
import com.cah.script.parser.Expr.Binary;
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
import com.cah.script.parser.Statement.VarStmt;
import com.cah.script.parser.Statement.While;

/**
 * Recursive-descent parser.
 *
 * Precedence, lowest first: assignment, and/or, is/not, comparison, + -,
 * * /, unary not/-, postfix ++/--, primary.
 *
 * {@link #parse()} never throws. A declaration that fails to parse is
 * reported, the cursor skips past the next STATEMENT_END and the declaration
 * is replaced by a {@code none} expression statement. Nesting of groups,
 * operators and blocks is capped so hostile input is reported instead of
 * overflowing the stack.
 */
public class Parser {

    private static final Set<TokenType> RESERVED = Collections.unmodifiableSet(EnumSet.of(
            TokenType.RITUAL, TokenType.END, TokenType.RETURN, TokenType.CLASS,
            TokenType.THIS, TokenType.SUPER, TokenType.FOR, TokenType.DOLLAR_GREATER
    ));

    public static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private final DiagnosticReporter reporter;
    private int current = 0;
    private int blockDepth = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens, DiagnosticReporter reporter) {
        this.tokens = tokens;
        this.reporter = reporter;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            if (match(TokenType.STATEMENT_END)) continue;
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        try {
            if (match(TokenType.OFFERING)) return varDeclaration();
            return statement();
        } catch (ParseError e) {
            synchronize();
            Debug.get().d(Debug.PARSER, "recovered after parse error, resuming at line " + peek().line);
            return new ExprStmt(new Literal(Value.none()));
        }
    }

    private Stmt varDeclaration() {
        Token name = consumeIf(TokenType.IDENTIFIER, "Expected variable name.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consumeIf(TokenType.STATEMENT_END, "Expected statement end after variable declaration.");
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.DOLLAR_LESS)) return printStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.LEFT_BRACE)) {
            Block block = new Block(block());
            consumeIf(TokenType.STATEMENT_END, "Expected statement end after block.");
            return block;
        }
        return exprStatement();
    }

    private Stmt printStatement() {
        Expr.ExprInterface value = expression();
        consumeIf(TokenType.STATEMENT_END, "Expected statement end after expression.");
        return new PrintStmt(value);
    }

    // if cond { ... } [else { ... } | else if ...]
    private Stmt ifStatement() {
        Expr.ExprInterface condition = expression();
        consumeIf(TokenType.LEFT_BRACE, "Expected '{' after if condition.");
        Block thenBranch = new Block(block());

        // else may sit on the line after the closing brace
        if (check(TokenType.STATEMENT_END) && checkNext(TokenType.ELSE)) advance();

        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                // the nested if consumes the trailing statement end
                int mark = nesting;
                try {
                    descend(previous(), "Blocks nested too deeply.");
                    Stmt nested = ifStatement();
                    return new If(condition, thenBranch, new Block(Collections.singletonList(nested)));
                } finally {
                    nesting = mark;
                }
            }
            consumeIf(TokenType.LEFT_BRACE, "Expected '{' after 'else'.");
            Block elseBranch = new Block(block());
            consumeIf(TokenType.STATEMENT_END, "Expected statement end after block.");
            return new If(condition, thenBranch, elseBranch);
        }

        consumeIf(TokenType.STATEMENT_END, "Expected statement end after block.");
        return new If(condition, thenBranch, null);
    }

    private Stmt whileStatement() {
        Expr.ExprInterface condition = expression();
        consumeIf(TokenType.LEFT_BRACE, "Expected '{' after while condition.");
        Block body = new Block(block());
        consumeIf(TokenType.STATEMENT_END, "Expected statement end after block.");
        return new While(condition, body);
    }

    /** Declarations up to and including the closing brace; the opening brace is already consumed. */
    private List<Stmt> block() {
        int mark = nesting;
        descend(previous(), "Blocks nested too deeply.");
        blockDepth++;
        try {
            List<Stmt> statements = new ArrayList<Stmt>();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                if (match(TokenType.STATEMENT_END)) continue;
                statements.add(declaration());
            }
            consumeIf(TokenType.RIGHT_BRACE, "Expected '}' after block.");
            return statements;
        } finally {
            blockDepth--;
            nesting = mark;
        }
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consumeIf(TokenType.STATEMENT_END, "Expected statement end after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        int mark = nesting;
        try {
            return assignmentAt();
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface assignmentAt() {
        Expr.ExprInterface expr = logical();

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            descend(equals, "Expression nested too deeply.");
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                return new Assign(((Variable) expr).name, value);
            }
            // reported, not thrown: parsing carries on with the left side
            report(equals, "Invalid assignment target.");
            return expr;
        }

        if (match(TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL)) {
            Token compound = previous();
            descend(compound, "Expression nested too deeply.");
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, new Binary(expr, arithmeticOperatorOf(compound), value));
            }
            report(compound, "Invalid assignment target.");
            return expr;
        }

        return expr;
    }

    private Expr.ExprInterface logical() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = equality();
            while (match(TokenType.AND, TokenType.OR)) {
                Token op = previous();
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = equality();
                expr = new Logical(expr, op, right);
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface equality() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = comparison();
            while (match(TokenType.IS, TokenType.NOT)) {
                Token op = previous();
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = comparison();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface comparison() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = term();
            while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
                Token op = previous();
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = term();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface term() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = factor();
            while (match(TokenType.PLUS, TokenType.MINUS)) {
                Token op = previous();
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = factor();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface factor() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = unary();
            while (match(TokenType.STAR, TokenType.SLASH)) {
                Token op = previous();
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = unary();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token op = previous();
            int mark = nesting;
            try {
                descend(op, "Expression nested too deeply.");
                Expr.ExprInterface right = unary();
                return new Unary(op, right);
            } finally {
                nesting = mark;
            }
        }
        return postfix();
    }

    private Expr.ExprInterface postfix() {
        int mark = nesting;
        try {
            Expr.ExprInterface expr = primary();
            while (match(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS)) {
                descend(previous(), "Expression nested too deeply.");
                expr = new Postfix(expr, previous());
            }
            return expr;
        } finally {
            nesting = mark;
        }
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NONE)) return new Literal(Value.none());
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            int mark = nesting;
            try {
                descend(previous(), "Expression nested too deeply.");
                Expr.ExprInterface expr = expression();
                consumeIf(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return new Grouping(expr);
            } finally {
                nesting = mark;
            }
        }

        if (RESERVED.contains(peek().type)) {
            throw error(peek(), "'" + peek().lexeme + "' is reserved and not supported yet.");
        }

        throw error(peek(), "Expected an expression.");
    }

    private static Token arithmeticOperatorOf(Token compound) {
        if (compound.type == TokenType.PLUS_EQUAL) {
            return new Token(TokenType.PLUS, "+", null, compound.line);
        }
        return new Token(TokenType.MINUS, "-", null, compound.line);
    }

    /**
     * Skips tokens up to and including the next STATEMENT_END outside any
     * braces skipped along the way. Inside a block it stops in front of the
     * block's own closing brace and leaves it to {@link #block()}.
     */
    private void synchronize() {
        int braces = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == TokenType.RIGHT_BRACE) {
                if (braces == 0 && blockDepth > 0) return;
                if (braces > 0) braces--;
            } else if (type == TokenType.LEFT_BRACE) {
                braces++;
            }
            advance();
            if (type == TokenType.STATEMENT_END && braces == 0) return;
        }
    }

    /** Counts one more level of nesting, failing once the cap is reached. */
    private void descend(Token at, String message) {
        if (nesting >= MAX_NESTING) throw error(at, message);
        nesting++;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /** Returns the next token if it has the given type, otherwise reports and throws. */
    private Token consumeIf(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        report(token, message);
        return new ParseError(token, message);
    }

    private void report(Token token, String message) {
        Debug.get().w(Debug.PARSER, "[line " + token.line + "] " + message);
        if (reporter != null) reporter.report(token.line, message);
    }
}
