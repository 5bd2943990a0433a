package com.cah.script.parser;

/**
 * Failure while evaluating a statement. Carries the token it is attributed
 * to so the diagnostic can name a line.
 */
public class RuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        TYPE_MISMATCH,
        UNDEFINED_VARIABLE,
        INVALID_TARGET
    }

    public final Token token;
    public final Kind kind;

    public RuntimeError(Token token, Kind kind, String message) {
        super(message);
        this.token = token;
        this.kind = kind;
    }

    public int line() {
        return token.line;
    }
}
