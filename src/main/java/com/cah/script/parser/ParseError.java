package com.cah.script.parser;

/** Unwinds one declaration; always caught by the parser's recovery. */
public class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public final Token token;

    ParseError(Token token, String message) {
        super("[line " + token.line + "] " + message, null, false, false);
        this.token = token;
    }
}
