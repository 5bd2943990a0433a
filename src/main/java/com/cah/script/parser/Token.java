package com.cah.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Literal payload for NUMBER and STRING tokens, null otherwise. */
    public final Value literal;
    public final int line;

    public Token(TokenType type, String lexeme, Value literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    @Override
    public String toString() {
        return type + " " + lexeme + (literal == null ? "" : " " + literal.debugString());
    }
}
