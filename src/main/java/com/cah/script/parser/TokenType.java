package com.cah.script.parser;

public enum TokenType {
    // Single character
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACKET, RIGHT_BRACKET,
    LEFT_BRACE, RIGHT_BRACE,
    COMMA, DOT, EQUAL,
    PLUS, MINUS, STAR, SLASH,
    LESS, GREATER,

    // Two characters
    PLUS_PLUS, PLUS_EQUAL,
    MINUS_MINUS, MINUS_EQUAL,
    LESS_EQUAL, GREATER_EQUAL,
    DOLLAR_LESS, DOLLAR_GREATER,

    // Literals
    STRING, NUMBER, IDENTIFIER,

    // Keywords
    AND, OR, NOT, IS,
    OFFERING, IF, ELSE, WHILE,
    TRUE, FALSE, NONE,

    // Reserved keywords (scanned, rejected by the parser)
    RITUAL, END, RETURN, CLASS, THIS, SUPER, FOR,

    // Synthetic
    STATEMENT_END, EOF
}
