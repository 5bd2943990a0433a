package com.cah.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cah.debug.Debug;
import com.cah.debug.DebugLevel;
import com.cah.script.CahScript.DiagnosticReporter;

/**
 * Single pass scanner. Never throws on bad input: malformed literals and
 * stray characters are reported and dropped.
 *
 * Statement boundaries are inferred from newlines. A newline becomes a
 * STATEMENT_END when it is outside any (...) or [...] and the previous token
 * is one that can close a statement, so a line ending in an operator carries
 * on to the next line.
 */
public class Lexer {

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("is", TokenType.IS);
        map.put("offering", TokenType.OFFERING);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("none", TokenType.NONE);
        map.put("ritual", TokenType.RITUAL);
        map.put("end", TokenType.END);
        map.put("return", TokenType.RETURN);
        map.put("class", TokenType.CLASS);
        map.put("this", TokenType.THIS);
        map.put("super", TokenType.SUPER);
        map.put("for", TokenType.FOR);
        keywords = Collections.unmodifiableMap(map);
    }

    private static final Set<TokenType> CAN_END_STATEMENT = Collections.unmodifiableSet(EnumSet.of(
            TokenType.RIGHT_BRACE,
            TokenType.RIGHT_PAREN,
            TokenType.RIGHT_BRACKET,
            TokenType.TRUE,
            TokenType.FALSE,
            TokenType.NUMBER,
            TokenType.STRING,
            TokenType.NONE,
            TokenType.END,
            TokenType.IDENTIFIER
    ));

    private final String source;
    private final DiagnosticReporter reporter;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int bracketDepth = 0;

    public Lexer(String source, DiagnosticReporter reporter) {
        this.source = (source == null) ? "" : source;
        this.reporter = reporter;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        if (tokens.isEmpty() || lastType() != TokenType.STATEMENT_END) {
            tokens.add(new Token(TokenType.STATEMENT_END, "", null, line));
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        if (Debug.get().enabled(DebugLevel.TRACE)) {
            Debug.get().t(Debug.LEXER, "scanned " + tokens.size() + " tokens over " + line + " line(s)");
        }
        return tokens;
    }

    /** True when a newline after a token of this type may end a statement. */
    public static boolean canEndStatement(TokenType type) {
        return CAN_END_STATEMENT.contains(type);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': openBracket(TokenType.LEFT_PAREN); break;
            case ')': closeBracket(TokenType.RIGHT_PAREN); break;
            case '[': openBracket(TokenType.LEFT_BRACKET); break;
            case ']': closeBracket(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '+':
                if (match('+')) addToken(TokenType.PLUS_PLUS);
                else if (match('=')) addToken(TokenType.PLUS_EQUAL);
                else addToken(TokenType.PLUS);
                break;
            case '-':
                if (match('-')) addToken(TokenType.MINUS_MINUS);
                else if (match('=')) addToken(TokenType.MINUS_EQUAL);
                else addToken(TokenType.MINUS);
                break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '$':
                if (match('<')) addToken(TokenType.DOLLAR_LESS);
                else if (match('>')) addToken(TokenType.DOLLAR_GREATER);
                else error("Expected '<' or '>' after '$'.");
                break;
            case '?':
                // comment to end of line, the newline itself is still scanned
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newline();
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else error("Unexpected character '" + c + "'.");
        }
    }

    private void newline() {
        line++;
        if (bracketDepth > 0 || tokens.isEmpty()) return;
        if (canEndStatement(lastType())) {
            tokens.add(new Token(TokenType.STATEMENT_END, "\\n", null, line - 1));
        }
    }

    private void openBracket(TokenType type) {
        addToken(type);
        bracketDepth++;
    }

    private void closeBracket(TokenType type) {
        addToken(type);
        if (bracketDepth > 0) bracketDepth--;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(keywords.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            error("Could not parse number '" + text + "'.");
            return;
        }
        addToken(TokenType.NUMBER, Value.number(value));
    }

    private void string() {
        int startLine = line;
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') line++;
            advance();
        }
        if (isAtEnd()) {
            report(startLine, "Unterminated string.");
            return;
        }
        advance();
        // no escape sequences
        String value = source.substring(start + 1, current - 1);
        tokens.add(new Token(TokenType.STRING, source.substring(start, current), Value.string(value), startLine));
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private TokenType lastType() { return tokens.get(tokens.size() - 1).type; }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Value literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private void error(String message) {
        report(line, message);
    }

    private void report(int atLine, String message) {
        Debug.get().w(Debug.LEXER, "[line " + atLine + "] " + message);
        if (reporter != null) reporter.report(atLine, message);
    }
}
