package com.cah.script;

/** One reported problem: where it was found and by which stage. */
public final class Diagnostic {

    public enum Phase { LEX, PARSE, RUNTIME }

    private final Phase phase;
    private final int line;
    private final String message;

    public Diagnostic(Phase phase, int line, String message) {
        this.phase = phase;
        this.line = line;
        this.message = message;
    }

    public Phase phase() { return phase; }
    public int line() { return line; }
    public String message() { return message; }

    @Override
    public String toString() {
        return "[line " + line + "] " + message;
    }
}
