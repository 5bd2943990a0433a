package com.cah.script;

import java.util.ArrayList;
import java.util.List;

import com.cah.debug.Debug;
import com.cah.script.parser.Environment;
import com.cah.script.parser.Interpreter;
import com.cah.script.parser.Lexer;
import com.cah.script.parser.Parser;
import com.cah.script.parser.Statement.Stmt;
import com.cah.script.parser.Token;

/**
 * Core Cah engine.
 *
 * - Statements end at a newline (no semicolons); {@code ?} starts a comment
 * - {@code offering x = 1} declares, {@code $< x} prints
 * - Types: number (double), bool, string, none
 * - Operators: + - * / < <= > >= is not and or, postfix ++ --, += -=
 * - Control flow: if / else / while with braced blocks
 *
 * One engine is one session: the global frame survives between
 * {@link #run(String)} calls, which is what the REPL relies on.
 *
 * Nothing here throws on bad scripts. Lexical, parse and runtime problems
 * are collected as {@link Diagnostic}s and forwarded to the host reporter.
 */
public class CahScript {

    /** Receives every recoverable problem found while scanning, parsing or running. */
    public interface DiagnosticReporter {
        void report(int line, String message);
    }

    /** Receives the text of each print statement. */
    public interface OutputWriter {
        void write(String text);
    }

    private DiagnosticReporter hostReporter;
    private OutputWriter hostOutput;

    private Interpreter interpreter;

    // per-run collectors; only touched while run(...) is active
    private List<String> runOutput = new ArrayList<>();
    private List<Diagnostic> runDiagnostics = new ArrayList<>();

    public CahScript() {
        reset();
    }

    public void setDiagnosticReporter(DiagnosticReporter reporter) { this.hostReporter = reporter; }

    public void setOutputWriter(OutputWriter output) { this.hostOutput = output; }

    /** Drops every global binding and starts a fresh session. */
    public void reset() {
        this.interpreter = new Interpreter(new Environment(), this::onRuntimeDiagnostic, this::onOutput);
        Debug.get().d(Debug.ENGINE, "new session");
    }

    public Environment globals() { return interpreter.globals(); }

    /** Scans only. Lexical problems are forwarded to the host reporter. */
    public List<Token> scan(String source) {
        return new Lexer(source, this::forwardOnly).tokenize();
    }

    /** Scans and parses without executing. */
    public List<Stmt> parse(String source) {
        return new Parser(scan(source), this::forwardOnly).parse();
    }

    /** Scans, parses and runs {@code source} against this session's global frame. */
    public RunResult run(String source) {
        List<String> output = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        runOutput = output;
        runDiagnostics = diagnostics;
        try {
            List<Token> tokens = new Lexer(source, (line, msg) -> collect(Diagnostic.Phase.LEX, line, msg)).tokenize();
            List<Stmt> program = new Parser(tokens, (line, msg) -> collect(Diagnostic.Phase.PARSE, line, msg)).parse();
            Debug.get().d(Debug.ENGINE, "parsed " + program.size() + " top-level statement(s)");

            interpreter.interpret(program);
        } finally {
            runOutput = new ArrayList<>();
            runDiagnostics = new ArrayList<>();
        }
        return new RunResult(interpreter.globals().snapshot(), output, diagnostics);
    }

    private void onRuntimeDiagnostic(int line, String message) {
        collect(Diagnostic.Phase.RUNTIME, line, message);
    }

    private void collect(Diagnostic.Phase phase, int line, String message) {
        runDiagnostics.add(new Diagnostic(phase, line, message));
        forwardOnly(line, message);
    }

    private void forwardOnly(int line, String message) {
        if (hostReporter != null) hostReporter.report(line, message);
    }

    private void onOutput(String text) {
        runOutput.add(text);
        if (hostOutput != null) hostOutput.write(text);
    }
}
