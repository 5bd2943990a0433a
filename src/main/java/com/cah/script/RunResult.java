package com.cah.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.cah.script.parser.Value;

public class RunResult {
    private final Map<String, Value> globals;
    private final List<String> output;
    private final List<Diagnostic> diagnostics;

    public RunResult(Map<String, Value> globals, List<String> output, List<Diagnostic> diagnostics) {
        this.globals = globals;
        this.output = Collections.unmodifiableList(output);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /** Global frame bindings after the run. */
    public Map<String, Value> globals() { return globals; }

    /** Printed lines, in order. */
    public List<String> output() { return output; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    public boolean hasErrors() { return !diagnostics.isEmpty(); }
}
