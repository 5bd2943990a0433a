package com.cah.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One lexical scope: its own bindings plus a link to the enclosing frame.
 * The global frame has no parent.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Global frame. */
    public Environment() {
        this.parent = null;
    }

    /** Child frame of {@code parent}, used for one block execution. */
    public Environment(Environment parent) {
        this.parent = parent;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in this frame only; an existing binding of the same name here is replaced. */
    public void define(String name, Value value) {
        values.put(name, Objects.requireNonNull(value, "value"));
    }

    public Value get(Token name) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            Value v = frame.values.get(name.lexeme);
            if (v != null) return v;
        }
        throw undefined(name);
    }

    /** Rebinds the nearest existing binding. Never creates one. */
    public void assign(Token name, Value value) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            if (frame.values.containsKey(name.lexeme)) {
                frame.values.put(name.lexeme, value);
                return;
            }
        }
        throw undefined(name);
    }

    public boolean exists(String name) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            if (frame.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    /** Number of frames from this one up to and including the global frame. */
    public int depth() {
        int depth = 0;
        for (Environment frame = this; frame != null; frame = frame.parent) depth++;
        return depth;
    }

    // -------------------------
    // Snapshots
    // -------------------------

    /** Bindings of this frame only, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** One map per frame, global frame first, innermost last. */
    public List<Map<String, Value>> snapshotFrames() {
        List<Map<String, Value>> frames = new ArrayList<>();
        for (Environment frame = this; frame != null; frame = frame.parent) {
            frames.add(0, frame.snapshot());
        }
        return frames;
    }

    private static RuntimeError undefined(Token name) {
        return new RuntimeError(name, RuntimeError.Kind.UNDEFINED_VARIABLE, "Undefined variable '" + name.lexeme + "'.");
    }
}
