package com.cah.script.parser;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Runtime value. The set of types is closed: instances only come from the
 * static factories below and are immutable.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    private final Type type;
    private final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "s")); }
    public static Value none() { return NONE; }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.NUMBER; }
    public boolean isString() { return type == Type.STRING; }
    public boolean isNone() { return type == Type.NONE; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** None is false, a bool is itself, everything else is true. */
    public boolean isTruthy() {
        switch (type) {
            case NONE: return false;
            case BOOL: return asBool();
            default: return true;
        }
    }

    /** Canonical text used by print and string concatenation. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case BOOL:   return Boolean.toString(asBool());
            case STRING: return asString();
            default:     return "none";
        }
    }

    /** Like {@link #toString()} but with strings quoted; used by the AST dumps. */
    public String debugString() {
        if (type == Type.STRING) return '"' + asString() + '"';
        return toString();
    }

    /**
     * Structural equality: different types are never equal. No identity
     * shortcut, so NaN is unequal even to the same instance.
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NUMBER: return asNumber() == other.asNumber();
            case NONE:   return true;
            default:     return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            double d = asNumber();
            // 0.0 and -0.0 compare equal, so they must hash alike
            return Double.hashCode(d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, value);
    }

    /**
     * Shortest round-trip decimal text, never in exponent form and without a
     * trailing ".0": 6, 1.5, 0.1, 100000000000000000000.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
    }
}
