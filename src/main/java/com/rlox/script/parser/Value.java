package com.rlox.script.parser;

import java.math.BigDecimal;

/**
 * Runtime value of the language. Closed set of four variants; every switch over
 * {@link Type} is written without a default branch so a new variant breaks the build.
 */
public final class Value {
    public enum Type { NIL, BOOL, NUMBER, STRING }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }

    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /*
     * How values leave the environment. Numbers and strings get a fresh wrapper;
     * nil and the two booleans are canonical instances.
     */
    public Value copy() {
        return switch (type) {
            case NIL -> NIL;
            case BOOL -> bool(asBool());
            case NUMBER -> number(asNumber());
            case STRING -> string(asString());
        };
    }

    /** Print form: nil is empty, numbers in plain decimal without a trailing ".0", strings are unquoted. */
    public String display() {
        return switch (type) {
            case NIL -> "";
            case BOOL -> Boolean.toString(asBool());
            case NUMBER -> formatNumber(asNumber());
            case STRING -> asString();
        };
    }

    /** Plain decimal, never exponent notation: 10000000, 0.0001, 2.5, -0, Infinity, NaN. */
    static String formatNumber(double d) {
        if (!Double.isFinite(d)) return Double.toString(d);
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** Same variant and equal payload. Numbers use IEEE comparison, so NaN is never equal to itself. */
    public boolean sameAs(Value other) {
        if (other == null || type != other.type) return false;
        return switch (type) {
            case NIL -> true;
            case BOOL -> asBool() == other.asBool();
            case NUMBER -> asNumber() == other.asNumber();
            case STRING -> asString().equals(other.asString());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        return switch (type) {
            case NIL -> true;
            case BOOL, STRING -> value.equals(other.value);
            case NUMBER -> Double.compare(asNumber(), other.asNumber()) == 0;
        };
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + (value == null ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        return switch (type) {
            case NIL -> "nil";
            case BOOL, NUMBER -> display();
            case STRING -> '"' + asString() + '"';
        };
    }
}
