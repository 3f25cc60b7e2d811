package com.grim.script.parser;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Runtime value of a Grim program. Exactly four variants exist and a value never
 * changes after construction, so instances are shared freely between scopes.
 */
public final class Value {
    public enum Type { INTEGER, FLOAT, BOOLEAN, STRING }

    private static final Value ZERO = new Value(Type.INTEGER, 0L);
    private static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return l == 0L ? ZERO : new Value(Type.INTEGER, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "s")); }

    /** Result of a call whose body never executed a return. */
    public static Value zero() { return ZERO; }

    public Type getType() { return type; }

    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Expected integer, got " + type);
        return (long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new IllegalStateException("Expected float, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOLEAN) throw new IllegalStateException("Expected boolean, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Integer promoted to Float; Float unchanged. */
    public double toDouble() {
        switch (type) {
            case INTEGER: return (double) asInteger();
            case FLOAT:   return asFloat();
            default: throw new IllegalStateException("Expected integer or float, got " + type);
        }
    }

    /** Text written by a print statement. */
    public String display() {
        switch (type) {
            case INTEGER: return Long.toString(asInteger());
            case FLOAT:   return displayFloat(asFloat());
            case BOOLEAN: return Boolean.toString(asBool());
            case STRING:  return asString();
            default: throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    // Plain decimal, shortest round-trip digits, no exponent and no trailing ".0".
    static String displayFloat(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision));
            if (candidate.doubleValue() == d) return candidate.stripTrailingZeros().toPlainString();
        }
        return exact.round(new MathContext(17)).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER: return "Integer(" + asInteger() + ")";
            case FLOAT:   return "Float(" + displayFloat(asFloat()) + ")";
            case BOOLEAN: return "Boolean(" + asBool() + ")";
            case STRING:  return "String(\"" + asString() + "\")";
            default: return "?";
        }
    }
}
