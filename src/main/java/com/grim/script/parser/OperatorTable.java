package com.grim.script.parser;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongBinaryOperator;

import com.grim.script.parser.Value.Type;

/**
 * Operator x left type x right type -> rule. A combination with no rule is an
 * INCOMPATIBLE_OPERANDS error; nothing is coerced outside what a rule does itself.
 */
public final class OperatorTable {

    @FunctionalInterface
    private interface Rule {
        Value apply(Value left, Value right);
    }

    private static final Map<BinaryOperator, Map<Type, Map<Type, Rule>>> RULES = new EnumMap<>(BinaryOperator.class);

    static {
        for (BinaryOperator op : BinaryOperator.values()) {
            RULES.put(op, new EnumMap<>(Type.class));
        }

        // + - * : Integer x Integer stays Integer, anything with a Float is Float
        numeric(BinaryOperator.ADD,
                exactInteger(BinaryOperator.ADD, Math::addExact),
                (l, r) -> Value.floating(l.toDouble() + r.toDouble()));
        numeric(BinaryOperator.SUB,
                exactInteger(BinaryOperator.SUB, Math::subtractExact),
                (l, r) -> Value.floating(l.toDouble() - r.toDouble()));
        numeric(BinaryOperator.MUL,
                exactInteger(BinaryOperator.MUL, Math::multiplyExact),
                (l, r) -> Value.floating(l.toDouble() * r.toDouble()));
        numeric(BinaryOperator.DIV, OperatorTable::divideIntegers,
                (l, r) -> Value.floating(l.toDouble() / r.toDouble()));

        // % only on two Integers
        rule(BinaryOperator.MOD, Type.INTEGER, Type.INTEGER, (l, r) -> {
            if (r.asInteger() == 0L) throw Errors.divisionByZero(BinaryOperator.MOD, l, r);
            return Value.integer(l.asInteger() % r.asInteger());
        });

        // Both sides are already evaluated when these run: no short-circuit.
        rule(BinaryOperator.AND, Type.BOOLEAN, Type.BOOLEAN, (l, r) -> Value.bool(l.asBool() && r.asBool()));
        rule(BinaryOperator.OR, Type.BOOLEAN, Type.BOOLEAN, (l, r) -> Value.bool(l.asBool() || r.asBool()));

        relational(BinaryOperator.LESS);
        relational(BinaryOperator.GREATER);
        relational(BinaryOperator.LESS_EQ);
        relational(BinaryOperator.GREATER_EQ);

        equality(BinaryOperator.EQ, false);
        equality(BinaryOperator.NEQ, true);
    }

    private OperatorTable() {}

    public static Value apply(BinaryOperator op, Value left, Value right) {
        Rule rule = RULES.get(op).getOrDefault(left.getType(), Map.of()).get(right.getType());
        if (rule == null) {
            throw Errors.incompatibleOperands(op, left, right);
        }
        return rule.apply(left, right);
    }

    public static boolean supports(BinaryOperator op, Type left, Type right) {
        Map<Type, Rule> row = RULES.get(op).get(left);
        return row != null && row.containsKey(right);
    }

    private static void rule(BinaryOperator op, Type left, Type right, Rule rule) {
        RULES.get(op).computeIfAbsent(left, t -> new EnumMap<>(Type.class)).put(right, rule);
    }

    private static void numeric(BinaryOperator op, Rule integers, Rule promoted) {
        rule(op, Type.INTEGER, Type.INTEGER, integers);
        rule(op, Type.INTEGER, Type.FLOAT, promoted);
        rule(op, Type.FLOAT, Type.INTEGER, promoted);
        rule(op, Type.FLOAT, Type.FLOAT, promoted);
    }

    private static void relational(BinaryOperator op) {
        numeric(op,
                (l, r) -> Value.bool(compare(op, Long.compare(l.asInteger(), r.asInteger()))),
                (l, r) -> Value.bool(compareDoubles(op, l.toDouble(), r.toDouble())));
    }

    private static void equality(BinaryOperator op, boolean negate) {
        rule(op, Type.INTEGER, Type.INTEGER, (l, r) -> Value.bool((l.asInteger() == r.asInteger()) != negate));
        rule(op, Type.FLOAT, Type.FLOAT, (l, r) -> Value.bool((l.asFloat() == r.asFloat()) != negate));
        rule(op, Type.BOOLEAN, Type.BOOLEAN, (l, r) -> Value.bool((l.asBool() == r.asBool()) != negate));
        rule(op, Type.STRING, Type.STRING, (l, r) -> Value.bool(l.asString().equals(r.asString()) != negate));
    }

    // Exact when the remainder is zero, otherwise the true quotient as a Float.
    private static Value divideIntegers(Value left, Value right) {
        long l = left.asInteger();
        long r = right.asInteger();
        if (r == 0L) throw Errors.divisionByZero(BinaryOperator.DIV, left, right);
        if (l == Long.MIN_VALUE && r == -1L) {
            throw Errors.integerOverflow(BinaryOperator.DIV.description(), List.of(left, right),
                    new ArithmeticException("long overflow"));
        }
        if (l % r == 0L) return Value.integer(l / r);
        return Value.floating((double) l / (double) r);
    }

    private static boolean compare(BinaryOperator op, int cmp) {
        switch (op) {
            case LESS:       return cmp < 0;
            case GREATER:    return cmp > 0;
            case LESS_EQ:    return cmp <= 0;
            case GREATER_EQ: return cmp >= 0;
            default: throw new IllegalStateException("Not a relational operator: " + op);
        }
    }

    // IEEE semantics: every comparison against NaN is false.
    private static boolean compareDoubles(BinaryOperator op, double l, double r) {
        switch (op) {
            case LESS:       return l < r;
            case GREATER:    return l > r;
            case LESS_EQ:    return l <= r;
            case GREATER_EQ: return l >= r;
            default: throw new IllegalStateException("Not a relational operator: " + op);
        }
    }

    private static Rule exactInteger(BinaryOperator op, LongBinaryOperator f) {
        return (l, r) -> {
            try {
                return Value.integer(f.applyAsLong(l.asInteger(), r.asInteger()));
            } catch (ArithmeticException e) {
                throw Errors.integerOverflow(op.description(), List.of(l, r), e);
            }
        };
    }
}
