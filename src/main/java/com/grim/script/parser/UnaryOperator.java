package com.grim.script.parser;

import java.util.List;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    public Value apply(Value operand) {
        switch (this) {
            case NEGATE:
                if (operand.getType() == Value.Type.INTEGER) {
                    try {
                        return Value.integer(Math.negateExact(operand.asInteger()));
                    } catch (ArithmeticException e) {
                        throw Errors.integerOverflow("Negation", List.of(operand), e);
                    }
                }
                if (operand.getType() == Value.Type.FLOAT) return Value.floating(-operand.asFloat());
                throw Errors.unsupportedUnaryOperand(this, operand);
            case NOT:
                if (operand.getType() == Value.Type.BOOLEAN) return Value.bool(!operand.asBool());
                throw Errors.unsupportedUnaryOperand(this, operand);
            default:
                throw new IllegalStateException("Unsupported unary operator: " + this);
        }
    }

    public static UnaryOperator fromSymbol(String symbol) {
        for (UnaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}
