package com.grim.script.parser;

public enum BinaryOperator {
    ADD("+", "Sum"),
    SUB("-", "Difference"),
    MUL("*", "Product"),
    DIV("/", "Division"),
    MOD("%", "Modulo"),
    AND("&&", "Logical and"),
    OR("||", "Logical or"),
    LESS("<", "Less than comparison"),
    GREATER(">", "Greater than comparison"),
    LESS_EQ("<=", "Less or equal comparison"),
    GREATER_EQ(">=", "Greater or equal comparison"),
    EQ("==", "Equality comparison"),
    NEQ("!=", "Inequality comparison");

    private final String symbol;
    private final String description;

    BinaryOperator(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String symbol() { return symbol; }

    public String description() { return description; }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
