package com.grim.script.parser;

public enum StatementKind {
    VARIABLE_DECLARATION("variable declaration"),
    ASSIGNMENT("variable assignment"),
    IF("if statement"),
    IF_ELSE("if-else statement"),
    WHILE("while statement"),
    FUNCTION_DECLARATION("function declaration"),
    RETURN("return statement"),
    PRINT("print statement"),
    INPUT("input statement");

    private final String label;

    StatementKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
