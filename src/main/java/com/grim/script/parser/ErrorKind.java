package com.grim.script.parser;

/** Every way a Grim program can fail at run time. */
public enum ErrorKind {
    UNDEFINED_VARIABLE,
    UNDEFINED_FUNCTION,
    NAME_ALREADY_BOUND,
    SHADOWING_VIOLATION,
    INCOMPATIBLE_OPERANDS,
    UNSUPPORTED_UNARY_OPERAND,
    NON_BOOLEAN_CONDITION,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    IO_FAILURE,
    DIVISION_BY_ZERO,
    INTEGER_OVERFLOW,
    CALL_DEPTH_EXCEEDED
}
