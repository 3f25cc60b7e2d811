package com.grim.script.parser;

import java.util.List;

/** Builds every runtime error the evaluator and executor raise. */
public final class Errors {

    private Errors() {}

    public static GrimRuntimeException undefinedVariable(String name) {
        return new GrimRuntimeException(ErrorKind.UNDEFINED_VARIABLE, name, null,
                "Variable " + name + " does not exist", null);
    }

    public static GrimRuntimeException undefinedFunction(String name) {
        return new GrimRuntimeException(ErrorKind.UNDEFINED_FUNCTION, name, null,
                "Function " + name + " does not exist", null);
    }

    public static GrimRuntimeException nameAlreadyBound(String name, boolean function) {
        String what = function ? "A function" : "A variable";
        return new GrimRuntimeException(ErrorKind.NAME_ALREADY_BOUND, name, null,
                what + " with this name (" + name + ") already exists and it is in scope", null);
    }

    public static GrimRuntimeException shadowingViolation(String name) {
        return new GrimRuntimeException(ErrorKind.SHADOWING_VIOLATION, name, null,
                "You are overshadowing (" + name + ")", null);
    }

    public static GrimRuntimeException incompatibleOperands(BinaryOperator op, Value left, Value right) {
        return new GrimRuntimeException(ErrorKind.INCOMPATIBLE_OPERANDS, null, List.of(left, right),
                op.description() + " between incompatible types -> " + left + " and " + right, null);
    }

    public static GrimRuntimeException unsupportedUnaryOperand(UnaryOperator op, Value operand) {
        return new GrimRuntimeException(ErrorKind.UNSUPPORTED_UNARY_OPERAND, null, List.of(operand),
                "Operator '" + op.symbol() + "' is not supported -> " + operand, null);
    }

    public static GrimRuntimeException nonBooleanCondition(StatementKind statement, Value condition) {
        return new GrimRuntimeException(ErrorKind.NON_BOOLEAN_CONDITION, null, List.of(condition),
                condition.getType() + " cannot be used as " + statement.label() + " condition", null);
    }

    public static GrimRuntimeException arityMismatch(String function, int expected, int actual) {
        return new GrimRuntimeException(ErrorKind.ARITY_MISMATCH, function, null,
                function + "() expects " + expected + " arguments, got " + actual, null);
    }

    public static GrimRuntimeException typeMismatch(String name, Value.Type declared, Value.Type read) {
        return new GrimRuntimeException(ErrorKind.TYPE_MISMATCH, name, null,
                "Error of type incoherence, \"" + name + "\" is " + declared + " but input is " + read, null);
    }

    public static GrimRuntimeException ioFailure(Throwable cause) {
        return new GrimRuntimeException(ErrorKind.IO_FAILURE, null, null,
                "Error reading standard input: " + cause.getMessage(), cause);
    }

    public static GrimRuntimeException divisionByZero(BinaryOperator op, Value left, Value right) {
        return new GrimRuntimeException(ErrorKind.DIVISION_BY_ZERO, null, List.of(left, right),
                op.description() + " by zero -> " + left + " and " + right, null);
    }

    public static GrimRuntimeException integerOverflow(String operation, List<Value> operands, ArithmeticException cause) {
        return new GrimRuntimeException(ErrorKind.INTEGER_OVERFLOW, null, operands,
                operation + " overflows a 64-bit integer -> " + operands, cause);
    }

    public static GrimRuntimeException callDepthExceeded(String function, int maxDepth) {
        return new GrimRuntimeException(ErrorKind.CALL_DEPTH_EXCEEDED, function, null,
                "Max call depth exceeded (" + maxDepth + ") calling " + function, null);
    }
}
