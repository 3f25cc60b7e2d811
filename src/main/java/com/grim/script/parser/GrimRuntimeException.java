package com.grim.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single runtime failure of a Grim program. It is never caught inside the
 * interpreter; each statement it passes through on the way out is recorded so the
 * host can show where it happened.
 */
public class GrimRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String name;
    private final List<Value> operands;
    private final List<StatementKind> statementTrace = new ArrayList<>();

    GrimRuntimeException(ErrorKind kind, String name, List<Value> operands, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.name = name;
        this.operands = (operands == null) ? Collections.emptyList() : List.copyOf(operands);
    }

    public ErrorKind getKind() { return kind; }

    /** Variable or function name involved, or null. */
    public String getName() { return name; }

    /** Operand values for operator errors, empty otherwise. */
    public List<Value> getOperands() { return operands; }

    /** Innermost statement the error occurred in, or null if raised outside any statement. */
    public StatementKind getStatementKind() {
        return statementTrace.isEmpty() ? null : statementTrace.get(0);
    }

    /** Enclosing statements, innermost first. */
    public List<StatementKind> getStatementTrace() {
        return Collections.unmodifiableList(statementTrace);
    }

    GrimRuntimeException during(StatementKind statement) {
        statementTrace.add(statement);
        return this;
    }

    /** Multi-line description for consoles: one "Error during ..." line per enclosing statement. */
    public String report() {
        StringBuilder sb = new StringBuilder();
        for (int i = statementTrace.size() - 1; i >= 0; i--) {
            sb.append("Error during ").append(statementTrace.get(i).label()).append('\n');
        }
        sb.append(kind).append(": ").append(getMessage());
        return sb.toString();
    }
}
