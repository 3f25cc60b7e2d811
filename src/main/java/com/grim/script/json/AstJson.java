package com.grim.script.json;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grim.script.parser.BinaryOperator;
import com.grim.script.parser.Expr;
import com.grim.script.parser.Expr.ExprInterface;
import com.grim.script.parser.ParseException;
import com.grim.script.parser.Statement;
import com.grim.script.parser.Statement.Stmt;
import com.grim.script.parser.UnaryOperator;
import com.grim.script.parser.Value;

/**
 * JSON form of a program tree, for handing a parsed program between tools.
 *
 * A program is an array of statement objects, each keyed by "type":
 * <pre>
 *   {"type":"let",     "name":"x", "value":EXPR}
 *   {"type":"assign",  "name":"x", "value":EXPR}
 *   {"type":"if",      "condition":EXPR, "then":[...]}
 *   {"type":"if_else", "condition":EXPR, "then":[...], "else":[...]}
 *   {"type":"while",   "condition":EXPR, "body":[...]}
 *   {"type":"fn",      "name":"f", "params":["a","b"], "body":[...]}
 *   {"type":"return",  "value":EXPR}
 *   {"type":"print",   "value":EXPR}
 *   {"type":"input",   "name":"x"}
 * </pre>
 * Expressions:
 * <pre>
 *   {"type":"int","value":5}  {"type":"float","value":3.5}  {"type":"bool","value":true}
 *   {"type":"str","value":"hi"}  {"type":"ident","name":"x"}
 *   {"type":"call","name":"f","args":[...]}
 *   {"type":"binary","op":"+","left":EXPR,"right":EXPR}
 *   {"type":"unary","op":"-","operand":EXPR}
 * </pre>
 * Non-finite floats are written as the strings "NaN", "Infinity" and "-Infinity".
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    // ===================== READ =====================

    public static List<Stmt> read(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseException("Malformed JSON program: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ParseException(0, "JSON program must be an array of statements");
        }
        return statements(root, "program");
    }

    private static List<Stmt> statements(JsonNode node, String where) {
        if (node == null || !node.isArray()) {
            throw new ParseException(0, "'" + where + "' must be an array of statements");
        }
        List<Stmt> out = new ArrayList<>();
        for (JsonNode n : node) out.add(statement(n));
        return out;
    }

    private static Stmt statement(JsonNode n) {
        String type = text(n, "type");
        switch (type) {
            case "let":     return new Statement.VarStmt(text(n, "name"), expression(n.get("value")));
            case "assign":  return new Statement.AssignStmt(text(n, "name"), expression(n.get("value")));
            case "if":      return new Statement.If(expression(n.get("condition")), statements(n.get("then"), "then"));
            case "if_else": return new Statement.IfElse(expression(n.get("condition")),
                                    statements(n.get("then"), "then"), statements(n.get("else"), "else"));
            case "while":   return new Statement.While(expression(n.get("condition")), statements(n.get("body"), "body"));
            case "fn":      return new Statement.FunctionStmt(text(n, "name"), params(n.get("params")),
                                    statements(n.get("body"), "body"));
            case "return":  return new Statement.ReturnStmt(expression(n.get("value")));
            case "print":   return new Statement.PrintStmt(expression(n.get("value")));
            case "input":   return new Statement.InputStmt(text(n, "name"));
            default: throw new ParseException(0, "Unknown statement type: " + type);
        }
    }

    private static List<String> params(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new ParseException(0, "'params' must be an array of names");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode p : node) {
            if (!p.isTextual()) throw new ParseException(0, "Parameter name must be a string: " + p);
            out.add(p.asText());
        }
        return out;
    }

    private static ExprInterface expression(JsonNode n) {
        if (n == null || !n.isObject()) {
            throw new ParseException(0, "Expected an expression object, got: " + n);
        }
        String type = text(n, "type");
        switch (type) {
            case "int": {
                JsonNode v = n.get("value");
                if (v == null || !v.isIntegralNumber() || !v.canConvertToLong()) {
                    throw new ParseException(0, "Integer literal out of range or not an integer: " + v);
                }
                return new Expr.Literal(Value.integer(v.asLong()));
            }
            case "float":
                return new Expr.Literal(Value.floating(floatValue(n.get("value"))));
            case "bool": {
                JsonNode v = n.get("value");
                if (v == null || !v.isBoolean()) throw new ParseException(0, "Boolean literal expected: " + v);
                return new Expr.Literal(Value.bool(v.asBoolean()));
            }
            case "str":
                return new Expr.Literal(Value.string(text(n, "value")));
            case "ident":
                return new Expr.Variable(text(n, "name"));
            case "call": {
                JsonNode args = n.get("args");
                if (args == null || !args.isArray()) throw new ParseException(0, "'args' must be an array");
                List<ExprInterface> arguments = new ArrayList<>();
                for (JsonNode a : args) arguments.add(expression(a));
                return new Expr.Call(text(n, "name"), arguments);
            }
            case "binary":
                return new Expr.Binary(expression(n.get("left")), binaryOperator(text(n, "op")), expression(n.get("right")));
            case "unary":
                return new Expr.Unary(unaryOperator(text(n, "op")), expression(n.get("operand")));
            default:
                throw new ParseException(0, "Unknown expression type: " + type);
        }
    }

    private static double floatValue(JsonNode v) {
        if (v != null && v.isNumber()) return v.asDouble();
        if (v != null && v.isTextual()) {
            switch (v.asText()) {
                case "NaN":       return Double.NaN;
                case "Infinity":  return Double.POSITIVE_INFINITY;
                case "-Infinity": return Double.NEGATIVE_INFINITY;
                default: break;
            }
        }
        throw new ParseException(0, "Float literal expected: " + v);
    }

    private static BinaryOperator binaryOperator(String symbol) {
        try {
            return BinaryOperator.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), e);
        }
    }

    private static UnaryOperator unaryOperator(String symbol) {
        try {
            return UnaryOperator.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), e);
        }
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.isTextual()) {
            throw new ParseException(0, "Missing string field '" + field + "' in " + n);
        }
        return v.asText();
    }

    // ===================== WRITE =====================

    public static String write(List<Stmt> program) {
        ArrayNode root = om.createArrayNode();
        Writer w = new Writer();
        for (Stmt s : program) root.add(w.statement(s));
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize program", e);
        }
    }

    private static final class Writer implements Statement.StmtVisitor, Expr.ExprVisitor<JsonNode> {
        private ObjectNode current;

        ObjectNode statement(Stmt s) {
            s.accept(this);
            return current;
        }

        ArrayNode block(List<Stmt> statements) {
            ArrayNode arr = om.createArrayNode();
            for (Stmt s : statements) arr.add(statement(s));
            return arr;
        }

        private ObjectNode node(String type) {
            ObjectNode o = om.createObjectNode();
            o.put("type", type);
            return o;
        }

        @Override
        public void visitVarStmt(Statement.VarStmt stmt) {
            ObjectNode o = node("let");
            o.put("name", stmt.name);
            o.set("value", stmt.initializer.accept(this));
            current = o;
        }

        @Override
        public void visitAssignStmt(Statement.AssignStmt stmt) {
            ObjectNode o = node("assign");
            o.put("name", stmt.name);
            o.set("value", stmt.value.accept(this));
            current = o;
        }

        @Override
        public void visitIfStmt(Statement.If stmt) {
            ObjectNode o = node("if");
            o.set("condition", stmt.condition.accept(this));
            o.set("then", block(stmt.thenBranch));
            current = o;
        }

        @Override
        public void visitIfElseStmt(Statement.IfElse stmt) {
            ObjectNode o = node("if_else");
            o.set("condition", stmt.condition.accept(this));
            ArrayNode thenBranch = block(stmt.thenBranch);
            ArrayNode elseBranch = block(stmt.elseBranch);
            o.set("then", thenBranch);
            o.set("else", elseBranch);
            current = o;
        }

        @Override
        public void visitWhileStmt(Statement.While stmt) {
            ObjectNode o = node("while");
            o.set("condition", stmt.condition.accept(this));
            o.set("body", block(stmt.body));
            current = o;
        }

        @Override
        public void visitFunctionStmt(Statement.FunctionStmt stmt) {
            ObjectNode o = node("fn");
            o.put("name", stmt.name);
            ArrayNode params = o.putArray("params");
            for (String p : stmt.params) params.add(p);
            o.set("body", block(stmt.body));
            current = o;
        }

        @Override
        public void visitReturnStmt(Statement.ReturnStmt stmt) {
            ObjectNode o = node("return");
            o.set("value", stmt.value.accept(this));
            current = o;
        }

        @Override
        public void visitPrintStmt(Statement.PrintStmt stmt) {
            ObjectNode o = node("print");
            o.set("value", stmt.content.accept(this));
            current = o;
        }

        @Override
        public void visitInputStmt(Statement.InputStmt stmt) {
            ObjectNode o = node("input");
            o.put("name", stmt.name);
            current = o;
        }

        @Override
        public JsonNode visitLiteralExpr(Expr.Literal expr) {
            Value v = expr.value;
            switch (v.getType()) {
                case INTEGER: {
                    ObjectNode o = node("int");
                    o.put("value", v.asInteger());
                    return o;
                }
                case FLOAT: {
                    ObjectNode o = node("float");
                    double d = v.asFloat();
                    if (Double.isNaN(d)) o.put("value", "NaN");
                    else if (Double.isInfinite(d)) o.put("value", d > 0 ? "Infinity" : "-Infinity");
                    else o.put("value", d);
                    return o;
                }
                case BOOLEAN: {
                    ObjectNode o = node("bool");
                    o.put("value", v.asBool());
                    return o;
                }
                case STRING: {
                    ObjectNode o = node("str");
                    o.put("value", v.asString());
                    return o;
                }
                default:
                    throw new IllegalStateException("Unknown value type: " + v.getType());
            }
        }

        @Override
        public JsonNode visitVariableExpr(Expr.Variable expr) {
            ObjectNode o = node("ident");
            o.put("name", expr.name);
            return o;
        }

        @Override
        public JsonNode visitCallExpr(Expr.Call expr) {
            ObjectNode o = node("call");
            o.put("name", expr.name);
            ArrayNode args = o.putArray("args");
            for (ExprInterface a : expr.arguments) args.add(a.accept(this));
            return o;
        }

        @Override
        public JsonNode visitBinaryExpr(Expr.Binary expr) {
            ObjectNode o = node("binary");
            o.put("op", expr.operator.symbol());
            o.set("left", expr.left.accept(this));
            o.set("right", expr.right.accept(this));
            return o;
        }

        @Override
        public JsonNode visitUnaryExpr(Expr.Unary expr) {
            ObjectNode o = node("unary");
            o.put("op", expr.operator.symbol());
            o.set("operand", expr.right.accept(this));
            return o;
        }
    }
}
