package com.grim.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.grim.script.parser.Expr.Binary;
import com.grim.script.parser.Expr.Call;
import com.grim.script.parser.Expr.ExprInterface;
import com.grim.script.parser.Expr.ExprVisitor;
import com.grim.script.parser.Expr.Literal;
import com.grim.script.parser.Expr.Unary;
import com.grim.script.parser.Expr.Variable;

/**
 * Reduces an expression to a single Value. The tree is never modified; the
 * environment is only touched through a function call, which runs in its own frame.
 */
public final class ExpressionEvaluator implements ExprVisitor<Value> {

    private final Interpreter interpreter;
    private Environment env;

    ExpressionEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    public Value evaluate(Environment environment, ExprInterface expr) {
        Environment previous = this.env;
        this.env = environment;
        try {
            return expr.accept(this);
        } finally {
            this.env = previous;
        }
    }

    private Value eval(ExprInterface expr) { return expr.accept(this); }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.lookup(expr.name);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        return expr.operator.apply(right);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        // Both operands always, left first, even for && and ||
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        return OperatorTable.apply(expr.operator, left, right);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        UserFunction fn = env.lookupFunction(expr.name);
        if (expr.arguments.size() != fn.arity()) {
            throw Errors.arityMismatch(expr.name, fn.arity(), expr.arguments.size());
        }

        // Arguments belong to the caller's scope, evaluated left to right.
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) {
            args.add(eval(a));
        }
        return interpreter.invoke(fn, env, args);
    }
}
