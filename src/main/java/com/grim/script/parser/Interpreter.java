package com.grim.script.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.grim.debug.Debug;
import com.grim.script.GrimScript.LoopScope;
import com.grim.script.parser.Expr.ExprInterface;
import com.grim.script.parser.Statement.AssignStmt;
import com.grim.script.parser.Statement.FunctionStmt;
import com.grim.script.parser.Statement.If;
import com.grim.script.parser.Statement.IfElse;
import com.grim.script.parser.Statement.InputStmt;
import com.grim.script.parser.Statement.PrintStmt;
import com.grim.script.parser.Statement.ReturnStmt;
import com.grim.script.parser.Statement.Stmt;
import com.grim.script.parser.Statement.StmtVisitor;
import com.grim.script.parser.Statement.VarStmt;
import com.grim.script.parser.Statement.While;

/**
 * Statement executor. Walks a statement list top to bottom in the current
 * environment; the first runtime error aborts the whole run and leaves annotated
 * with every statement it passes through.
 */
public class Interpreter implements StmtVisitor {
    private static final String TAG = "grim.interpreter";

    Environment env;
    private final ExpressionEvaluator evaluator;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final LoopScope loopScope;
    private final PrintStream out;
    private final BufferedReader in;
    private String failedFunction;

    public Interpreter(Environment env, int maxDepth, LoopScope loopScope, PrintStream out, BufferedReader in) {
        this.env = env;
        this.evaluator = new ExpressionEvaluator(this);
        this.maxDepth = maxDepth;
        this.loopScope = (loopScope == null) ? LoopScope.SHARED : loopScope;
        this.out = out;
        this.in = in;
    }

    /** Function that was executing when the last runtime error was raised, or null for top level. */
    public String failedFunctionName() {
        return failedFunction;
    }

    /** Runs a whole program. A top-level return ends it normally. */
    public void execute(List<Stmt> program) {
        try {
            for (Stmt stmt : program) execute(stmt);
        } catch (ReturnSignal rs) {
            Debug.get().d(TAG, "top-level return " + rs.value + ", remaining statements skipped");
        }
    }

    void execute(Stmt stmt) {
        try {
            stmt.accept(this);
        } catch (GrimRuntimeException e) {
            throw e.during(stmt.kind());
        }
    }

    void executeBlock(List<Stmt> statements, Environment blockEnv) {
        Environment previous = this.env;
        this.env = blockEnv;
        try {
            for (Stmt s : statements) execute(s);
        } finally {
            this.env = previous;
        }
    }

    void executeFunctionBody(List<Stmt> body, Environment frame) {
        try {
            executeBlock(body, frame);
        } catch (ReturnSignal rs) {
            // the value is already in frame's return slot
            if (rs.frame != frame) throw rs;
        }
    }

    Value invoke(UserFunction fn, Environment caller, List<Value> args) {
        if (maxDepth > 0 && callStack.size() >= maxDepth) {
            throw Errors.callDepthExceeded(fn.name, maxDepth);
        }
        callStack.push(new CallFrame(fn.name, args));
        Debug.get().t(TAG, "call " + fn.name + args + " depth=" + callStack.size());
        try {
            Value result = fn.call(this, caller, args);
            Debug.get().t(TAG, "return " + fn.name + " -> " + result);
            return result;
        } catch (GrimRuntimeException e) {
            if (failedFunction == null) failedFunction = fn.name;
            throw e;
        } finally {
            callStack.pop();
        }
    }

    public Value evaluate(ExprInterface expr) {
        return evaluator.evaluate(env, expr);
    }

    private boolean condition(ExprInterface expr, StatementKind statement) {
        Value cond = evaluate(expr);
        if (cond.getType() != Value.Type.BOOLEAN) {
            throw Errors.nonBooleanCondition(statement, cond);
        }
        return cond.asBool();
    }

    @Override
    public void visitVarStmt(VarStmt stmt) {
        Value value = evaluate(stmt.initializer);
        env.declare(stmt.name, value);
    }

    @Override
    public void visitAssignStmt(AssignStmt stmt) {
        Value value = evaluate(stmt.value);
        env.assign(stmt.name, value);
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (condition(stmt.condition, StatementKind.IF)) {
            executeBlock(stmt.thenBranch, env.enterChild());
        }
    }

    @Override
    public void visitIfElseStmt(IfElse stmt) {
        if (condition(stmt.condition, StatementKind.IF_ELSE)) {
            executeBlock(stmt.thenBranch, env.enterChild());
        } else {
            executeBlock(stmt.elseBranch, env.enterChild());
        }
    }

    @Override
    public void visitWhileStmt(While stmt) {
        // SHARED: one body scope for all iterations, so a `let` in the body fails the second time round
        Environment shared = (loopScope == LoopScope.SHARED) ? env.enterChild() : null;
        while (condition(stmt.condition, StatementKind.WHILE)) {
            executeBlock(stmt.body, shared != null ? shared : env.enterChild());
        }
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        env.declareFunction(stmt.name, new UserFunction(stmt.name, stmt.params, stmt.body));
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        Value value = evaluate(stmt.value);
        Environment frame = env.frame();
        frame.setReturnValue(value);
        throw new ReturnSignal(frame, value);
    }

    @Override
    public void visitPrintStmt(PrintStmt stmt) {
        Value value = evaluate(stmt.content);
        out.println(value.display());
    }

    @Override
    public void visitInputStmt(InputStmt stmt) {
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw Errors.ioFailure(e);
        }
        // end of input reads as an empty line
        Value read = InputValueParser.parse(line == null ? "" : line);

        Value current = env.lookup(stmt.name);
        if (current.getType() != read.getType()) {
            throw Errors.typeMismatch(stmt.name, current.getType(), read.getType());
        }
        env.assign(stmt.name, read);
    }

    /** Unwinds nested statement lists up to the frame the return belongs to. */
    static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Environment frame;
        final transient Value value;

        ReturnSignal(Environment frame, Value value) {
            super(null, null, false, false);
            this.frame = frame;
            this.value = value;
        }
    }
}
