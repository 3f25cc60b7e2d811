package com.grim.script.parser;

import java.util.List;

import com.grim.script.parser.Statement.Stmt;

public class UserFunction {
    final String name;
    final List<String> params;
    final List<Stmt> body;

    UserFunction(String name, List<String> params, List<Stmt> body) {
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public int arity() { return params.size(); }

    /**
     * Runs the body in a fresh frame. Arguments were already evaluated in the caller's
     * environment and the arity already checked.
     */
    Value call(Interpreter interpreter, Environment caller, List<Value> args) {
        Environment frame = caller.enterFunctionFrame(this);
        for (int i = 0; i < params.size(); i++) {
            frame.declare(params.get(i), args.get(i));
        }

        interpreter.executeFunctionBody(body, frame);

        // Integer 0 unless a return statement ran in this frame
        return frame.getReturnValue();
    }

    @Override
    public String toString() {
        return "<fn " + name + "/" + params.size() + ">";
    }
}
