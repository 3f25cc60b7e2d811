package com.grim.script.parser;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical block: the program's top level, an if/else branch, a loop body or a
 * function call frame.
 *
 * Children reference their parent, never the reverse, so a block's environment is
 * simply dropped when the block finishes. Assignments walk up to the owning block;
 * declarations always land here. The visible-name sets are copied down on entry so
 * a shadowing check never has to walk the chain.
 */
public class Environment {

    public final Environment parent;

    // Top-level environment of the program; the fallback for function lookups from a call frame.
    private final Environment program;

    private final Map<String, Value> variables = new LinkedHashMap<>();
    private final Map<String, UserFunction> functions = new LinkedHashMap<>();
    private final Set<String> visibleVariables;
    private final Set<String> visibleFunctions;

    private Value returnValue = Value.zero();

    /** Top-level environment of a program run. */
    public Environment() {
        this.parent = null;
        this.program = this;
        this.visibleVariables = new HashSet<>();
        this.visibleFunctions = new HashSet<>();
    }

    private Environment(Environment parent, Environment program, Set<String> visibleVariables, Set<String> visibleFunctions) {
        this.parent = parent;
        this.program = program;
        this.visibleVariables = visibleVariables;
        this.visibleFunctions = visibleFunctions;
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void declare(String name, Value value) {
        if (variables.containsKey(name)) {
            throw Errors.nameAlreadyBound(name, false);
        }
        if (visibleVariables.contains(name)) {
            throw Errors.shadowingViolation(name);
        }
        variables.put(name, value);
        visibleVariables.add(name);
    }

    public Value lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.variables.get(name);
            if (v != null) return v;
        }
        throw Errors.undefinedVariable(name);
    }

    /** Overwrites the innermost existing binding; never creates one. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.variables.containsKey(name)) {
                e.variables.put(name, value);
                return;
            }
        }
        throw Errors.undefinedVariable(name);
    }

    public boolean isVisible(String name) {
        return visibleVariables.contains(name);
    }

    public boolean existsInCurrentScope(String name) {
        return variables.containsKey(name);
    }

    // -------------------------
    // Functions API
    // -------------------------
    public void declareFunction(String name, UserFunction function) {
        if (functions.containsKey(name)) {
            throw Errors.nameAlreadyBound(name, true);
        }
        if (visibleFunctions.contains(name)) {
            throw Errors.shadowingViolation(name);
        }
        functions.put(name, function);
        visibleFunctions.add(name);
    }

    public UserFunction lookupFunction(String name) {
        Environment e = this;
        while (true) {
            UserFunction fn = e.functions.get(name);
            if (fn != null) return fn;
            if (e.parent == null) break;
            e = e.parent;
        }
        // e is now a call frame or the program itself; frames still see top-level functions
        if (e != program) {
            UserFunction fn = program.functions.get(name);
            if (fn != null) return fn;
        }
        throw Errors.undefinedFunction(name);
    }

    // -------------------------
    // Block / frame entry
    // -------------------------
    public Environment enterChild() {
        return new Environment(this, program, new HashSet<>(visibleVariables), new HashSet<>(visibleFunctions));
    }

    /**
     * Fresh call frame for {@code function}: no parent, so the body cannot see the
     * caller's locals. The function itself is pre-declared so it can recurse.
     */
    public Environment enterFunctionFrame(UserFunction function) {
        Environment frame = new Environment(null, program, new HashSet<>(), new HashSet<>());
        frame.declareFunction(function.name, function);
        return frame;
    }

    // -------------------------
    // Return slot
    // -------------------------

    /** The environment a return statement in this block reports to: the call frame, or the program. */
    public Environment frame() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    public void setReturnValue(Value value) {
        this.returnValue = value;
    }

    public Value getReturnValue() {
        return returnValue;
    }

    // -------------------------
    // Host / debug views
    // -------------------------

    /** Bindings declared directly in this block, in declaration order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public int depth() {
        int d = 0;
        for (Environment e = parent; e != null; e = e.parent) d++;
        return d;
    }
}
