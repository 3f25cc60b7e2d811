package com.grim.script;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import com.grim.debug.Debug;
import com.grim.script.json.AstJson;
import com.grim.script.parser.Environment;
import com.grim.script.parser.GrimRuntimeException;
import com.grim.script.parser.Interpreter;
import com.grim.script.parser.Lexer;
import com.grim.script.parser.Parser;
import com.grim.script.parser.Statement.Stmt;
import com.grim.script.parser.Token;
import com.grim.script.parser.Value;

public class GrimScript {
    private static final String TAG = "grim.script";

    /** How a while loop scopes declarations made in its body. Default SHARED. */
    public enum LoopScope {
        /** One body environment for the whole loop; a body {@code let} fails on the second iteration. */
        SHARED,
        /** A fresh body environment per iteration. */
        PER_ITERATION
    }

    /** Host hook notified of every runtime error before it is rethrown. */
    public interface SystemErrorReporter {
        void report(GrimRuntimeException e, String functionName);
    }

    // ===================== ENGINE PUBLIC API =====================

    private int maxCallDepth = 0;
    private LoopScope loopScope = LoopScope.SHARED;
    private PrintStream out = System.out;
    private BufferedReader in;
    private SystemErrorReporter errorReporter;

    public GrimScript() {}

    /** 0 means no limit beyond the JVM stack. */
    public void setMaxCallDepth(int depth) {
        if (depth < 0) throw new IllegalArgumentException("max call depth must be >= 0: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setLoopScope(LoopScope loopScope) { this.loopScope = (loopScope == null) ? LoopScope.SHARED : loopScope; }

    public LoopScope getLoopScope() { return loopScope; }

    public void setOutput(PrintStream out) { this.out = (out == null) ? System.out : out; }

    public void setInput(BufferedReader in) { this.in = in; }

    public void setErrorReporter(SystemErrorReporter reporter) { this.errorReporter = reporter; }

    /** Lexes and parses source text into a statement list. */
    public static List<Stmt> parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parse();
    }

    public Map<String, Value> run(String source) {
        return run(parse(source));
    }

    /** Runs a program given as a JSON AST. */
    public Map<String, Value> runJson(String json) {
        return run(AstJson.read(json));
    }

    /** Runs a program in a fresh top-level environment. Returns the top-level bindings afterwards. */
    public Map<String, Value> run(List<Stmt> program) {
        Environment env = new Environment();
        Interpreter interpreter = new Interpreter(env, maxCallDepth, loopScope, out, input());
        Debug.get().d(TAG, "run start: " + program.size() + " statements, loopScope=" + loopScope
                + ", maxCallDepth=" + maxCallDepth);
        try {
            interpreter.execute(program);
        } catch (GrimRuntimeException e) {
            String fn = interpreter.failedFunctionName();
            Debug.get().e(TAG, e.getKind() + " in " + (fn == null ? "<top level>" : fn) + ": " + e.getMessage());
            if (errorReporter != null) {
                errorReporter.report(e, fn);
            }
            throw e;
        } finally {
            out.flush();
        }
        Map<String, Value> snapshot = env.snapshot();
        Debug.get().d(TAG, "run end: " + snapshot.size() + " top-level bindings");
        return snapshot;
    }

    private BufferedReader input() {
        if (in == null) {
            in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return in;
    }
}
