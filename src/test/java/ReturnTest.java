import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.grim.script.GrimScript;
import com.grim.script.parser.Value;

public class ReturnTest {

    @Test
    void returnInsideLoop_endsFunctionImmediately() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "fn firstOver(limit) {\n" +
                "  let i = 0;\n" +
                "  while (true) {\n" +
                "    i = i + 1;\n" +
                "    if (i > limit) { return i; }\n" +
                "  }\n" +
                "  return 0 - 1;\n" +
                "}\n" +
                "let r = firstOver(4);\n"
        );
        assertEquals(Value.integer(5), env.get("r"));
    }

    @Test
    void statementsAfterReturn_doNotRun() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        GrimScript gs = new GrimScript();
        gs.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));

        Map<String, Value> env = gs.run(
                "fn f() { return \"done\"; print(\"unreachable\"); }\n" +
                "let r = f();\n" +
                "print(r);\n"
        );
        assertEquals(Value.string("done"), env.get("r"));
        assertEquals("done", buf.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void nestedCalls_eachReturnToOwnCaller() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "fn inner(x) { return x * 2; }\n" +
                "fn outer(x) { let y = inner(x) + 1; return y * 10; }\n" +
                "let r = outer(3);\n"
        );
        assertEquals(Value.integer(70), env.get("r"));
    }

    @Test
    void returnValue_mayBeAnyVariant() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "fn half(x) { return x / 2; }\n" +
                "fn isBig(x) { return x > 100; }\n" +
                "let a = half(3);\n" +
                "let b = isBig(500);\n"
        );
        assertEquals(Value.floating(1.5), env.get("a"));
        assertEquals(Value.bool(true), env.get("b"));
    }

    @Test
    void topLevelReturn_endsProgramNormally() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "let a = 1;\n" +
                "return a;\n" +
                "let b = 2;\n"
        );
        assertEquals(Value.integer(1), env.get("a"));
        assertFalse(env.containsKey("b"));
    }

    @Test
    void mutualRecursion_throughTopLevelFunctions() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "fn isEven(n) { if (n == 0) { return true; } return isOdd(n - 1); }\n" +
                "fn isOdd(n) { if (n == 0) { return false; } return isEven(n - 1); }\n" +
                "let r = isEven(10);\n"
        );
        assertEquals(Value.bool(true), env.get("r"));
    }

    @Test
    void parametersAreLocalCopies() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "fn bump(n) { n = n + 1; return n; }\n" +
                "let n = 1;\n" +
                "let r = bump(n);\n"
        );
        assertEquals(Value.integer(1), env.get("n"));
        assertEquals(Value.integer(2), env.get("r"));
    }
}
