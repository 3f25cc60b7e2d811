import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.grim.script.GrimScript;
import com.grim.script.GrimScript.LoopScope;
import com.grim.script.parser.ErrorKind;
import com.grim.script.parser.GrimRuntimeException;
import com.grim.script.parser.StatementKind;
import com.grim.script.parser.Value;

public class LoopScopeTest {

    private static final String DECLARING_LOOP =
            "let i = 0;\n" +
            "while (i < 3) {\n" +
            "  let step = 1;\n" +
            "  i = i + step;\n" +
            "}\n";

    @Test
    void shared_isDefault() {
        assertEquals(LoopScope.SHARED, new GrimScript().getLoopScope());
    }

    @Test
    void shared_declarationInBodyFailsOnSecondIteration() {
        GrimScript gs = new GrimScript();
        GrimRuntimeException ex = assertThrows(GrimRuntimeException.class, () -> gs.run(DECLARING_LOOP));
        assertEquals(ErrorKind.NAME_ALREADY_BOUND, ex.getKind());
        assertEquals("step", ex.getName());
        assertEquals(StatementKind.VARIABLE_DECLARATION, ex.getStatementKind());
    }

    @Test
    void perIteration_allowsRedeclaration() {
        GrimScript gs = new GrimScript();
        gs.setLoopScope(LoopScope.PER_ITERATION);
        Map<String, Value> env = gs.run(DECLARING_LOOP);
        assertEquals(Value.integer(3), env.get("i"));
        assertFalse(env.containsKey("step"));
    }

    @Test
    void shared_bodyStateSurvivesIterations() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run(
                "let i = 0;\n" +
                "let total = 0;\n" +
                "while (i < 4) {\n" +
                "  if (i == 0) { total = 100; }\n" +
                "  i = i + 1;\n" +
                "}\n"
        );
        assertEquals(Value.integer(4), env.get("i"));
        assertEquals(Value.integer(100), env.get("total"));
    }

    @Test
    void falseCondition_neverRunsBody() {
        GrimScript gs = new GrimScript();
        Map<String, Value> env = gs.run("let n = 1; while (false) { n = 2; }");
        assertEquals(Value.integer(1), env.get("n"));
    }

    @Test
    void nullLoopScope_fallsBackToShared() {
        GrimScript gs = new GrimScript();
        gs.setLoopScope(null);
        assertEquals(LoopScope.SHARED, gs.getLoopScope());
    }
}
