import com.valyxo.debug.Debug;
import com.valyxo.debug.DebugLevel;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;
import com.valyxo.script.parser.UserFunction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionRegistryTest {

    private final ValyxoScript es = new ValyxoScript();

    @AfterEach
    void restoreSink() {
        Debug.get().setSink(null);
    }

    @Test
    void definitionsAreRecordedWithParameters() {
        RuntimeState state = es.createRuntime();
        es.runProgram(state, "func add(a, b) { print a + b }");

        UserFunction add = state.functions().get("add");
        assertNotNull(add);
        assertEquals(2, add.arity());
        assertEquals(List.of("a", "b"), add.params());
        assertEquals("add(a, b)", add.signature());
        assertEquals(1, add.line());
    }

    @Test
    void redefinition_replacesAndLogsWarning() {
        List<String> logs = Collections.synchronizedList(new ArrayList<>());
        Debug.get().setSink((level, tag, message, error) -> logs.add(level + ":" + message));

        RuntimeState state = es.createRuntime();
        String src = String.join("\n",
            "func f() { print 1 }",
            "func f(x) { print x }",
            "f(7)"
        );

        assertEquals("7\n", es.runProgram(state, src).output());
        assertEquals(1, state.functions().size());
        assertEquals(2, state.functions().get("f").line());
        assertTrue(logs.stream().anyMatch(l -> l.startsWith(DebugLevel.WARN + ":") && l.contains("redefined")));
    }

    @Test
    void arityMismatch_isReported() {
        String src = String.join("\n",
            "func add(a,b){ print a+b }",
            "add(1)"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.run(src));
        assertEquals(ErrorKind.ARITY_MISMATCH, e.kind());
        assertEquals(2, e.line());
        assertEquals("add() expects 2 arguments, got 1", e.reason());
        assertEquals("Use: add(a, b)", e.suggestion());
    }

    @Test
    void undefinedFunction_suggestsClosestName() {
        String src = String.join("\n",
            "func add(a,b){ print a+b }",
            "ad(1, 2)"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.run(src));
        assertEquals(ErrorKind.UNDEFINED_FUNCTION, e.kind());
        assertEquals("did you mean 'add'?", e.suggestion());
    }

    @Test
    void argumentsEvaluatedInCallerScope_beforeBinding() {
        String src = String.join("\n",
            "set base = 10",
            "func show(v){ print v }",
            "show(base * 2)"
        );

        assertEquals("20\n", es.run(src).output());
    }

    @Test
    void functionsCallOtherFunctions() {
        String src = String.join("\n",
            "func inner(v) { print v + 1 }",
            "func outer(v) {",
            "  inner(v * 2)",
            "  print v",
            "}",
            "outer(5)"
        );

        assertEquals("11\n5\n", es.run(src).output());
    }
}
