import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.ExecutionResult;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;
import com.valyxo.script.parser.Value;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValyxoScriptTest {

    @Test
    void roundTrip_outputAndVariables() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "set x = 10",
            "set y = 20",
            "set sum = x + y",
            "print sum"
        );

        ExecutionResult r = es.run(src);

        assertEquals("30\n", r.output());

        Map<String, Value> expected = new LinkedHashMap<>();
        expected.put("x", Value.integer(10));
        expected.put("y", Value.integer(20));
        expected.put("sum", Value.integer(30));
        assertEquals(expected, r.variables());
        assertEquals(List.of("x", "y", "sum"), new ArrayList<>(r.variables().keySet()));
    }

    @Test
    void inlineIf_takesThenBranch() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "set score = 85",
            "if [score >= 80] then [print \"Passed\"] else [print \"Failed\"]"
        );

        assertEquals("Passed\n", es.run(src).output());
    }

    @Test
    void inlineIf_takesElseBranch() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "set score = 42",
            "if [score >= 80] then [print \"Passed\"] else [print \"Failed\"]"
        );

        assertEquals("Failed\n", es.run(src).output());
    }

    @Test
    void function_definedOnOneLine_isCallable() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "func add(a,b){ print a+b }",
            "add(3,4)"
        );

        assertEquals("7\n", es.run(src).output());
    }

    @Test
    void redefinition_lastDefinitionWins() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "func f(){ print \"first\" }",
            "f()",
            "func f(){ print \"second\" }",
            "f()"
        );

        // deliberate policy: no error, the later body replaces the earlier one
        assertEquals("first\nsecond\n", es.run(src).output());
    }

    @Test
    void function_cannotReadCallerLocals() {
        ValyxoScript es = new ValyxoScript();
        RuntimeState state = es.createRuntime();

        String src = String.join("\n",
            "func f(){ print x }",
            "func g(){ set x = 5; f() }",
            "g()"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.runProgram(state, src));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.kind());

        // frames popped on the error path, x never became global
        assertEquals(1, state.environment().depth());
        assertFalse(state.variables().containsKey("x"));
    }

    @Test
    void infiniteWhile_hitsLoopLimit() {
        ValyxoScript es = new ValyxoScript();

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("while [1] { }"));
        assertEquals(ErrorKind.LOOP_LIMIT_EXCEEDED, e.kind());
        assertEquals(1, e.line());
    }

    @Test
    void loopLimit_stopsAfterExactlyMaxIterations() {
        ValyxoScript es = new ValyxoScript();
        es.setMaxIterations(100);
        RuntimeState state = es.createRuntime();

        String src = String.join("\n",
            "set n = 0",
            "while [True] { set n = n + 1 }"
        );

        assertThrows(ScriptError.class, () -> es.runProgram(state, src));
        assertEquals(Value.integer(100), state.variables().get("n"));
    }

    @Test
    void arithmetic_floorAndTrueDivision() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "set x = 10",
            "set y = 3",
            "set z = x // y",
            "set z2 = x / y"
        );

        Map<String, Value> vars = es.run(src).variables();
        assertEquals(Value.integer(3), vars.get("z"));
        assertEquals(Value.Type.FLOAT, vars.get("z2").type);
        assertEquals(10.0 / 3.0, vars.get("z2").asFloat(), 1e-12);
    }

    @Test
    void stringPlusNumber_isTypeError() {
        ValyxoScript es = new ValyxoScript();

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("set a = \"hi\" + 5"));
        assertEquals(ErrorKind.TYPE_ERROR, e.kind());
        assertEquals(1, e.line());
        assertEquals("set a = \"hi\" + 5", e.source());
    }

    @Test
    void freshRuntimes_areDeterministic() {
        ValyxoScript es = new ValyxoScript();

        String src = String.join("\n",
            "set total = 0",
            "set names = []",
            "for i in 1 to 20 {",
            "  set total = total + i * i",
            "  set names = names + [\"n\" * (i % 3 + 1)]",
            "}",
            "set d = {\"total\": total, \"half\": total / 2}",
            "print total, d",
            "vars"
        );

        ExecutionResult a = es.run(src);
        ExecutionResult b = es.run(src);

        assertEquals(a.output(), b.output());
        assertEquals(a.variables(), b.variables());
        assertTrue(a.output().startsWith("2870 {'total': 2870, 'half': 1435.0}\n"));
    }

    @Test
    void firstErrorStops_earlierAssignmentsStay() {
        ValyxoScript es = new ValyxoScript();
        RuntimeState state = es.createRuntime();

        String src = String.join("\n",
            "set a = 1",
            "set b = 1 / 0",
            "set c = 3"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.runProgram(state, src));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, e.kind());
        assertEquals(2, e.line());

        assertEquals(Value.integer(1), state.variables().get("a"));
        assertFalse(state.variables().containsKey("b"));
        assertFalse(state.variables().containsKey("c"));
    }

    @Test
    void errorListener_seesErrorAndErrorStillThrows() {
        ValyxoScript es = new ValyxoScript();
        List<ScriptError> seen = new ArrayList<>();
        es.setErrorListener((error, state) -> seen.add(error));

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("print missing"));

        assertEquals(1, seen.size());
        assertSame(e, seen.get(0));
    }

    @Test
    void limitsAreCopiedIntoEachRuntime() {
        ValyxoScript es = new ValyxoScript();
        es.setMaxIterations(5);
        RuntimeState small = es.createRuntime();

        es.setMaxIterations(1000);
        RuntimeState large = es.createRuntime();

        String src = "for i in 1 to 10 { set last = i }";

        assertThrows(ScriptError.class, () -> es.runProgram(small, src));
        assertEquals(Value.integer(10), es.runProgram(large, src).variables().get("last"));
        assertEquals(5, small.limits().maxIterations);
    }

    @Test
    void invalidLimit_rejectedWhenRuntimeIsCreated() {
        ValyxoScript es = new ValyxoScript();
        es.setMaxCallDepth(0);

        assertThrows(IllegalArgumentException.class, es::createRuntime);
    }
}
