import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.ScriptError;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptErrorTest {

    private final ValyxoScript es = new ValyxoScript();

    @Test
    void describe_rendersKindLineContextAndHint() {
        String src = String.join("\n",
            "set total = 1",
            "print totl"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.run(src));

        assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.kind());
        assertEquals(2, e.line());
        assertEquals("print totl", e.source());
        assertEquals(
            "UndefinedVariable [line 2]: Unknown variable: 'totl'\n"
                + "  Context: print totl\n"
                + "  Hint: did you mean 'total'?",
            e.describe());
    }

    @Test
    void errorsCarryNoHostStackTrace() {
        ScriptError e = assertThrows(ScriptError.class, () -> es.run("set x = 1 / 0"));

        assertEquals(0, e.getStackTrace().length);
        assertFalse(e.describe().contains("at com."));
        assertFalse(e.describe().contains(".java"));
    }

    @Test
    void nestedError_anchoredAtInnermostStatement() {
        String src = String.join("\n",
            "for i in 1 to 3 {",
            "  if [i == 2] then {",
            "    set bad = i + \"x\"",
            "  }",
            "}"
        );

        ScriptError e = assertThrows(ScriptError.class, () -> es.run(src));
        assertEquals(ErrorKind.TYPE_ERROR, e.kind());
        assertEquals(3, e.line());
        assertEquals("set bad = i + \"x\"", e.source());
    }

    @Test
    void failingListener_doesNotReplaceScriptError() {
        es.setErrorListener((error, state) -> {
            throw new IllegalStateException("listener broke");
        });

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("print nope"));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.kind());
    }

    @Test
    void at_onlyFillsMissingPosition() {
        ScriptError bare = new ScriptError(ErrorKind.TYPE_ERROR, 0, null, "bad");
        ScriptError anchored = bare.at(7, "print x");

        assertEquals(7, anchored.line());
        assertEquals("print x", anchored.source());
        assertSame(anchored, anchored.at(9, "other"));
        assertEquals("TypeError [line 7]: bad", anchored.getMessage());
    }

    @Test
    void kindDisplayNames() {
        assertEquals("SyntaxError", ErrorKind.SYNTAX_ERROR.toString());
        assertEquals("ArityMismatch", ErrorKind.ARITY_MISMATCH.displayName());
        assertEquals("LoopLimitExceeded", ErrorKind.LOOP_LIMIT_EXCEEDED.displayName());
        assertEquals("ResourceLimitExceeded", ErrorKind.RESOURCE_LIMIT_EXCEEDED.displayName());
    }
}
