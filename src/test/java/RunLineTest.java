import com.valyxo.script.ValyxoRepl;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;
import com.valyxo.script.parser.Value;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RunLineTest {

    private final ValyxoScript es = new ValyxoScript();

    @Test
    void statePersistsAcrossLines_blocksAreBuffered() {
        RuntimeState state = es.createRuntime();

        es.runLine(state, "set x = 1");
        es.runLine(state, "func f(a) {");
        assertTrue(state.isBlockOpen());
        es.runLine(state, "print a + x");
        es.runLine(state, "}");
        assertFalse(state.isBlockOpen());
        es.runLine(state, "f(2)");

        assertEquals("3\n", state.output());
        assertEquals(Value.integer(1), state.variables().get("x"));
        assertTrue(state.functions().containsKey("f"));
    }

    @Test
    void rejectedPrint_doesNotConsumeOutputBudget() {
        ValyxoScript small = new ValyxoScript();
        small.setMaxValueSize(20);
        RuntimeState state = small.createRuntime();

        ScriptError e = assertThrows(ScriptError.class,
                () -> small.runLine(state, "print \"abcdefghijklmnopqrstuvwxy\""));
        assertEquals(ErrorKind.RESOURCE_LIMIT_EXCEEDED, e.kind());
        assertEquals("", state.output());

        small.runLine(state, "print \"0123456789\"");
        small.runLine(state, "print \"abcdefgh\"");
        assertEquals("0123456789\nabcdefgh\n", state.output());
    }

    @Test
    void blankAndCommentLines_areIgnored() {
        RuntimeState state = es.createRuntime();

        es.runLine(state, "   ");
        es.runLine(state, "# note");
        es.runLine(state, null);

        assertEquals("", state.output());
    }

    @Test
    void strayBrace_isSyntaxError() {
        RuntimeState state = es.createRuntime();

        ScriptError e = assertThrows(ScriptError.class, () -> es.runLine(state, "}"));
        assertEquals(ErrorKind.SYNTAX_ERROR, e.kind());
        assertEquals("Unexpected closing brace '}'", e.reason());
    }

    @Test
    void failingBlock_isDiscarded_stateStaysUsable() {
        RuntimeState state = es.createRuntime();

        es.runLine(state, "while [1] {");
        assertThrows(ScriptError.class, () -> es.runLine(state, "}"));
        assertFalse(state.isBlockOpen());

        es.runLine(state, "print 5");
        assertEquals("5\n", state.output());
    }

    @Test
    void lineNumbers_countFedLines() {
        RuntimeState state = es.createRuntime();

        es.runLine(state, "set a = 1");
        ScriptError e = assertThrows(ScriptError.class, () -> es.runLine(state, "print b"));

        assertEquals(2, e.line());
        assertEquals("Did you mean to set 'b' first? Use: set b = value", e.suggestion());
    }

    @Test
    void elseOnSameLineAsClosingBrace() {
        RuntimeState state = es.createRuntime();

        es.runLine(state, "if [0] then {");
        es.runLine(state, "print 1");
        es.runLine(state, "} else {");
        es.runLine(state, "print 2");
        es.runLine(state, "}");

        assertEquals("2\n", state.output());
    }

    @Test
    void iterationBudget_isPerRunLineCall() {
        ValyxoScript small = new ValyxoScript();
        small.setMaxTotalIterations(15);
        RuntimeState state = small.createRuntime();

        // 10 steps each, 20 in total across the two calls
        small.runLine(state, "for i in 1 to 10 { set a = i }");
        small.runLine(state, "for i in 1 to 10 { set b = i }");

        assertEquals(Value.integer(10), state.variables().get("b"));
    }

    @Test
    void reset_disposesEverything() {
        RuntimeState state = es.createRuntime();
        es.runLine(state, "set a = 1");
        es.runLine(state, "func f() { print a }");
        es.runLine(state, "f()");
        es.runLine(state, "while [a] {");

        state.reset();

        assertTrue(state.variables().isEmpty());
        assertTrue(state.functions().isEmpty());
        assertEquals("", state.output());
        assertFalse(state.isBlockOpen());
    }

    // -------------------------
    // REPL front end
    // -------------------------

    private static String text(ByteArrayOutputStream bytes) {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void repl_printsNewOutputAndReportsErrors() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ValyxoRepl repl = new ValyxoRepl(es, new PrintStream(out, true), new PrintStream(err, true));

        assertTrue(repl.handle("set x = 2"));
        assertTrue(repl.handle("print x * 21"));
        assertTrue(repl.handle("print y"));
        assertTrue(repl.handle(":vars"));

        String o = text(out);
        assertTrue(o.contains("42"));
        assertTrue(o.contains("{\"x\":2}"));
        assertTrue(text(err).startsWith("UndefinedVariable [line 3]"));
    }

    @Test
    void repl_promptsWhileBlockOpen() {
        ValyxoRepl repl = new ValyxoRepl(es, new PrintStream(new ByteArrayOutputStream()), new PrintStream(new ByteArrayOutputStream()));

        assertEquals(ValyxoRepl.PROMPT, repl.prompt());
        repl.handle("for i in 1 to 2 {");
        assertEquals(ValyxoRepl.CONTINUATION_PROMPT, repl.prompt());
        repl.handle("}");
        assertEquals(ValyxoRepl.PROMPT, repl.prompt());
    }

    @Test
    void repl_quitResetAndExit() {
        ValyxoRepl repl = new ValyxoRepl(es, new PrintStream(new ByteArrayOutputStream()), new PrintStream(new ByteArrayOutputStream()));

        repl.handle("set a = 1");
        assertTrue(repl.handle(":reset"));
        assertTrue(repl.state().variables().isEmpty());

        assertFalse(repl.handle(":quit"));
        assertFalse(repl.handle("exit"));
    }

    @Test
    void repl_runsUntilQuit() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ValyxoRepl repl = new ValyxoRepl(es, new PrintStream(out, true), new PrintStream(new ByteArrayOutputStream()));

        repl.run(new BufferedReader(new StringReader("set a = 1\nprint a + 1\n:quit\nprint 99\n")));

        String o = text(out);
        assertTrue(o.contains(ValyxoRepl.PROMPT + "2"));
        assertFalse(o.contains("99"));
    }
}
