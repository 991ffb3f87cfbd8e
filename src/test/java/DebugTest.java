import com.valyxo.debug.Debug;
import com.valyxo.debug.DebugLevel;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.ScriptError;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @Test
    void defaultSink_isInstalledWithoutSetup() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().w("DebugTest", "no sink configured"));
        assertDoesNotThrow(() -> Debug.get().log(DebugLevel.ERROR, "DebugTest", "with cause", new RuntimeException("x")));
    }

    @Test
    void loggingPaths_workWithDefaultSink() {
        ValyxoScript es = new ValyxoScript();

        assertEquals("7\n", es.run("func add(a, b) { print a + b }\nadd(3, 4)").output());

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("set a = \"hi\" + 5"));
        assertEquals(ErrorKind.TYPE_ERROR, e.kind());
    }
}
