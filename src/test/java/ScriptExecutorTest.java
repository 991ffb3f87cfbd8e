import com.fasterxml.jackson.databind.JsonNode;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.host.ExecutionRecord;
import com.valyxo.script.host.ScriptExecutor;
import com.valyxo.script.host.ValueJson;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptExecutorTest {

    @Test
    void success_recordsVariableSnapshotAsJson() throws Exception {
        try (ScriptExecutor executor = new ScriptExecutor(new ValyxoScript(), 2, 5_000)) {
            ExecutionRecord rec = executor.execute(String.join("\n",
                "set x = 10",
                "set y = 20",
                "set sum = x + y",
                "print sum"
            ));

            assertTrue(rec.isSuccess());
            assertEquals(ExecutionRecord.SUCCESS, rec.status());
            assertEquals("{\"x\":10,\"y\":20,\"sum\":30}", rec.output());
            assertEquals("30\n", rec.printed());
            assertNull(rec.error());
            assertTrue(rec.durationMs() >= 0);

            JsonNode json = ValueJson.mapper().readTree(rec.toJsonString());
            assertEquals("success", json.get("status").asText());
            assertTrue(json.get("error").isNull());
            assertTrue(json.has("durationMs"));
        }
    }

    @Test
    void scriptError_recordsSanitizedMessage() {
        try (ScriptExecutor executor = new ScriptExecutor(new ValyxoScript(), 1, 5_000)) {
            ExecutionRecord rec = executor.execute(String.join("\n",
                "print \"before\"",
                "set a = \"hi\" + 5"
            ));

            assertFalse(rec.isSuccess());
            assertEquals(ExecutionRecord.ERROR, rec.status());
            assertNull(rec.output());
            assertTrue(rec.error().startsWith("TypeError [line 2]"));
            assertTrue(rec.error().contains("Context: set a = \"hi\" + 5"));
            assertEquals("before\n", rec.printed());
        }
    }

    @Test
    void deeplyNestedValue_isRecordedAsResourceLimit() {
        String src = String.join("\n",
            "set a = []",
            "for i in 1 to 1001 {",
            "  set a = [a]",
            "}"
        );

        try (ScriptExecutor executor = new ScriptExecutor(new ValyxoScript(), 1, 5_000)) {
            ExecutionRecord rec = executor.execute(src);

            assertFalse(rec.isSuccess());
            assertNull(rec.output());
            assertTrue(rec.error().startsWith("ResourceLimitExceeded [line 3]"), rec.error());
        }
    }

    @Test
    void unserializableSnapshot_isRecordedAsError() {
        ValyxoScript engine = new ValyxoScript();
        engine.setMaxNestingDepth(5_000);

        try (ScriptExecutor executor = new ScriptExecutor(engine, 1, 10_000)) {
            ExecutionRecord rec = assertDoesNotThrow(() -> executor.execute(String.join("\n",
                "set a = []",
                "for i in 1 to 1500 {",
                "  set a = [a]",
                "}",
                "print \"built\""
            )));

            assertFalse(rec.isSuccess());
            assertTrue(rec.error().startsWith("ResourceLimitExceeded"), rec.error());
            assertEquals("built\n", rec.printed());
        }
    }

    @Test
    void deadlineOverrun_isRecordedAsError() {
        ValyxoScript engine = new ValyxoScript();
        engine.setMaxIterations(3_000_000);
        engine.setMaxTotalIterations(3_000_000);

        try (ScriptExecutor executor = new ScriptExecutor(engine, 1, 1)) {
            ExecutionRecord rec = executor.execute("set n = 0\nwhile [True] { set n = n + 1 }");

            assertFalse(rec.isSuccess());
            assertTrue(rec.error().startsWith("Timeout"));
        }
    }

    @Test
    void concurrentExecutions_areIndependent() throws Exception {
        ValyxoScript engine = new ValyxoScript();
        ExecutorService callers = Executors.newFixedThreadPool(4);

        try (ScriptExecutor executor = new ScriptExecutor(engine, 4, 10_000)) {
            List<Future<ExecutionRecord>> futures = new ArrayList<>();
            for (int k = 0; k < 8; k++) {
                final int seed = k;
                futures.add(callers.submit(() -> executor.execute(String.join("\n",
                    "set acc = 0",
                    "for i in 1 to 1000 { set acc = acc + " + seed + " }"
                ))));
            }

            for (int k = 0; k < futures.size(); k++) {
                ExecutionRecord rec = futures.get(k).get();
                assertTrue(rec.isSuccess(), rec.error());
                JsonNode vars = ValueJson.mapper().readTree(rec.output());
                assertEquals(1000L * k, vars.get("acc").asLong());
            }
        } finally {
            callers.shutdownNow();
        }
    }
}
