package com.valyxo.script.host;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.valyxo.debug.Debug;
import com.valyxo.debug.DebugLevel;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.parser.ExecutionResult;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;

/**
 * Runs scripts on a worker pool, one fresh {@link RuntimeState} per execution, under a wall-clock deadline.
 *
 * The interpreter has no cancellation point: a run that misses its deadline is recorded as an error and its
 * state discarded, while the worker thread finishes on its own once the iteration caps stop it.
 */
public final class ScriptExecutor implements AutoCloseable {
    private static final String TAG = "ScriptExecutor";
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;

    private final ValyxoScript engine;
    private final ExecutorService pool;
    private final long timeoutMs;

    public ScriptExecutor(ValyxoScript engine, int threads, long timeoutMs) {
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be > 0");
        this.engine = engine;
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        this.timeoutMs = timeoutMs;
    }

    public ScriptExecutor(ValyxoScript engine) {
        this(engine, Runtime.getRuntime().availableProcessors(), DEFAULT_TIMEOUT_MS);
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public ExecutionRecord execute(String source) {
        long t0 = System.nanoTime();
        RuntimeState state = engine.createRuntime();
        Debug.get().i(TAG, "execution started (" + source.length() + " chars)");

        // snapshot serialization runs on the worker as well
        Future<ExecutionRecord> future = pool.submit(() -> snapshot(engine.runProgram(state, source), t0));
        ExecutionRecord record;
        try {
            record = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            record = ExecutionRecord.error("Timeout: execution exceeded " + timeoutMs + " ms", "", elapsedMs(t0));
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof ScriptError) {
                record = ExecutionRecord.error(((ScriptError) cause).describe(), state.output(), elapsedMs(t0));
            } else {
                Debug.get().e(TAG, "internal failure while executing script", cause);
                record = ExecutionRecord.error("InternalError: script execution failed", "", elapsedMs(t0));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            record = ExecutionRecord.error("Interrupted: execution was cancelled", "", elapsedMs(t0));
        }

        Debug.get().i(TAG, "execution finished: " + record.status() + " in " + record.durationMs() + " ms");
        return record;
    }

    private static ExecutionRecord snapshot(ExecutionResult result, long t0) {
        String variables;
        try {
            variables = ValueJson.toJsonString(result.variables());
        } catch (RuntimeException e) {
            Debug.get().log(DebugLevel.WARN, TAG, "variable snapshot could not be serialized", e);
            return ExecutionRecord.error("ResourceLimitExceeded: variable snapshot could not be serialized",
                    result.output(), elapsedMs(t0));
        }
        return ExecutionRecord.success(variables, result.output(), elapsedMs(t0));
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
