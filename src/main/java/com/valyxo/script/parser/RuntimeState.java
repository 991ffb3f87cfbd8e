package com.valyxo.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Mutable execution context for one script's lifetime: environment, functions, counters, output.
 *
 * Not thread-safe. A state must only be touched by one thread at a time; separate states share nothing.
 */
public class RuntimeState {
    private final RuntimeLimits limits;
    private final Environment env = new Environment();
    private final FunctionRegistry functions = new FunctionRegistry();
    private final BlockBuffer pending = new BlockBuffer();
    private final List<String> output = new ArrayList<>();

    private long outputChars = 0;
    private long totalIterations = 0;
    private int linesFed = 0;
    private boolean exited = false;

    public RuntimeState(RuntimeLimits limits) {
        this.limits = limits;
    }

    public RuntimeState() {
        this(RuntimeLimits.DEFAULTS);
    }

    public RuntimeLimits limits() { return limits; }
    public Environment environment() { return env; }
    public FunctionRegistry registry() { return functions; }

    /** Lines of an unfinished block fed through runLine. */
    public BlockBuffer pendingBlock() { return pending; }

    public boolean isBlockOpen() { return pending.isOpen(); }

    /** True once an 'exit' statement ran; cleared by {@link #reset()}. */
    public boolean hasExited() { return exited; }

    void markExited() { exited = true; }

    // -------------------------
    // Output
    // -------------------------

    /** Everything printed so far, one '\n'-terminated line per print. */
    public String output() {
        StringBuilder sb = new StringBuilder();
        for (String line : output) sb.append(line).append('\n');
        return sb.toString();
    }

    public List<String> outputLines() {
        return Collections.unmodifiableList(output);
    }

    void appendOutput(String line) {
        long next = outputChars + line.length() + 1;
        if (next > limits.maxValueSize) {
            throw new ScriptError(ErrorKind.RESOURCE_LIMIT_EXCEEDED, 0, null,
                    "output exceeds " + limits.maxValueSize + " characters", null);
        }
        outputChars = next;
        output.add(line);
    }

    // -------------------------
    // Snapshots
    // -------------------------

    public Map<String, Value> variables() {
        return env.snapshotGlobals();
    }

    public Map<String, UserFunction> functions() {
        return functions.all();
    }

    // -------------------------
    // Counters
    // -------------------------

    /** Line number given to the next line fed through runLine. */
    public int nextLineNumber() {
        return ++linesFed;
    }

    /** Starts a new runLine / runProgram budget. */
    public void beginExecution() {
        totalIterations = 0;
    }

    void countIteration(int line, String source) {
        if (++totalIterations > limits.maxTotalIterations) {
            throw new ScriptError(ErrorKind.LOOP_LIMIT_EXCEEDED, line, source,
                    "Execution exceeded " + limits.maxTotalIterations + " loop iterations in total",
                    "Reduce the loop bounds or split the work across several runs");
        }
    }

    /** Disposes everything so the state can be reused as if fresh. */
    public void reset() {
        env.clear();
        functions.clear();
        pending.clear();
        output.clear();
        outputChars = 0;
        totalIterations = 0;
        linesFed = 0;
        exited = false;
    }
}
