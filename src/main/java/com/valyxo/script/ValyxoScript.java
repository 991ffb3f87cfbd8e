package com.valyxo.script;

import java.util.List;
import java.util.regex.Pattern;

import com.valyxo.debug.Debug;
import com.valyxo.script.parser.ErrorKind;
import com.valyxo.script.parser.Evaluator;
import com.valyxo.script.parser.ExecutionResult;
import com.valyxo.script.parser.Expr.ExprInterface;
import com.valyxo.script.parser.Interpreter;
import com.valyxo.script.parser.Parser;
import com.valyxo.script.parser.RuntimeLimits;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;
import com.valyxo.script.parser.SourceLine;
import com.valyxo.script.parser.Statement.Stmt;
import com.valyxo.script.parser.StatementSplitter;
import com.valyxo.script.parser.Value;

/**
 * Core ValyxoScript engine.
 *
 * - Line-oriented commands: set / print / if-then-else / for / while / func / call / vars / exit
 * - Types: int (arbitrary precision, capped), float, str, bool, list, dict, None
 * - Sandboxed: expressions are a closed grammar, no host calls
 * - Bounded: per-loop and per-run iteration caps, call depth, value and integer size caps
 *
 * The engine only holds configuration. All execution state lives in a {@link RuntimeState};
 * limits are copied into each state when {@link #createRuntime()} runs.
 */
public class ValyxoScript {
    private static final String TAG = "ValyxoScript";
    private static final Pattern ELSE_LINE = Pattern.compile("^else\\b");

    private int maxIterations = RuntimeLimits.DEFAULT_MAX_ITERATIONS;
    private long maxTotalIterations = RuntimeLimits.DEFAULT_MAX_TOTAL_ITERATIONS;
    private int maxCallDepth = RuntimeLimits.DEFAULT_MAX_CALL_DEPTH;
    private int maxValueSize = RuntimeLimits.DEFAULT_MAX_VALUE_SIZE;
    private int maxIntegerBits = RuntimeLimits.DEFAULT_MAX_INTEGER_BITS;
    private int maxNestingDepth = RuntimeLimits.DEFAULT_MAX_NESTING_DEPTH;

    private ScriptErrorListener errorListener = null;

    public ValyxoScript() {}

    // ===================== CONFIGURATION =====================

    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public void setMaxTotalIterations(long maxTotalIterations) { this.maxTotalIterations = maxTotalIterations; }
    public void setMaxCallDepth(int depth) { this.maxCallDepth = depth; }
    public void setMaxValueSize(int maxValueSize) { this.maxValueSize = maxValueSize; }
    public void setMaxIntegerBits(int maxIntegerBits) { this.maxIntegerBits = maxIntegerBits; }
    public void setMaxNestingDepth(int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }

    public int getMaxIterations() { return maxIterations; }
    public long getMaxTotalIterations() { return maxTotalIterations; }
    public int getMaxCallDepth() { return maxCallDepth; }
    public int getMaxValueSize() { return maxValueSize; }
    public int getMaxIntegerBits() { return maxIntegerBits; }
    public int getMaxNestingDepth() { return maxNestingDepth; }

    /** Registers the host listener for fatal errors; null removes it. */
    public void setErrorListener(ScriptErrorListener listener) { this.errorListener = listener; }

    /** @throws IllegalArgumentException if a configured limit is out of range */
    public RuntimeLimits limits() {
        return new RuntimeLimits(maxIterations, maxTotalIterations, maxCallDepth, maxValueSize, maxIntegerBits,
                maxNestingDepth);
    }

    // ===================== ENGINE PUBLIC API =====================

    public RuntimeState createRuntime() {
        return new RuntimeState(limits());
    }

    /**
     * Feeds one line. A line that opens a block is buffered until the matching '}' arrives, then the
     * whole block runs. There is no lookahead here, so an 'else' must share the line of the '}' it follows.
     *
     * @throws ScriptError on the first fatal error; the pending block is discarded
     */
    public void runLine(RuntimeState state, String text) {
        SourceLine line = new SourceLine(state.nextLineNumber(), text == null ? "" : text.trim());
        state.beginExecution();
        if (StatementSplitter.isBlankOrComment(line.text)) return;
        feed(state, line, false);
    }

    /**
     * Runs a whole script against the given state and returns the accumulated output and globals.
     * Execution stops at the first fatal error or at 'exit'.
     *
     * @throws ScriptError on the first fatal error
     */
    public ExecutionResult runProgram(RuntimeState state, String source) {
        state.beginExecution();
        List<SourceLine> lines = StatementSplitter.split(source);

        for (int i = 0; i < lines.size(); i++) {
            SourceLine next = (i + 1 < lines.size()) ? lines.get(i + 1) : null;
            boolean holdForElse = next != null && ELSE_LINE.matcher(next.text).find();
            if (!feed(state, lines.get(i), holdForElse)) break;
        }

        if (state.isBlockOpen()) {
            ScriptError unclosed = new ScriptError(ErrorKind.SYNTAX_ERROR,
                    state.pendingBlock().openedAt(), state.pendingBlock().openedText(),
                    "Unclosed block", "Add a closing '}'");
            state.pendingBlock().clear();
            throw report(unclosed, state);
        }
        return new ExecutionResult(state.output(), state.variables());
    }

    /** Runs a script on a fresh runtime. */
    public ExecutionResult run(String source) {
        return runProgram(createRuntime(), source);
    }

    /** Parses a single expression without evaluating it. */
    public ExprInterface parseExpression(String text) {
        return Parser.parseExpression(text);
    }

    /** Evaluates a single expression against the state's current variables. */
    public Value evaluate(RuntimeState state, String text) {
        try {
            ExprInterface expr = Parser.parseExpression(text);
            return new Evaluator(state.environment(), state.limits()).eval(expr);
        } catch (ScriptError e) {
            throw report(e, state);
        }
    }

    // ===================== EXECUTION =====================

    /** @return false once 'exit' has run */
    private boolean feed(RuntimeState state, SourceLine line, boolean holdForElse) {
        try {
            List<SourceLine> chunk = state.pendingBlock().feed(line, holdForElse);
            if (chunk == null) return true;

            List<Stmt> program = Parser.parseProgram(chunk);
            return new Interpreter(state).run(program);
        } catch (ScriptError e) {
            state.pendingBlock().clear();
            throw report(e, state);
        } catch (StackOverflowError so) {
            state.pendingBlock().clear();
            throw report(new ScriptError(ErrorKind.RESOURCE_LIMIT_EXCEEDED, line.number, line.text,
                    "Nesting too deep", "Simplify the expression or reduce recursion"), state);
        }
    }

    private ScriptError report(ScriptError e, RuntimeState state) {
        Debug.get().e(TAG, e.kind() + " at line " + e.line() + ": " + e.reason());
        ScriptErrorListener listener = this.errorListener;
        if (listener != null) {
            try {
                listener.onError(e, state);
            } catch (RuntimeException listenerFailure) {
                // the script error stays the one the caller sees
                Debug.get().e(TAG, "Error listener failed", listenerFailure);
            }
        }
        return e;
    }
}
