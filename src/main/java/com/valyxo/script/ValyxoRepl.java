package com.valyxo.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import com.valyxo.script.host.ValueJson;
import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;

/**
 * Interactive session over one {@link RuntimeState}.
 *
 * Commands:
 *  - :vars   dump globals as JSON
 *  - :reset  clear variables, functions and any open block
 *  - :quit   leave (so does the 'exit' statement)
 *
 * Errors are reported and the session continues with the state as it was left.
 */
public final class ValyxoRepl {
    public static final String PROMPT = ">>> ";
    public static final String CONTINUATION_PROMPT = "... ";

    private final ValyxoScript engine;
    private final RuntimeState state;
    private final PrintStream out;
    private final PrintStream err;

    public ValyxoRepl(ValyxoScript engine, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.state = engine.createRuntime();
        this.out = out;
        this.err = err;
    }

    public RuntimeState state() {
        return state;
    }

    public String prompt() {
        return state.isBlockOpen() ? CONTINUATION_PROMPT : PROMPT;
    }

    /** @return false when the session should end */
    public boolean handle(String line) {
        String trimmed = line.trim();
        switch (trimmed) {
            case ":quit":
                return false;
            case ":vars":
                out.println(ValueJson.toJsonString(state.variables()));
                return true;
            case ":reset":
                state.reset();
                out.println("(state cleared)");
                return true;
            case ":help":
                out.println("Commands: :vars, :reset, :quit. Anything else runs as a script line.");
                return true;
            default:
                break;
        }

        int mark = state.outputLines().size();
        try {
            engine.runLine(state, line);
        } catch (ScriptError e) {
            err.println(e.describe());
        } finally {
            List<String> lines = state.outputLines();
            for (int i = mark; i < lines.size(); i++) out.println(lines.get(i));
        }
        return !state.hasExited();
    }

    public void run(BufferedReader in) throws IOException {
        out.println("ValyxoScript REPL. Type :help for commands.");
        while (true) {
            out.print(prompt());
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            if (!handle(line)) break;
        }
    }
}
