package com.valyxo.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.valyxo.debug.Debug;
import com.valyxo.debug.DebugLevel;
import com.valyxo.script.host.ExecutionRecord;
import com.valyxo.script.host.ScriptExecutor;

/**
 * Usage:
 * <pre>
 *   ValyxoCli [options] &lt;script-file&gt;   run a file
 *   ValyxoCli [options]                 interactive REPL
 *
 *   --json               print the execution record as JSON
 *   --max-iterations=N   per-loop iteration cap
 *   --max-call-depth=N   nested call cap
 *   --timeout-ms=N       wall-clock deadline for a file run
 *   --verbose            log to the console
 * </pre>
 */
public final class ValyxoCli {
    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: ValyxoCli [--json] [--verbose] [--max-iterations=N] [--max-call-depth=N] [--timeout-ms=N] [script-file]";

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, stdin, System.out, System.err));
    }

    static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) {
        ValyxoScript engine = new ValyxoScript();
        boolean json = false;
        long timeoutMs = ScriptExecutor.DEFAULT_TIMEOUT_MS;
        String file = null;

        try {
            for (String a : args) {
                if (a.equals("--json")) {
                    json = true;
                } else if (a.equals("--verbose")) {
                    Debug.useSysOut(DebugLevel.DEBUG);
                } else if (a.startsWith("--max-iterations=")) {
                    engine.setMaxIterations(Integer.parseInt(valueOf(a)));
                } else if (a.startsWith("--max-call-depth=")) {
                    engine.setMaxCallDepth(Integer.parseInt(valueOf(a)));
                } else if (a.startsWith("--timeout-ms=")) {
                    timeoutMs = Long.parseLong(valueOf(a));
                } else if (a.startsWith("--")) {
                    err.println("Unknown option: " + a);
                    err.println(USAGE);
                    return EXIT_USAGE;
                } else if (file == null) {
                    file = a;
                } else {
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
            }
            // fail fast on bad limits
            engine.limits();
        } catch (IllegalArgumentException e) {
            err.println("Invalid option: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (file == null) {
            try {
                new ValyxoRepl(engine, out, err).run(in);
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_IO;
            }
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            return EXIT_IO;
        }

        ExecutionRecord record;
        try (ScriptExecutor executor = new ScriptExecutor(engine, 1, timeoutMs)) {
            record = executor.execute(script);
        } catch (IllegalArgumentException e) {
            err.println("Invalid option: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (json) {
            out.println(record.toJsonString());
        } else {
            out.print(record.printed());
            if (!record.isSuccess()) err.println(record.error());
        }
        out.flush();
        return record.isSuccess() ? EXIT_OK : EXIT_SCRIPT_ERROR;
    }

    private static String valueOf(String option) {
        return option.substring(option.indexOf('=') + 1);
    }

    private ValyxoCli() {}
}
