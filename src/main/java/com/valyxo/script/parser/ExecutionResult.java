package com.valyxo.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Accumulated output plus the final global variables of one program run. */
public final class ExecutionResult {
    private final String output;
    private final Map<String, Value> variables;

    public ExecutionResult(String output, Map<String, Value> variables) {
        this.output = output;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /** Printed lines, each terminated by '\n'. */
    public String output() {
        return output;
    }

    /** Global frame snapshot in definition order. */
    public Map<String, Value> variables() {
        return variables;
    }

    @Override
    public String toString() {
        return "ExecutionResult{output=" + output.length() + " chars, variables=" + variables + "}";
    }
}
