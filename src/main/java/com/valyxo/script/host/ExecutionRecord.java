package com.valyxo.script.host;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What a host stores per execution: status, serialized variable snapshot on success,
 * sanitized error text on failure, wall-clock duration.
 */
public final class ExecutionRecord {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private final String status;
    private final String output;
    private final String printed;
    private final String error;
    private final long durationMs;

    private ExecutionRecord(String status, String output, String printed, String error, long durationMs) {
        this.status = status;
        this.output = output;
        this.printed = printed;
        this.error = error;
        this.durationMs = durationMs;
    }

    static ExecutionRecord success(String variablesJson, String printed, long durationMs) {
        return new ExecutionRecord(SUCCESS, variablesJson, printed, null, durationMs);
    }

    static ExecutionRecord error(String message, String printed, long durationMs) {
        return new ExecutionRecord(ERROR, null, printed, message, durationMs);
    }

    public String status() { return status; }
    public boolean isSuccess() { return SUCCESS.equals(status); }

    /** JSON object of the final globals; null on error. */
    public String output() { return output; }

    /** Text printed before the run ended; empty when nothing was printed or the state was discarded. */
    public String printed() { return printed; }

    /** Sanitized error text; null on success. */
    public String error() { return error; }

    public long durationMs() { return durationMs; }

    public ObjectNode toJson() {
        ObjectNode obj = ValueJson.mapper().createObjectNode();
        obj.put("status", status);
        if (output != null) obj.put("output", output);
        else obj.putNull("output");
        obj.put("printed", printed);
        if (error != null) obj.put("error", error);
        else obj.putNull("error");
        obj.put("durationMs", durationMs);
        return obj;
    }

    public String toJsonString() {
        return ValueJson.write(toJson());
    }

    @Override
    public String toString() {
        return toJsonString();
    }
}
