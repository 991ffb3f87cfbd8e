package com.valyxo.script.parser;

/**
 * Fatal script failure with source position.
 *
 * The message and suggestion are user-facing: they never contain host stack traces or file paths.
 * Stack traces are not captured at all, the error is a value that travels back to the host.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int line;
    private final String source;
    private final String reason;
    private final String suggestion;

    public ScriptError(ErrorKind kind, int line, String source, String reason, String suggestion) {
        super(kind.displayName() + " [line " + line + "]: " + reason, null, false, false);
        this.kind = kind;
        this.line = line;
        this.source = source;
        this.reason = reason;
        this.suggestion = suggestion;
    }

    public ScriptError(ErrorKind kind, int line, String source, String reason) {
        this(kind, line, source, reason, null);
    }

    public ErrorKind kind() { return kind; }

    /** 1-based line in the user's original source; 0 when no line applies. */
    public int line() { return line; }

    /** Offending source text, may be null. */
    public String source() { return source; }

    public String reason() { return reason; }

    /** Optional hint, may be null. */
    public String suggestion() { return suggestion; }

    /** Same error, re-anchored at the given source line when it has none yet. */
    public ScriptError at(int line, String source) {
        if (this.line > 0 && this.source != null) return this;
        int l = (this.line > 0) ? this.line : line;
        String s = (this.source != null) ? this.source : source;
        return new ScriptError(kind, l, s, reason, suggestion);
    }

    /**
     * Multi-line, user-facing rendering:
     * <pre>
     * UndefinedVariable [line 3]: Unknown variable: 'totl'
     *   Context: print totl
     *   Hint: did you mean 'total'?
     * </pre>
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (source != null && !source.isEmpty()) sb.append("\n  Context: ").append(source);
        if (suggestion != null && !suggestion.isEmpty()) sb.append("\n  Hint: ").append(suggestion);
        return sb.toString();
    }
}
