package com.valyxo.script.parser;

/** Every way a script execution can fail. All kinds abort the current execution, none affect the host. */
public enum ErrorKind {
    SYNTAX_ERROR("SyntaxError"),
    UNDEFINED_VARIABLE("UndefinedVariable"),
    UNDEFINED_FUNCTION("UndefinedFunction"),
    ARITY_MISMATCH("ArityMismatch"),
    TYPE_ERROR("TypeError"),
    DIVISION_BY_ZERO("DivisionByZero"),
    LOOP_LIMIT_EXCEEDED("LoopLimitExceeded"),
    RESOURCE_LIMIT_EXCEEDED("ResourceLimitExceeded");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
