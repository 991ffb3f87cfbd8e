package com.valyxo.script.parser;

/** Resource bounds copied into each runtime state when it is created. */
public final class RuntimeLimits {
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;
    public static final long DEFAULT_MAX_TOTAL_ITERATIONS = 1_000_000L;
    public static final int DEFAULT_MAX_CALL_DEPTH = 64;
    public static final int DEFAULT_MAX_VALUE_SIZE = 1_000_000;
    public static final int DEFAULT_MAX_INTEGER_BITS = 4_096;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    public static final RuntimeLimits DEFAULTS = new RuntimeLimits(
            DEFAULT_MAX_ITERATIONS,
            DEFAULT_MAX_TOTAL_ITERATIONS,
            DEFAULT_MAX_CALL_DEPTH,
            DEFAULT_MAX_VALUE_SIZE,
            DEFAULT_MAX_INTEGER_BITS,
            DEFAULT_MAX_NESTING_DEPTH);

    /** Steps allowed for one execution of one loop. */
    public final int maxIterations;
    /** Loop steps allowed across one runLine / runProgram call. */
    public final long maxTotalIterations;
    public final int maxCallDepth;
    /** Longest string, or most list/dict elements, any expression may produce. */
    public final int maxValueSize;
    public final int maxIntegerBits;
    /** Deepest list/dict nesting a value may reach; a flat list has depth 1. */
    public final int maxNestingDepth;

    public RuntimeLimits(int maxIterations, long maxTotalIterations, int maxCallDepth,
                         int maxValueSize, int maxIntegerBits, int maxNestingDepth) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (maxTotalIterations < 1) throw new IllegalArgumentException("maxTotalIterations must be >= 1");
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        if (maxValueSize < 1) throw new IllegalArgumentException("maxValueSize must be >= 1");
        if (maxIntegerBits < 64) throw new IllegalArgumentException("maxIntegerBits must be >= 64");
        if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        this.maxIterations = maxIterations;
        this.maxTotalIterations = maxTotalIterations;
        this.maxCallDepth = maxCallDepth;
        this.maxValueSize = maxValueSize;
        this.maxIntegerBits = maxIntegerBits;
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public String toString() {
        return "RuntimeLimits{maxIterations=" + maxIterations
                + ", maxTotalIterations=" + maxTotalIterations
                + ", maxCallDepth=" + maxCallDepth
                + ", maxValueSize=" + maxValueSize
                + ", maxIntegerBits=" + maxIntegerBits
                + ", maxNestingDepth=" + maxNestingDepth + "}";
    }
}
