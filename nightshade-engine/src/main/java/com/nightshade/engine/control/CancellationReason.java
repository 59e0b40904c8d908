package com.nightshade.engine.control;

public enum CancellationReason {
    /** Operator stopped the run. */
    STOP,
    /** A parallel group reached its success threshold; remaining branches are no longer needed. */
    SIBLING,
    /** Operator skipped the current instruction. */
    SKIP
}
