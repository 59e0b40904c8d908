package com.nightshade.preflight;

/**
 * Severity of a preflight issue.
 */
public enum ValidationSeverity {
    /** Blocks the run from starting. */
    ERROR,
    /** Surfaced to the operator; the run may start after an explicit override. */
    WARNING,
    /** Advisory only. */
    INFO
}
