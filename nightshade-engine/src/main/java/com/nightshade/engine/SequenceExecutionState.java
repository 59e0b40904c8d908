package com.nightshade.engine;

/**
 * Run-level state. {@link #COMPLETED}, {@link #FAILED} and {@link #STOPPED} are terminal.
 */
public enum SequenceExecutionState {
    IDLE,
    RUNNING,
    PAUSED,
    /** Stop requested; in-flight work is being cancelled. */
    STOPPING,
    COMPLETED,
    FAILED,
    /** Operator stopped the run between device operations. */
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED || this == STOPPING;
    }
}
