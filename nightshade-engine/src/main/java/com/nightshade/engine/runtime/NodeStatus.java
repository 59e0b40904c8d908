package com.nightshade.engine.runtime;

/**
 * Runtime status of a node during one run.
 */
public enum NodeStatus {
    /** Not yet entered (or reset for another loop iteration or retry). */
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    /** Condition not met, target window missed, disabled, or skipped by the operator. */
    SKIPPED,
    /** Never finished because the run or its parallel group was cancelled. */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
