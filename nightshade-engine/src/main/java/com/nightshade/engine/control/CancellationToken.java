package com.nightshade.engine.control;

/**
 * Hierarchical cancellation flag. Cancelling a token cancels every token derived from it;
 * cancelling a child leaves the parent untouched. The first reason recorded wins.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private volatile CancellationReason reason;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken root() {
        return new CancellationToken(null);
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public synchronized void cancel(CancellationReason cancellationReason) {
        if (reason == null) {
            reason = cancellationReason;
        }
    }

    public boolean isCancelled() {
        return reason() != null;
    }

    /** Own reason, else the nearest cancelled ancestor's, else null. */
    public CancellationReason reason() {
        CancellationReason own = reason;
        if (own != null) return own;
        return parent != null ? parent.reason() : null;
    }

    public void throwIfCancelled(String nodeId, boolean midOperation) {
        CancellationReason r = reason();
        if (r != null) {
            throw new ExecutionCancelledException(r, nodeId, midOperation);
        }
    }
}
