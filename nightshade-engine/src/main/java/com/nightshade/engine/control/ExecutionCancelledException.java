package com.nightshade.engine.control;

/**
 * Cooperative cancellation observed by a handler. {@code midOperation} is true when a device
 * operation was aborted in flight rather than at a node or frame boundary.
 */
public class ExecutionCancelledException extends RuntimeException {

    private final CancellationReason reason;
    private final String nodeId;
    private final boolean midOperation;

    public ExecutionCancelledException(CancellationReason reason, String nodeId, boolean midOperation) {
        super("Cancelled (" + reason + ") at node " + nodeId);
        this.reason = reason;
        this.nodeId = nodeId;
        this.midOperation = midOperation;
    }

    public CancellationReason getReason() {
        return reason;
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isMidOperation() {
        return midOperation;
    }
}
