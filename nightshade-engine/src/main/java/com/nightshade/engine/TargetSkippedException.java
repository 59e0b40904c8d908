package com.nightshade.engine;

/**
 * Unwinds to the enclosing target header, which marks its remaining work skipped and lets
 * the run continue with the next target.
 */
public class TargetSkippedException extends RuntimeException {

    private final String nodeId;

    public TargetSkippedException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    /** Node that requested the skip. */
    public String getNodeId() {
        return nodeId;
    }
}
