package com.nightshade.engine;

/**
 * Fails the whole run regardless of enclosing recovery policy (park-and-abort).
 */
public class SequenceAbortedException extends RuntimeException {

    private final String nodeId;

    public SequenceAbortedException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
