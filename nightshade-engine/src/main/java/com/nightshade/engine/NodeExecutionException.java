package com.nightshade.engine;

/**
 * A node failed: device error, timeout, fired trigger or exhausted recovery. Recovery nodes
 * absorb it; anywhere else it fails the run with the node id preserved for diagnosis.
 */
public class NodeExecutionException extends RuntimeException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
