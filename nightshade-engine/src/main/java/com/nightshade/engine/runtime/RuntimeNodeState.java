package com.nightshade.engine.runtime;

import com.nightshade.sequence.model.SequenceNode;

/**
 * Mutable runtime view of one node: immutable definition plus status, failure count and last message.
 */
public final class RuntimeNodeState {

    private final SequenceNode definition;
    private volatile NodeStatus status = NodeStatus.PENDING;
    private volatile int failureCount;
    private volatile String lastMessage;

    public RuntimeNodeState(SequenceNode definition) {
        this.definition = definition;
    }

    public String getNodeId() {
        return definition.getId();
    }

    public SequenceNode getDefinition() {
        return definition;
    }

    public NodeStatus getStatus() {
        return status;
    }

    void setStatus(NodeStatus status) {
        this.status = status != null ? status : NodeStatus.PENDING;
    }

    /** Number of transitions into {@link NodeStatus#FAILURE} during this run. */
    public int getFailureCount() {
        return failureCount;
    }

    void recordFailure(String message) {
        failureCount++;
        lastMessage = message;
    }

    public String getLastMessage() {
        return lastMessage;
    }
}
