package com.nightshade.engine.runtime;

import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import com.nightshade.sequence.tree.SequenceTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime status of every node in one run: single source of truth for the engine and the progress tracker.
 * Definitions come from the leased sequence and never change; only statuses move.
 * Every transition is reported to the listener in the order it happened.
 */
public final class RuntimeSequenceTree {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSequenceTree.class);

    private final Sequence sequence;
    private final Map<String, RuntimeNodeState> nodesById = new LinkedHashMap<>();
    private final Set<String> liveIds;
    private final NodeStatusListener listener;

    public RuntimeSequenceTree(Sequence sequence, Collection<String> liveIds, NodeStatusListener listener) {
        this.sequence = sequence;
        this.liveIds = Set.copyOf(liveIds);
        this.listener = listener != null ? listener : (n, from, to) -> { };
        for (SequenceNode node : sequence.getNodes().values()) {
            nodesById.put(node.getId(), new RuntimeNodeState(node));
        }
    }

    public RuntimeNodeState getNode(String nodeId) {
        return nodeId != null ? nodesById.get(nodeId) : null;
    }

    public NodeStatus statusOf(String nodeId) {
        RuntimeNodeState state = getNode(nodeId);
        return state != null ? state.getStatus() : null;
    }

    public int failureCount(String nodeId) {
        RuntimeNodeState state = getNode(nodeId);
        return state != null ? state.getFailureCount() : 0;
    }

    public void transition(String nodeId, NodeStatus to) {
        transition(nodeId, to, null);
    }

    public synchronized void transition(String nodeId, NodeStatus to, String message) {
        RuntimeNodeState state = getNode(nodeId);
        if (state == null) {
            log.warn("Tree transition | node not found | nodeId={} | to={}", nodeId, to);
            return;
        }
        NodeStatus from = state.getStatus();
        if (from == to) return;
        state.setStatus(to);
        if (to == NodeStatus.FAILURE) {
            state.recordFailure(message);
        }
        if (log.isInfoEnabled()) {
            log.info("Tree transition | nodeId={} | name={} | {} -> {}{}", nodeId, state.getDefinition().getName(),
                    from, to, message != null ? " | message=" + message : "");
        }
        listener.onTransition(state.getDefinition(), from, to);
    }

    /** Puts a node and its descendants back to PENDING before a loop iteration or retry re-enters them. */
    public synchronized void resetSubtree(String nodeId) {
        transition(nodeId, NodeStatus.PENDING);
        for (String id : SequenceTreeWalker.descendantIds(sequence, nodeId)) {
            transition(id, NodeStatus.PENDING);
        }
    }

    /** Moves still-pending descendants of {@code nodeId} (not the node itself) to {@code to}. */
    public synchronized void settlePendingDescendants(String nodeId, NodeStatus to) {
        for (String id : SequenceTreeWalker.descendantIds(sequence, nodeId)) {
            if (statusOf(id) == NodeStatus.PENDING) {
                transition(id, to);
            }
        }
    }

    /** Marks every live node that never started as CANCELLED. */
    public synchronized void cancelPending() {
        for (RuntimeNodeState state : nodesById.values()) {
            if (liveIds.contains(state.getNodeId()) && state.getStatus() == NodeStatus.PENDING) {
                transition(state.getNodeId(), NodeStatus.CANCELLED);
            }
        }
    }

    /** Instruction (non-container) nodes currently RUNNING. */
    public List<String> runningInstructionIds() {
        List<String> ids = new ArrayList<>();
        for (RuntimeNodeState state : nodesById.values()) {
            if (state.getStatus() == NodeStatus.RUNNING && !state.getDefinition().getType().isContainer()) {
                ids.add(state.getNodeId());
            }
        }
        return ids;
    }

    /** Status of every node, in sequence order. */
    public Map<String, NodeStatus> statuses() {
        Map<String, NodeStatus> out = new LinkedHashMap<>();
        nodesById.forEach((id, state) -> out.put(id, state.getStatus()));
        return out;
    }
}
