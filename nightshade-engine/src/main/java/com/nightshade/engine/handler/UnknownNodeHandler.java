package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Nodes written by a newer release load but never run; they and their subtree are skipped.
 */
public final class UnknownNodeHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(UnknownNodeHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.UNKNOWN);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        log.warn("Skipping node of unknown type | nodeId={} | name={}", node.getId(), node.getName());
        ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
        return NodeStatus.SKIPPED;
    }
}
