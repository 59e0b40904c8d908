package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;

import java.util.Set;

/**
 * Instruction sets: children in order, first failure propagates.
 */
public final class SequentialHandler implements NodeHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.INSTRUCTION_SET);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        ctx.runChildren(node);
        return NodeStatus.SUCCESS;
    }
}
