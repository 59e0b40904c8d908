package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;

import java.util.Set;

/**
 * Filter wheel and rotator moves.
 */
public final class AccessoryHandler implements NodeHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.FILTER_CHANGE, NodeType.ROTATOR);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        if (node.getType() == NodeType.FILTER_CHANGE) {
            NodeSpec.FilterChange change = node.spec(NodeSpec.FilterChange.class);
            ctx.await(node, ctx.devices().changeFilter(change.filterName(), change.filterPosition()),
                    ctx.config().getOperationTimeout());
            ctx.progress().currentFilter(change.filterName());
        } else {
            NodeSpec.Rotator rotator = node.spec(NodeSpec.Rotator.class);
            ctx.await(node, ctx.devices().moveRotator(rotator.targetAngle(), rotator.relative()),
                    ctx.config().getOperationTimeout());
        }
        return NodeStatus.SUCCESS;
    }
}
