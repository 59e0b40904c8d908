package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;

import java.util.Set;

public final class DomeHandler implements NodeHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.OPEN_DOME, NodeType.CLOSE_DOME, NodeType.PARK_DOME);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        switch (node.getType()) {
            case OPEN_DOME -> ctx.await(node,
                    ctx.devices().openDome(node.spec(NodeSpec.OpenDome.class).shutterOnly()),
                    ctx.config().getOperationTimeout());
            case CLOSE_DOME -> ctx.await(node,
                    ctx.devices().closeDome(node.spec(NodeSpec.CloseDome.class).shutterOnly()),
                    ctx.config().getOperationTimeout());
            case PARK_DOME -> ctx.await(node, ctx.devices().parkDome(), ctx.config().getOperationTimeout());
            default -> throw new IllegalStateException("Unsupported node type " + node.getType());
        }
        return NodeStatus.SUCCESS;
    }
}
