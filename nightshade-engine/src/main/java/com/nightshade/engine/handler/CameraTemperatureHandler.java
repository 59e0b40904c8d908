package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;

import java.time.Duration;
import java.util.Set;

/**
 * Cooling and warming ramps. A cooldown may take its full ramp duration plus the general operation timeout.
 */
public final class CameraTemperatureHandler implements NodeHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.COOL_CAMERA, NodeType.WARM_CAMERA);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        if (node.getType() == NodeType.COOL_CAMERA) {
            NodeSpec.CoolCamera cool = node.spec(NodeSpec.CoolCamera.class);
            ctx.progress().message("Cooling camera to " + cool.targetTemp() + "°C");
            Duration timeout = Duration.ofSeconds(Math.round(cool.durationMins() * 60))
                    .plus(ctx.config().getOperationTimeout());
            ctx.await(node, ctx.devices().coolCamera(cool.targetTemp(), cool.durationMins(), ctx.progressFor(node)), timeout);
        } else {
            NodeSpec.WarmCamera warm = node.spec(NodeSpec.WarmCamera.class);
            ctx.progress().message("Warming camera");
            ctx.await(node, ctx.devices().warmCamera(warm.ratePerMin(), ctx.progressFor(node)),
                    ctx.config().getOperationTimeout());
        }
        return NodeStatus.SUCCESS;
    }
}
