package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Guiding instructions. Without a connected guider they are skipped rather than failed; preflight
 * has already warned about the missing guider.
 */
public final class GuidingHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(GuidingHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.DITHER, NodeType.START_GUIDING, NodeType.STOP_GUIDING);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        if (!ctx.snapshot().isGuiderConnected()) {
            log.warn("Guider not connected, skipping | nodeId={} | type={}", node.getId(), node.getType());
            ctx.progress().message("Guider not connected; skipped " + node.getName());
            return NodeStatus.SKIPPED;
        }
        switch (node.getType()) {
            case DITHER -> {
                NodeSpec.Dither dither = node.spec(NodeSpec.Dither.class);
                ctx.await(node, ctx.devices().dither(dither.pixels(), dither.settlePixels(), dither.settleTime()),
                        settleTimeout(dither.settleTime(), ctx));
            }
            case START_GUIDING -> {
                NodeSpec.StartGuiding guiding = node.spec(NodeSpec.StartGuiding.class);
                ctx.progress().message("Starting guiding");
                ctx.await(node, ctx.devices().startGuiding(guiding.settlePixels(), guiding.settleTime(),
                        guiding.autoSelectStar()), seconds(guiding.settleTimeout() + guiding.settleTime()));
            }
            case STOP_GUIDING -> ctx.await(node, ctx.devices().stopGuiding(), ctx.config().getOperationTimeout());
            default -> throw new IllegalStateException("Unsupported node type " + node.getType());
        }
        return NodeStatus.SUCCESS;
    }

    private static Duration settleTimeout(double settleTimeSecs, ExecutionContext ctx) {
        return seconds(settleTimeSecs).plus(ctx.config().getOperationTimeout());
    }

    private static Duration seconds(double secs) {
        return Duration.ofMillis(Math.round(Math.max(0, secs) * 1000));
    }
}
