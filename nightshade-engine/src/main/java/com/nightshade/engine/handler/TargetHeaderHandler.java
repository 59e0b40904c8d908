package com.nightshade.engine.handler;

import com.nightshade.engine.TargetSkippedException;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Set;

/**
 * Imaging target. Gates its children on the time window and altitude limits, makes its
 * coordinates available to descendants, and absorbs "next target" requests from recovery nodes.
 */
public final class TargetHeaderHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(TargetHeaderHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.TARGET_HEADER);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.TargetHeader target = node.spec(NodeSpec.TargetHeader.class);
        String name = target.targetName().isBlank() ? node.getName() : target.targetName();
        if (target.mosaicPanel() != null) {
            name = name + " (" + target.mosaicPanel().label() + ")";
        }
        ctx.progress().currentTarget(name);

        Instant now = ctx.clock().instant();
        if (target.endBefore() != null && !now.isBefore(target.endBefore())) {
            return skip(node, ctx, "Target '" + name + "' window ended at " + target.endBefore());
        }
        if (target.startAfter() != null && now.isBefore(target.startAfter())) {
            ctx.progress().message("Waiting for target '" + name + "' window to open at " + target.startAfter());
            ctx.sleepUntil(node, target.startAfter());
        }
        if (target.minAltitude() != null || target.maxAltitude() != null) {
            Double altitude = ctx.telemetry().altitudeOf(target.raHours(), target.decDegrees());
            if (altitude != null) {
                if (target.minAltitude() != null && altitude < target.minAltitude()) {
                    return skip(node, ctx, String.format("Target '%s' at %.1f° is below its minimum altitude %.1f°",
                            name, altitude, target.minAltitude()));
                }
                if (target.maxAltitude() != null && altitude > target.maxAltitude()) {
                    return skip(node, ctx, String.format("Target '%s' at %.1f° is above its maximum altitude %.1f°",
                            name, altitude, target.maxAltitude()));
                }
            }
        }

        try {
            ctx.withTarget(target).runChildren(node);
        } catch (TargetSkippedException e) {
            log.warn("Target skipped by recovery | targetNodeId={} | requestedBy={} | reason={}",
                    node.getId(), e.getNodeId(), e.getMessage());
            return skip(node, ctx, "Skipping rest of target '" + name + "': " + e.getMessage());
        }
        return NodeStatus.SUCCESS;
    }

    private static NodeStatus skip(SequenceNode node, ExecutionContext ctx, String reason) {
        if (log.isInfoEnabled()) {
            log.info("Target skipped | nodeId={} | reason={}", node.getId(), reason);
        }
        ctx.progress().message(reason);
        ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
        return NodeStatus.SKIPPED;
    }
}
