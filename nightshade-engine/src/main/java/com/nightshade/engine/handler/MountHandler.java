package com.nightshade.engine.handler;

import com.nightshade.device.PolarAlignmentRequest;
import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Mount instructions: slew, center, park, unpark, meridian flip and polar alignment.
 * Slew and center default to the coordinates of the enclosing target.
 */
public final class MountHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(MountHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.SLEW, NodeType.CENTER, NodeType.PARK, NodeType.UNPARK,
                NodeType.MERIDIAN_FLIP, NodeType.POLAR_ALIGNMENT);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        Duration slewTimeout = ctx.config().getSlewTimeout();
        switch (node.getType()) {
            case SLEW -> {
                NodeSpec.Slew slew = node.spec(NodeSpec.Slew.class);
                double[] coords = coordinates(node, ctx, slew.useTargetCoords(), slew.customRa(), slew.customDec());
                ctx.progress().message(String.format(Locale.ROOT, "Slewing to RA %.3fh Dec %.2f°", coords[0], coords[1]));
                ctx.await(node, ctx.devices().slew(coords[0], coords[1]), slewTimeout);
            }
            case CENTER -> {
                NodeSpec.Center center = node.spec(NodeSpec.Center.class);
                double[] coords = coordinates(node, ctx, center.useTargetCoords(), null, null);
                ctx.progress().message("Centering target within " + center.accuracyArcsec() + "\"");
                ctx.await(node, ctx.devices().center(coords[0], coords[1], center.accuracyArcsec(), center.maxAttempts()),
                        slewTimeout.multipliedBy(Math.max(1, center.maxAttempts())));
            }
            case PARK -> ctx.await(node, ctx.devices().park(), slewTimeout);
            case UNPARK -> ctx.await(node, ctx.devices().unpark(), slewTimeout);
            case MERIDIAN_FLIP -> {
                return meridianFlip(node, ctx);
            }
            case POLAR_ALIGNMENT -> {
                NodeSpec.PolarAlignment pa = node.spec(NodeSpec.PolarAlignment.class);
                PolarAlignmentRequest request = new PolarAlignmentRequest(pa.exposureDuration(), pa.binning(),
                        pa.startAltitude(), pa.rotationStep(), pa.gain(), pa.offset(), pa.startFromCurrent(),
                        pa.north(), pa.manualSlew());
                ctx.await(node, ctx.devices().polarAlign(request, ctx.progressFor(node)), ctx.config().getOperationTimeout());
            }
            default -> throw new IllegalStateException("Unsupported node type " + node.getType());
        }
        return NodeStatus.SUCCESS;
    }

    /**
     * Flips once the current target is {@code minutesPastMeridian} past the meridian, waiting for
     * that point if it is close. A target still east of the meridian needs no flip.
     */
    private static NodeStatus meridianFlip(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.MeridianFlip flip = node.spec(NodeSpec.MeridianFlip.class);
        NodeSpec.TargetHeader target = ctx.currentTarget();
        if (target != null) {
            Double past = ctx.telemetry().minutesPastMeridian(target.raHours());
            if (past != null && past < 0) {
                if (log.isInfoEnabled()) {
                    log.info("Meridian flip not needed | nodeId={} | minutesPastMeridian={}", node.getId(), past);
                }
                return NodeStatus.SKIPPED;
            }
            if (past != null && past < flip.minutesPastMeridian()) {
                ctx.progress().message("Waiting for meridian flip point");
                ctx.waitFor(node, () -> {
                    Double now = ctx.telemetry().minutesPastMeridian(target.raHours());
                    return now == null || now >= flip.minutesPastMeridian();
                }, null);
            }
        }
        ctx.progress().message("Meridian flip");
        ctx.await(node, ctx.devices().meridianFlip(flip.pauseGuiding(), flip.autoCenter(), flip.settleTime()),
                ctx.config().getSlewTimeout().plusSeconds(Math.round(flip.settleTime())));
        return NodeStatus.SUCCESS;
    }

    /** RA hours and Dec degrees from the enclosing target or the custom pair. */
    private static double[] coordinates(SequenceNode node, ExecutionContext ctx, boolean useTarget,
                                        Double customRa, Double customDec) {
        NodeSpec.TargetHeader target = ctx.currentTarget();
        if (useTarget && target != null) {
            return new double[]{target.raHours(), target.decDegrees()};
        }
        if (customRa != null && customDec != null) {
            return new double[]{customRa, customDec};
        }
        throw new NodeExecutionException(node.getId(),
                ExecutionContext.describe(node) + " has no coordinates: no enclosing target and no custom RA/Dec");
    }
}
