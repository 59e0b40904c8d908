package com.nightshade.engine.handler;

import com.nightshade.device.DeviceType;
import com.nightshade.device.FrameRequest;
import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.device.DeviceLocks;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Captures {@code count} frames one at a time. Each frame is a separate device operation, so
 * pause and skip take effect between frames and stop aborts the frame in flight. Counters are
 * credited per successful frame. Dithers every {@code ditherEvery} frames when a guider is connected.
 */
public final class ExposureHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(ExposureHandler.class);

    private static final double DITHER_PIXELS = 5.0;
    private static final double DITHER_SETTLE_PIXELS = 1.5;
    private static final double DITHER_SETTLE_SECS = 30.0;

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.EXPOSURE);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.Exposure exposure = node.spec(NodeSpec.Exposure.class);
        int count = Math.max(0, exposure.count());
        if (exposure.filter() != null && !exposure.filter().isBlank()) {
            ctx.progress().currentFilter(exposure.filter());
        }
        FrameRequest request = new FrameRequest(exposure.durationSecs(), exposure.frameType().toValue(),
                exposure.filter(), exposure.gain(), exposure.offset(), exposure.binning().getFactor());
        Duration timeout = Duration.ofMillis(Math.round(exposure.durationSecs() * 1000))
                .plus(ctx.config().getExposureOverhead());
        boolean dither = exposure.ditherEvery() > 0 && ctx.snapshot().isGuiderConnected();

        for (int frame = 1; frame <= count; frame++) {
            ctx.checkpoint(node);
            ctx.progress().reportNodeProgress(node.getId(), (double) (frame - 1) / count,
                    "Frame " + frame + "/" + count);
            ctx.await(node, ctx.devices().expose(request), timeout);
            ctx.progress().frameCompleted(node.getId(), exposure.durationSecs());
            ctx.progress().reportNodeProgress(node.getId(), (double) frame / count,
                    "Frame " + frame + "/" + count + " done");
            if (dither && frame < count && frame % exposure.ditherEvery() == 0) {
                dither(node, ctx);
            }
        }
        if (log.isInfoEnabled()) {
            log.info("Exposure finished | nodeId={} | frames={} | durationSecs={} | filter={}",
                    node.getId(), count, exposure.durationSecs(), exposure.filter());
        }
        return NodeStatus.SUCCESS;
    }

    /** A failed dither between frames is logged and the series continues; the next frame re-checks guiding. */
    private static void dither(SequenceNode node, ExecutionContext ctx) {
        try (DeviceLocks.Lease ignored = ctx.lockDevices(node, Set.of(DeviceType.GUIDER))) {
            ctx.await(node, ctx.devices().dither(DITHER_PIXELS, DITHER_SETTLE_PIXELS, DITHER_SETTLE_SECS),
                    ctx.config().getOperationTimeout());
        } catch (NodeExecutionException e) {
            log.warn("Dither between frames failed | nodeId={} | error={}", node.getId(), e.getMessage());
            ctx.progress().message("Dither failed, continuing: " + e.getMessage());
        }
    }
}
