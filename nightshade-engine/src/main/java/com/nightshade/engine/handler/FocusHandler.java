package com.nightshade.engine.handler;

import com.nightshade.device.DeviceType;
import com.nightshade.device.FocusRequest;
import com.nightshade.device.FocusResult;
import com.nightshade.engine.device.DeviceLocks;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Autofocus runs, as an instruction or on behalf of a recovery node. Sub-progress from the
 * focus sweep is forwarded to the progress tracker; the overall run is bounded by the
 * configured autofocus timeout.
 */
public final class FocusHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(FocusHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.AUTOFOCUS);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        focus(node, node.spec(NodeSpec.Autofocus.class), ctx);
        return NodeStatus.SUCCESS;
    }

    /** Autofocus with default settings for {@code owner}, taking the camera and focuser itself. */
    static FocusResult refocus(SequenceNode owner, ExecutionContext ctx) {
        try (DeviceLocks.Lease ignored = ctx.lockDevices(owner, Set.of(DeviceType.CAMERA, DeviceType.FOCUSER))) {
            return focus(owner, NodeSpec.Autofocus.defaults(), ctx);
        }
    }

    private static FocusResult focus(SequenceNode node, NodeSpec.Autofocus spec, ExecutionContext ctx) {
        FocusRequest request = new FocusRequest(spec.method().toValue(), spec.stepSize(), spec.stepsOut(),
                spec.exposuresPerPoint(), spec.exposureDuration(), ctx.progress().getCurrentFilter());
        ctx.progress().message("Autofocus (" + spec.method().toValue() + ")");
        FocusResult result = ctx.await(node, ctx.devices().autofocus(request, ctx.progressFor(node)),
                ctx.config().getAutofocusTimeout());
        String detail = result != null
                ? String.format(Locale.ROOT, "Focus position %d, HFR %.2f", result.position(), result.hfr())
                : "Focus complete";
        ctx.progress().reportNodeProgress(node.getId(), 1.0, detail);
        if (log.isInfoEnabled()) {
            log.info("Autofocus finished | nodeId={} | {}", node.getId(), detail);
        }
        return result;
    }
}
