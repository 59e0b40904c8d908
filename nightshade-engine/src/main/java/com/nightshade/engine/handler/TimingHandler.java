package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import com.nightshade.sequence.model.TwilightType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Wait-for-time and fixed delays. Both wait cooperatively, so stop and skip interrupt them within
 * one poll interval. A wait whose instant has already passed completes immediately.
 */
public final class TimingHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(TimingHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.WAIT_TIME, NodeType.DELAY);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        if (node.getType() == NodeType.DELAY) {
            double seconds = Math.max(0, node.spec(NodeSpec.Delay.class).seconds());
            ctx.progress().message("Waiting " + Math.round(seconds) + "s");
            ctx.sleep(node, Duration.ofMillis(Math.round(seconds * 1000)));
            return NodeStatus.SUCCESS;
        }
        NodeSpec.WaitTime wait = node.spec(NodeSpec.WaitTime.class);
        if (wait.waitUntil() != null) {
            return waitUntil(node, wait.waitUntil(), ctx);
        }
        if (wait.waitForTwilight() != null) {
            return waitForTwilight(node, wait.waitForTwilight(), ctx);
        }
        return NodeStatus.SUCCESS;
    }

    private static NodeStatus waitUntil(SequenceNode node, Instant until, ExecutionContext ctx) {
        if (!ctx.clock().instant().isBefore(until)) {
            log.warn("Wait time already passed | nodeId={} | waitUntil={}", node.getId(), until);
            return NodeStatus.SUCCESS;
        }
        ctx.progress().message("Waiting until " + until);
        ctx.sleepUntil(node, until);
        return NodeStatus.SUCCESS;
    }

    /** Sun altitude is required; without an observer location the wait cannot be evaluated and is skipped. */
    private static NodeStatus waitForTwilight(SequenceNode node, TwilightType twilight, ExecutionContext ctx) {
        if (ctx.telemetry().sunAltitudeDegrees() == null) {
            log.warn("Sun altitude unknown, skipping twilight wait | nodeId={} | twilight={}", node.getId(), twilight);
            ctx.progress().message("Sun position unknown; not waiting for " + twilight.toValue() + " twilight");
            return NodeStatus.SKIPPED;
        }
        ctx.progress().message("Waiting for " + twilight.toValue() + " twilight");
        ctx.waitFor(node, () -> {
            Double sun = ctx.telemetry().sunAltitudeDegrees();
            return sun == null || sun <= twilight.getSunAltitude();
        }, null);
        return NodeStatus.SUCCESS;
    }
}
