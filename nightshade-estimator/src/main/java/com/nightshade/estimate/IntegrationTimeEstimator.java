package com.nightshade.estimate;

import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import com.nightshade.sequence.tree.SequenceTreeWalker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Estimates integration time over a sequence tree. Pure function of the tree and a reference instant.
 * <p>
 * Only exposures contribute time. Containers sum their children; loops apply their condition to the
 * summed children. Without a resolvable root the estimate falls back to the plain sum of enabled
 * exposures (degraded mode, tree structure ignored).
 */
public final class IntegrationTimeEstimator {

    public SequenceEstimate estimate(Sequence sequence, Instant referenceTime) {
        if (sequence.getRootNode() == null) {
            return degraded(sequence);
        }
        return estimateNode(sequence, sequence.getRootNodeId(), referenceTime);
    }

    /** Combined estimate of several execution roots, e.g. the root plus independent targets. */
    public SequenceEstimate estimateRoots(Sequence sequence, List<String> rootIds, Instant referenceTime) {
        if (rootIds.isEmpty()) {
            return degraded(sequence);
        }
        List<SequenceEstimate> parts = new ArrayList<>();
        for (String rootId : rootIds) {
            parts.add(estimateNode(sequence, rootId, referenceTime));
        }
        return sum(parts);
    }

    /** Estimate for the subtree rooted at {@code nodeId}; zero when the node is missing or disabled. */
    public SequenceEstimate estimateNode(Sequence sequence, String nodeId, Instant referenceTime) {
        return SequenceTreeWalker.fold(sequence, nodeId, new SequenceTreeWalker.Folder<>() {
            @Override
            public SequenceEstimate absent() {
                return SequenceEstimate.ZERO;
            }

            @Override
            public SequenceEstimate combine(SequenceNode node, List<SequenceEstimate> childResults) {
                return contribution(node, childResults, referenceTime);
            }
        });
    }

    private static SequenceEstimate degraded(Sequence sequence) {
        double total = 0;
        long frames = 0;
        for (SequenceNode node : sequence.exposureNodes()) {
            NodeSpec.Exposure exposure = node.spec(NodeSpec.Exposure.class);
            total += exposure.totalDurationSecs();
            frames += exposure.count();
        }
        return new SequenceEstimate(total, total, false, null, null, frames);
    }

    private static SequenceEstimate contribution(SequenceNode node, List<SequenceEstimate> children, Instant referenceTime) {
        return switch (node.getType()) {
            case EXPOSURE -> {
                NodeSpec.Exposure exposure = node.spec(NodeSpec.Exposure.class);
                double secs = exposure.totalDurationSecs();
                yield new SequenceEstimate(secs, secs, false, null, null, exposure.count());
            }
            case LOOP -> loop(node.spec(NodeSpec.Loop.class), sum(children), referenceTime);
            case TARGET_HEADER, PARALLEL, CONDITIONAL, RECOVERY, INSTRUCTION_SET -> sum(children);
            // Instructions other than exposures take time but do not add integration.
            case SLEW, CENTER, AUTOFOCUS, DITHER, START_GUIDING, STOP_GUIDING, FILTER_CHANGE,
                    COOL_CAMERA, WARM_CAMERA, ROTATOR, PARK, UNPARK, WAIT_TIME, DELAY, NOTIFICATION,
                    SCRIPT, MERIDIAN_FLIP, OPEN_DOME, CLOSE_DOME, PARK_DOME, POLAR_ALIGNMENT, UNKNOWN -> sum(children);
        };
    }

    private static SequenceEstimate loop(NodeSpec.Loop loop, SequenceEstimate children, Instant referenceTime) {
        double single = children.getSingleIterationSecs();
        long singleFrames = children.getEstimatedExposures();
        return switch (loop.conditionType()) {
            case COUNT -> {
                int iterations = Math.max(0, loop.repeatCount());
                yield new SequenceEstimate(children.getEstimatedSecs() * iterations, single,
                        children.isUnbounded(), children.getUntilTime(), children.getConditionType(),
                        singleFrames * iterations);
            }
            case UNTIL_TIME -> {
                Instant until = loop.repeatUntil();
                if (until != null && single > 0) {
                    double available = Duration.between(referenceTime, until).getSeconds();
                    if (available > 0) {
                        long iterations = (long) Math.floor(available / single);
                        yield new SequenceEstimate(single * iterations, single, false, until, null,
                                singleFrames * iterations);
                    }
                }
                yield new SequenceEstimate(single, single, false, until, null, singleFrames);
            }
            case FOREVER, WHILE_DARK, UNTIL_ALTITUDE ->
                    new SequenceEstimate(single, single, true, null, loop.conditionType(), singleFrames);
        };
    }

    private static SequenceEstimate sum(List<SequenceEstimate> children) {
        double secs = 0;
        double single = 0;
        boolean unbounded = false;
        Instant untilTime = null;
        LoopConditionType conditionType = null;
        long frames = 0;
        for (SequenceEstimate child : children) {
            secs += child.getEstimatedSecs();
            single += child.getSingleIterationSecs();
            unbounded |= child.isUnbounded();
            frames += child.getEstimatedExposures();
            if (untilTime == null) untilTime = child.getUntilTime();
            if (conditionType == null) conditionType = child.getConditionType();
        }
        return new SequenceEstimate(secs, single, unbounded, untilTime, conditionType, frames);
    }
}
