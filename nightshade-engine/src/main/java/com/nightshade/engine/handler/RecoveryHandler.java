package com.nightshade.engine.handler;

import com.nightshade.device.DeviceType;
import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.SequenceAbortedException;
import com.nightshade.engine.TargetSkippedException;
import com.nightshade.engine.device.DeviceLocks;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.RecoveryAction;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Failure policy around a subtree.
 * <p>
 * Any failure below re-enters the subtree up to {@code maxRetries} times. Between attempts the
 * node backs off, runs autofocus ({@link RecoveryAction#AUTOFOCUS}) or pauses the run until the
 * operator resumes ({@link RecoveryAction#PAUSE}). Once attempts are exhausted the configured
 * terminal action fires. A trigger, when set, is polled during every device wait below this node
 * and fails the in-flight operation into the same policy.
 * <p>
 * The {@code branchNodeId} child of a custom-branch recovery only runs on exhaustion.
 */
public final class RecoveryHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(RecoveryHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.RECOVERY);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.Recovery recovery = node.spec(NodeSpec.Recovery.class);
        TriggerMonitor trigger = TriggerMonitor.of(node.getId(), recovery);
        ExecutionContext guarded = trigger != null ? ctx.withTrigger(trigger) : ctx;
        String branchId = recovery.recoveryAction() == RecoveryAction.CUSTOM_BRANCH ? recovery.branchNodeId() : null;

        int maxAttempts = recovery.maxRetries() + 1;
        NodeExecutionException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                beforeRetry(node, recovery, attempt - 1, last, ctx);
                for (SequenceNode child : ctx.orderedChildren(node)) {
                    if (!child.getId().equals(branchId)) {
                        ctx.tree().resetSubtree(child.getId());
                    }
                }
            }
            try {
                for (SequenceNode child : ctx.orderedChildren(node)) {
                    if (!child.getId().equals(branchId)) {
                        guarded.runNode(child.getId());
                    }
                }
                if (attempt > 1 && log.isInfoEnabled()) {
                    log.info("Recovery succeeded | nodeId={} | attempt={}/{}", node.getId(), attempt, maxAttempts);
                }
                if (branchId != null) {
                    settle(ctx, branchId);
                }
                return NodeStatus.SUCCESS;
            } catch (NodeExecutionException e) {
                last = e;
                log.warn("Recovery caught failure | nodeId={} | failedNodeId={} | attempt={}/{} | action={} | error={}",
                        node.getId(), e.getNodeId(), attempt, maxAttempts, recovery.recoveryAction(), e.getMessage());
            }
        }
        return exhausted(node, recovery, branchId, last, ctx);
    }

    private static void beforeRetry(SequenceNode node, NodeSpec.Recovery recovery, int retry,
                                    NodeExecutionException failure, ExecutionContext ctx) {
        switch (recovery.recoveryAction()) {
            case AUTOFOCUS -> {
                ctx.progress().message("Refocusing before retry " + retry + " of '" + node.getName() + "'");
                FocusHandler.refocus(node, ctx);
            }
            case PAUSE -> {
                ctx.control().pauseIfRunning("Paused by '" + node.getName() + "': " + failure.getMessage());
                ctx.control().awaitResume(ctx.token(), node.getId());
            }
            case CONTINUE, NEXT_TARGET, RETRY, PARK_AND_ABORT, CUSTOM_BRANCH -> {
                double initial = recovery.retryDelaySecs() != null
                        ? recovery.retryDelaySecs()
                        : ctx.config().getRetryInitialIntervalSecs();
                Duration delay = ctx.config().retryBackoff(initial, retry);
                if (!delay.isZero()) {
                    if (log.isInfoEnabled()) {
                        log.info("Recovery backing off | nodeId={} | retry={} | delayMs={}", node.getId(), retry, delay.toMillis());
                    }
                    ctx.progress().message("Retry " + retry + " of '" + node.getName() + "' in " + delay.toSeconds() + "s");
                    ctx.sleep(node, delay);
                }
            }
        }
    }

    private static NodeStatus exhausted(SequenceNode node, NodeSpec.Recovery recovery, String branchId,
                                        NodeExecutionException last, ExecutionContext ctx) {
        String reason = last.getMessage();
        int attempts = recovery.maxRetries() + 1;
        log.error("Recovery exhausted | nodeId={} | attempts={} | action={} | lastError={}",
                node.getId(), attempts, recovery.recoveryAction(), reason);
        switch (recovery.recoveryAction()) {
            case CONTINUE -> {
                ctx.progress().message("Continuing past failure in '" + node.getName() + "': " + reason);
                ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
                return NodeStatus.SUCCESS;
            }
            case NEXT_TARGET -> throw new TargetSkippedException(node.getId(), reason);
            case PARK_AND_ABORT -> {
                park(node, ctx);
                throw new SequenceAbortedException(node.getId(),
                        "Parked and aborted by '" + node.getName() + "' after " + attempts + " attempts: " + reason, last);
            }
            case CUSTOM_BRANCH -> {
                if (branchId == null || ctx.sequence().getNode(branchId) == null) {
                    throw new NodeExecutionException(node.getId(),
                            "Recovery branch '" + branchId + "' not found after failure: " + reason, last);
                }
                ctx.progress().message("Running recovery branch of '" + node.getName() + "'");
                ctx.tree().resetSubtree(branchId);
                ctx.runNode(branchId);
                ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
                return NodeStatus.SUCCESS;
            }
            case RETRY, AUTOFOCUS, PAUSE -> throw new NodeExecutionException(node.getId(),
                    "Recovery '" + node.getName() + "' exhausted after " + attempts + " attempts: " + reason, last);
        }
        throw new IllegalStateException("Unhandled recovery action " + recovery.recoveryAction());
    }

    private static void settle(ExecutionContext ctx, String branchId) {
        ctx.tree().transition(branchId, NodeStatus.SKIPPED, "recovery branch not needed");
        ctx.tree().settlePendingDescendants(branchId, NodeStatus.SKIPPED);
    }

    private static void park(SequenceNode node, ExecutionContext ctx) {
        ctx.progress().message("Parking mount before abort");
        try (DeviceLocks.Lease ignored = ctx.lockDevices(node, Set.of(DeviceType.MOUNT))) {
            ctx.await(node, ctx.devices().park(), ctx.config().getSlewTimeout());
        } catch (NodeExecutionException e) {
            throw new SequenceAbortedException(node.getId(), "Park failed during abort: " + e.getMessage(), e);
        }
    }
}
