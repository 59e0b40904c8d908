package com.nightshade.engine.handler;

import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.control.CancellationReason;
import com.nightshade.engine.control.CancellationToken;
import com.nightshade.engine.control.ExecutionCancelledException;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Runs enabled children as concurrent branches on the run's branch executor. Completes once
 * {@code requiredSuccesses} branches succeed (skipped counts as success) or the threshold becomes
 * unreachable; the remaining branches are then cancelled. Device exclusivity still applies: two
 * branches needing the same device run one after the other.
 */
public final class ParallelHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(ParallelHandler.class);

    private record BranchOutcome(String nodeId, NodeStatus status, RuntimeException error) {
    }

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.PARALLEL);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.Parallel spec = node.spec(NodeSpec.Parallel.class);
        List<SequenceNode> enabled = new ArrayList<>();
        for (SequenceNode child : ctx.orderedChildren(node)) {
            if (child.isEnabled()) {
                enabled.add(child);
            } else {
                ctx.runNode(child.getId());
            }
        }
        if (enabled.isEmpty()) return NodeStatus.SUCCESS;
        int required = spec.requiredSuccesses() == null
                ? enabled.size()
                : Math.max(1, Math.min(enabled.size(), spec.requiredSuccesses()));

        CancellationToken group = ctx.token().child();
        ExecutionContext branchCtx = ctx.withToken(group);
        CompletionService<BranchOutcome> completion = new ExecutorCompletionService<>(ctx.branchExecutor());
        for (SequenceNode child : enabled) {
            completion.submit(() -> runBranch(branchCtx, child));
        }
        if (log.isInfoEnabled()) {
            log.info("Parallel started | nodeId={} | branches={} | requiredSuccesses={}", node.getId(), enabled.size(), required);
        }

        int successes = 0;
        int failures = 0;
        boolean settled = false;
        RuntimeException firstFailure = null;
        ExecutionCancelledException stop = null;
        for (int i = 0; i < enabled.size(); i++) {
            BranchOutcome outcome = take(completion, group, node);
            RuntimeException error = outcome.error();
            if (error == null) {
                successes++;
            } else if (error instanceof ExecutionCancelledException cancelled) {
                if (cancelled.getReason() != CancellationReason.SIBLING) stop = cancelled;
            } else {
                failures++;
                if (firstFailure == null) firstFailure = error;
            }
            if (!settled && (successes >= required || failures > enabled.size() - required)) {
                settled = true;
                group.cancel(CancellationReason.SIBLING);
            }
        }

        if (stop != null) throw stop;
        // branches cancelled before they started never left PENDING
        ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.CANCELLED);
        if (successes >= required) {
            if (log.isInfoEnabled()) {
                log.info("Parallel completed | nodeId={} | successes={} | failures={}", node.getId(), successes, failures);
            }
            return NodeStatus.SUCCESS;
        }
        if (firstFailure instanceof NodeExecutionException nodeFailure) {
            throw new NodeExecutionException(node.getId(), "Only " + successes + " of " + required
                    + " required branches succeeded: " + nodeFailure.getMessage(), nodeFailure);
        }
        throw firstFailure;
    }

    private static BranchOutcome runBranch(ExecutionContext ctx, SequenceNode child) {
        try {
            return new BranchOutcome(child.getId(), ctx.runNode(child.getId()), null);
        } catch (RuntimeException e) {
            return new BranchOutcome(child.getId(), NodeStatus.FAILURE, e);
        }
    }

    private static BranchOutcome take(CompletionService<BranchOutcome> completion, CancellationToken group,
                                      SequenceNode node) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            group.cancel(CancellationReason.STOP);
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(CancellationReason.STOP, node.getId(), false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new NodeExecutionException(node.getId(), "Parallel branch crashed: " + cause.getMessage(), cause);
        }
    }
}
