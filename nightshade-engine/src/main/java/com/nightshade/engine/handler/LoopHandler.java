package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Re-enters its children while the loop condition holds, re-evaluating it against the live
 * clock and telemetry before every iteration.
 */
public final class LoopHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(LoopHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.LOOP);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.Loop loop = node.spec(NodeSpec.Loop.class);
        boolean hasWork = ctx.sequence().getChildren(node.getId()).stream().anyMatch(SequenceNode::isEnabled);
        if (!hasWork) {
            log.warn("Loop has no enabled children | nodeId={}", node.getId());
            return NodeStatus.SUCCESS;
        }
        int completed = 0;
        while (ConditionEvaluator.shouldContinue(loop, completed, ctx)) {
            ctx.checkpoint(node);
            if (completed > 0) {
                for (SequenceNode child : ctx.sequence().getChildren(node.getId())) {
                    ctx.tree().resetSubtree(child.getId());
                }
            }
            ctx.runChildren(node);
            completed++;
            String detail = loop.conditionType() == LoopConditionType.COUNT
                    ? "Iteration " + completed + "/" + loop.repeatCount()
                    : "Iteration " + completed;
            double fraction = loop.conditionType() == LoopConditionType.COUNT
                    && loop.repeatCount() > 0 ? (double) completed / loop.repeatCount() : 0.0;
            ctx.progress().reportNodeProgress(node.getId(), fraction, detail);
        }
        if (completed == 0) {
            ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
        }
        if (log.isInfoEnabled()) {
            log.info("Loop finished | nodeId={} | condition={} | iterations={}", node.getId(), loop.conditionType(), completed);
        }
        return NodeStatus.SUCCESS;
    }
}
