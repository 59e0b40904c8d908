package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Evaluates its condition once, on entry. When unmet the node and its subtree are skipped;
 * this is not a failure.
 */
public final class ConditionalHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(ConditionalHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.CONDITIONAL);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        NodeSpec.Conditional condition = node.spec(NodeSpec.Conditional.class);
        if (!ConditionEvaluator.isSatisfied(condition, ctx)) {
            if (log.isInfoEnabled()) {
                log.info("Condition not met, skipping subtree | nodeId={} | condition={} | threshold={}",
                        node.getId(), condition.conditionType(), condition.thresholdValue());
            }
            ctx.tree().settlePendingDescendants(node.getId(), NodeStatus.SKIPPED);
            return NodeStatus.SKIPPED;
        }
        ctx.runChildren(node);
        return NodeStatus.SUCCESS;
    }
}
