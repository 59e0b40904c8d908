package com.nightshade.engine.handler;

import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Notifications and external scripts. A script that exits non-zero fails its node.
 */
public final class UtilityHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(UtilityHandler.class);

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.NOTIFICATION, NodeType.SCRIPT);
    }

    @Override
    public NodeStatus execute(SequenceNode node, ExecutionContext ctx) {
        if (node.getType() == NodeType.NOTIFICATION) {
            NodeSpec.Notification notification = node.spec(NodeSpec.Notification.class);
            ctx.await(node, ctx.devices().notify(notification.title(), notification.message(),
                    notification.level().toValue()), ctx.config().getOperationTimeout());
            return NodeStatus.SUCCESS;
        }
        NodeSpec.Script script = node.spec(NodeSpec.Script.class);
        if (script.scriptPath().isBlank()) {
            throw new NodeExecutionException(node.getId(), ExecutionContext.describe(node) + " has no script path");
        }
        Duration timeout = script.timeoutSecs() != null
                ? Duration.ofSeconds(script.timeoutSecs())
                : ctx.config().getOperationTimeout();
        Integer exitCode = ctx.await(node, ctx.devices().runScript(script.scriptPath(), script.arguments()), timeout);
        if (exitCode != null && exitCode != 0) {
            throw new NodeExecutionException(node.getId(),
                    "Script '" + script.scriptPath() + "' exited with code " + exitCode);
        }
        if (log.isInfoEnabled()) {
            log.info("Script finished | nodeId={} | path={} | exitCode={}", node.getId(), script.scriptPath(), exitCode);
        }
        return NodeStatus.SUCCESS;
    }
}
