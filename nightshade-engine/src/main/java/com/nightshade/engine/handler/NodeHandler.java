package com.nightshade.engine.handler;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.SequenceNode;

import java.util.Set;

/**
 * Executes one or more node types. The dispatcher in {@link ExecutionContext#runNode} owns status
 * transitions and device locks; a handler only does the work.
 */
public interface NodeHandler {

    Set<NodeType> supportedTypes();

    /**
     * Runs the node and returns {@link NodeStatus#SUCCESS} or {@link NodeStatus#SKIPPED}.
     * Failure is signalled by throwing {@link com.nightshade.engine.NodeExecutionException}.
     */
    NodeStatus execute(SequenceNode node, ExecutionContext ctx);
}
