package com.nightshade.engine.runtime;

import com.nightshade.sequence.model.SequenceNode;

@FunctionalInterface
public interface NodeStatusListener {

    void onTransition(SequenceNode node, NodeStatus from, NodeStatus to);
}
