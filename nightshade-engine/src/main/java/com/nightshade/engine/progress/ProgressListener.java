package com.nightshade.engine.progress;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.SequenceNode;

/**
 * Receives progress snapshots for one run. Called on engine threads while the tracker is
 * locked, so implementations must return quickly and must not call back into the run.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(SequenceProgress progress);

    default void onNodeStatusChanged(SequenceNode node, NodeStatus from, NodeStatus to) {
    }
}
