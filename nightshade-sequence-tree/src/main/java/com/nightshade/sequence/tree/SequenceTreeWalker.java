package com.nightshade.sequence.tree;

import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Generic walks over the id-keyed node arena. Every walk tolerates dangling child ids and cycles:
 * a missing id is skipped, and a node already on the current path (or already visited, for
 * pre-order walks) is not entered again.
 */
public final class SequenceTreeWalker {

    private SequenceTreeWalker() {
    }

    /** Post-order fold: child results are computed first and combined at the parent. */
    public interface Folder<R> {

        /** Result for a missing, disabled or cyclic node. */
        R absent();

        R combine(SequenceNode node, List<R> childResults);
    }

    @FunctionalInterface
    public interface NodeVisitor {
        void visit(SequenceNode node, int depth);
    }

    /**
     * Folds the enabled subtree rooted at {@code nodeId}. Disabled nodes yield {@link Folder#absent()}
     * and are not descended into.
     */
    public static <R> R fold(Sequence sequence, String nodeId, Folder<R> folder) {
        return fold(sequence, nodeId, folder, new HashSet<>());
    }

    private static <R> R fold(Sequence sequence, String nodeId, Folder<R> folder, Set<String> onPath) {
        SequenceNode node = sequence.getNode(nodeId);
        if (node == null || !node.isEnabled() || !onPath.add(nodeId)) {
            return folder.absent();
        }
        List<R> childResults = new ArrayList<>(node.getChildIds().size());
        for (String childId : node.getChildIds()) {
            childResults.add(fold(sequence, childId, folder, onPath));
        }
        onPath.remove(nodeId);
        return folder.combine(node, childResults);
    }

    /**
     * Depth-first pre-order walk from {@code startId}, siblings in order-index order. Each node is
     * visited at most once.
     */
    public static void walk(Sequence sequence, String startId, boolean includeDisabled, NodeVisitor visitor) {
        walk(sequence, startId, includeDisabled, visitor, 0, new HashSet<>());
    }

    private static void walk(Sequence sequence, String nodeId, boolean includeDisabled,
                             NodeVisitor visitor, int depth, Set<String> visited) {
        SequenceNode node = sequence.getNode(nodeId);
        if (node == null || !visited.add(nodeId)) return;
        if (!includeDisabled && !node.isEnabled()) return;
        visitor.visit(node, depth);
        for (SequenceNode child : sequence.getChildren(nodeId)) {
            walk(sequence, child.getId(), includeDisabled, visitor, depth + 1, visited);
        }
    }

    /** Ids of every node strictly below {@code nodeId}, disabled ones included, in pre-order. */
    public static List<String> descendantIds(Sequence sequence, String nodeId) {
        List<String> ids = new ArrayList<>();
        walk(sequence, nodeId, true, (node, depth) -> {
            if (depth > 0) ids.add(node.getId());
        });
        return ids;
    }

    /** Ids reachable from {@code startId} through existing child references, the start included. */
    public static Set<String> reachableFrom(Sequence sequence, String startId) {
        Set<String> reached = new HashSet<>();
        walk(sequence, startId, true, (node, depth) -> reached.add(node.getId()));
        return reached;
    }
}
