package com.nightshade.sequence.tree;

import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes reachability, orphans, dangling references and cycles over a sequence. Pure; safe to
 * call on malformed documents.
 */
public final class StructureAnalyzer {

    /** Sibling or independent targets: higher priority first, then authored order. */
    public static final Comparator<SequenceNode> TARGET_ORDER =
            Comparator.comparingInt((SequenceNode n) -> n.spec(NodeSpec.TargetHeader.class).priority()).reversed()
                    .thenComparingInt(SequenceNode::getOrderIndex);

    private enum Mark { IN_PROGRESS, DONE }

    private StructureAnalyzer() {
    }

    /**
     * Ids a run walks, in order: the root when it resolves, then every independent target by
     * {@link #TARGET_ORDER}. Estimates over a whole plan must sum exactly these.
     */
    public static List<String> executionRoots(Sequence sequence, StructureReport structure) {
        List<String> roots = new ArrayList<>();
        if (structure.rootFound()) {
            roots.add(sequence.getRootNodeId());
        }
        List<SequenceNode> targets = new ArrayList<>();
        for (String id : structure.independentTargetRootIds()) {
            SequenceNode node = sequence.getNode(id);
            if (node != null) targets.add(node);
        }
        targets.sort(TARGET_ORDER);
        for (SequenceNode target : targets) {
            roots.add(target.getId());
        }
        return roots;
    }

    public static StructureReport analyze(Sequence sequence) {
        Map<String, SequenceNode> nodes = sequence.getNodes();
        String rootId = sequence.getRootNodeId();
        boolean rootSet = rootId != null && !rootId.isBlank();
        boolean rootFound = rootSet && nodes.containsKey(rootId);

        List<StructureReport.DanglingReference> dangling = new ArrayList<>();
        Map<String, Integer> referenceCounts = new HashMap<>();
        for (SequenceNode node : nodes.values()) {
            for (String childId : node.getChildIds()) {
                if (!nodes.containsKey(childId)) {
                    dangling.add(new StructureReport.DanglingReference(node.getId(), childId));
                } else {
                    referenceCounts.merge(childId, 1, Integer::sum);
                }
            }
        }
        Set<String> shared = new LinkedHashSet<>();
        referenceCounts.forEach((id, count) -> {
            if (count > 1) shared.add(id);
        });

        List<String> independentTargets = nodes.values().stream()
                .filter(n -> n.getType() == NodeType.TARGET_HEADER)
                .filter(n -> !n.getId().equals(rootId) && !referenceCounts.containsKey(n.getId()))
                .sorted(Comparator.comparingInt(SequenceNode::getOrderIndex))
                .map(SequenceNode::getId)
                .toList();

        Set<String> live = new LinkedHashSet<>();
        if (rootFound) {
            live.addAll(SequenceTreeWalker.reachableFrom(sequence, rootId));
        }
        for (String targetId : independentTargets) {
            live.addAll(SequenceTreeWalker.reachableFrom(sequence, targetId));
        }
        Set<String> orphaned = new LinkedHashSet<>();
        Set<String> unknown = new LinkedHashSet<>();
        for (SequenceNode node : nodes.values()) {
            if (!live.contains(node.getId())) orphaned.add(node.getId());
            if (node.getType() == NodeType.UNKNOWN) unknown.add(node.getId());
        }

        return new StructureReport(rootSet, rootFound, List.copyOf(dangling), findCycles(sequence),
                Set.copyOf(shared), Set.copyOf(live), independentTargets, Set.copyOf(orphaned), Set.copyOf(unknown));
    }

    /**
     * Every cycle reachable through child references, found by depth-first search with an explicit path.
     * Each cycle is reported once, at the back edge that closes it.
     */
    public static List<List<String>> findCycles(Sequence sequence) {
        Map<String, Mark> marks = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String id : sequence.getNodes().keySet()) {
            if (!marks.containsKey(id)) {
                visit(sequence, id, marks, new ArrayDeque<>(), cycles);
            }
        }
        return cycles;
    }

    private static void visit(Sequence sequence, String id, Map<String, Mark> marks,
                              Deque<String> path, List<List<String>> cycles) {
        marks.put(id, Mark.IN_PROGRESS);
        path.addLast(id);
        SequenceNode node = sequence.getNode(id);
        Set<String> seenChildren = new HashSet<>();
        for (String childId : node.getChildIds()) {
            if (!sequence.getNodes().containsKey(childId) || !seenChildren.add(childId)) continue;
            Mark mark = marks.get(childId);
            if (mark == null) {
                visit(sequence, childId, marks, path, cycles);
            } else if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String p : path) {
                    if (p.equals(childId)) inCycle = true;
                    if (inCycle) cycle.add(p);
                }
                cycle.add(childId);
                cycles.add(List.copyOf(cycle));
            }
        }
        path.removeLast();
        marks.put(id, Mark.DONE);
    }
}
