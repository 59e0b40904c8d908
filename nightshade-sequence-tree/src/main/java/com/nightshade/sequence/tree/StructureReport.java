package com.nightshade.sequence.tree;

import java.util.List;
import java.util.Set;

/**
 * Structural facts about a sequence's node arena, computed by {@link StructureAnalyzer}.
 *
 * @param rootSet                   a root id is present on the sequence
 * @param rootFound                 the root id resolves to a node
 * @param danglingReferences        child ids that do not resolve, with the referencing parent
 * @param cycles                    each cycle as the node ids along it, first id repeated at the end
 * @param sharedNodeIds             nodes listed as a child by more than one parent
 * @param liveNodeIds               nodes reachable from the root or from an independent target root
 * @param independentTargetRootIds  target headers nobody references, other than the root itself
 * @param orphanedNodeIds           nodes in the mapping that are not live
 * @param unknownTypeNodeIds        nodes whose type this release cannot interpret
 */
public record StructureReport(boolean rootSet,
                              boolean rootFound,
                              List<DanglingReference> danglingReferences,
                              List<List<String>> cycles,
                              Set<String> sharedNodeIds,
                              Set<String> liveNodeIds,
                              List<String> independentTargetRootIds,
                              Set<String> orphanedNodeIds,
                              Set<String> unknownTypeNodeIds) {

    public record DanglingReference(String parentId, String missingChildId) {
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public boolean isWellFormed() {
        return (!rootSet || rootFound) && danglingReferences.isEmpty() && cycles.isEmpty();
    }
}
