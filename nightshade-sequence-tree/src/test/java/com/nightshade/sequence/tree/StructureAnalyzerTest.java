package com.nightshade.sequence.tree;

import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructureAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-10-17T20:00:00Z");

    private static SequenceNode node(String id, NodeSpec spec, String... children) {
        return new SequenceNode(id, id, true, List.of(children), null, 0, spec);
    }

    @Test
    void analyze_wellFormedTreeHasNoOrphans() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("root", new NodeSpec.InstructionSet(), "a", "b"))
                .withNode(node("a", new NodeSpec.Park()))
                .withNode(node("b", new NodeSpec.Unpark()))
                .withRootNodeId("root");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertTrue(report.isWellFormed());
        assertTrue(report.orphanedNodeIds().isEmpty());
        assertEquals(Set.of("root", "a", "b"), report.liveNodeIds());
    }

    @Test
    void analyze_reportsOrphansAndDanglingReferences() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("root", new NodeSpec.InstructionSet(), "a", "ghost"))
                .withNode(node("a", new NodeSpec.Park()))
                .withNode(node("stray", new NodeSpec.Delay(3.0)))
                .withRootNodeId("root");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertFalse(report.isWellFormed());
        assertEquals(Set.of("stray"), report.orphanedNodeIds());
        assertEquals(List.of(new StructureReport.DanglingReference("root", "ghost")), report.danglingReferences());
    }

    @Test
    void analyze_detectsCycleThroughChildReferences() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("root", new NodeSpec.InstructionSet(), "loop"))
                .withNode(node("loop", NodeSpec.Loop.count(2), "inner"))
                .withNode(node("inner", new NodeSpec.InstructionSet(), "loop"))
                .withRootNodeId("root");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertTrue(report.hasCycles());
        assertEquals(List.of(List.of("loop", "inner", "loop")), report.cycles());
    }

    @Test
    void findCycles_detectsSelfReference() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("self", new NodeSpec.InstructionSet(), "self"))
                .withRootNodeId("self");

        assertEquals(List.of(List.of("self", "self")), StructureAnalyzer.findCycles(sequence));
    }

    @Test
    void analyze_unreferencedTargetHeadersAreIndependentLiveRoots() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("root", new NodeSpec.InstructionSet(), "t1"))
                .withNode(node("t1", NodeSpec.TargetHeader.at("M31", 0.7, 41.0), "e1"))
                .withNode(node("e1", NodeSpec.Exposure.of(60, 1)))
                .withNode(node("t2", NodeSpec.TargetHeader.at("M33", 1.5, 30.0), "e2"))
                .withNode(node("e2", NodeSpec.Exposure.of(60, 1)))
                .withRootNodeId("root");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertEquals(List.of("t2"), report.independentTargetRootIds());
        assertTrue(report.orphanedNodeIds().isEmpty());
        assertTrue(report.liveNodeIds().contains("e2"));
    }

    @Test
    void analyze_flagsSharedChildrenAndUnknownTypes() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("root", new NodeSpec.InstructionSet(), "a", "b"))
                .withNode(node("a", new NodeSpec.InstructionSet(), "shared"))
                .withNode(node("b", new NodeSpec.InstructionSet(), "shared"))
                .withNode(node("shared", new NodeSpec.Unknown()))
                .withRootNodeId("root");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertEquals(Set.of("shared"), report.sharedNodeIds());
        assertEquals(Set.of("shared"), report.unknownTypeNodeIds());
        assertFalse(report.hasCycles());
    }

    @Test
    void analyze_missingRootIsNotWellFormed() {
        Sequence sequence = Sequence.empty("S", NOW)
                .withNode(node("a", new NodeSpec.Park()))
                .withRootNodeId("nope");

        StructureReport report = StructureAnalyzer.analyze(sequence);

        assertTrue(report.rootSet());
        assertFalse(report.rootFound());
        assertFalse(report.isWellFormed());
        assertEquals(Set.of("a"), report.orphanedNodeIds());
    }
}
