package com.nightshade.sequence.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceTest {

    private static final Instant NOW = Instant.parse("2026-10-17T20:00:00Z");

    @Test
    void getChildren_sortsByOrderIndexAndDropsDanglingIds() {
        SequenceNode root = new SequenceNode("root", "Root", true, List.of("b", "ghost", "a"), null, 0,
                new NodeSpec.InstructionSet());
        SequenceNode a = new SequenceNode("a", "A", true, null, "root", 0, new NodeSpec.Delay(1.0));
        SequenceNode b = new SequenceNode("b", "B", true, null, "root", 1, new NodeSpec.Delay(2.0));
        Sequence sequence = Sequence.empty("S", NOW).withRoot(root).withNode(a).withNode(b);

        List<SequenceNode> children = sequence.getChildren("root");

        assertEquals(List.of("a", "b"), children.stream().map(SequenceNode::getId).toList());
    }

    @Test
    void totalExposures_countsEnabledExposuresOnly() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        Sequence sequence = Sequence.empty("S", NOW).withRoot(root)
                .withChild(root.getId(), SequenceNode.create("L", NodeSpec.Exposure.of(60, 10)))
                .withChild(root.getId(), SequenceNode.create("R", NodeSpec.Exposure.of(60, 5)).withEnabled(false));

        assertEquals(10, sequence.totalExposures());
        assertEquals(1, sequence.exposureNodes().size());
    }

    @Test
    void withChild_linksParentAndAssignsOrderIndex() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode first = SequenceNode.create("First", new NodeSpec.Park());
        SequenceNode second = SequenceNode.create("Second", new NodeSpec.Unpark());

        Sequence sequence = Sequence.empty("S", NOW).withRoot(root)
                .withChild(root.getId(), first)
                .withChild(root.getId(), second);

        assertEquals(List.of(first.getId(), second.getId()), sequence.getRootNode().getChildIds());
        assertEquals(root.getId(), sequence.getNode(second.getId()).getParentId());
        assertEquals(1, sequence.getNode(second.getId()).getOrderIndex());
        assertThrows(IllegalArgumentException.class, () -> sequence.withChild("missing", first));
    }

    @Test
    void withoutNode_unlinksFromParentAndClearsRoot() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode child = SequenceNode.create("Child", new NodeSpec.Park());
        Sequence sequence = Sequence.empty("S", NOW).withRoot(root).withChild(root.getId(), child);

        Sequence withoutChild = sequence.withoutNode(child.getId());
        Sequence withoutRoot = sequence.withoutNode(root.getId());

        assertTrue(withoutChild.getRootNode().getChildIds().isEmpty());
        assertNull(withoutRoot.getRootNodeId());
        assertEquals(1, withoutRoot.getNodes().size());
    }

    @Test
    void withRefreshedIds_remapsEveryReferenceConsistently() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode target = SequenceNode.create("Target", NodeSpec.TargetHeader.at("M42", 5.58, -5.39));
        SequenceNode exposure = SequenceNode.create("Lights", NodeSpec.Exposure.of(120, 20));
        Sequence template = Sequence.empty("Template", NOW).asTemplate(true).withRoot(root)
                .withChild(root.getId(), target)
                .withChild(target.getId(), exposure);

        Sequence copy = template.withRefreshedIds();

        assertFalse(copy.isTemplate());
        assertNotEquals(template.getId(), copy.getId());
        Set<String> oldIds = new HashSet<>(template.getNodes().keySet());
        for (SequenceNode node : copy.getNodes().values()) {
            assertFalse(oldIds.contains(node.getId()));
            for (String childId : node.getChildIds()) {
                assertEquals(node.getId(), copy.getNode(childId).getParentId());
            }
        }
        SequenceNode newRoot = copy.getRootNode();
        assertEquals("Root", newRoot.getName());
        SequenceNode newTarget = copy.getChildren(newRoot.getId()).get(0);
        assertEquals("Lights", copy.getChildren(newTarget.getId()).get(0).getName());
    }

    @Test
    void targetHeaders_sortedByOrderIndex() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode m31 = SequenceNode.create("M31", NodeSpec.TargetHeader.at("M31", 0.71, 41.3));
        SequenceNode m33 = SequenceNode.create("M33", NodeSpec.TargetHeader.at("M33", 1.56, 30.7));
        Sequence sequence = Sequence.empty("S", NOW).withRoot(root)
                .withChild(root.getId(), m31)
                .withChild(root.getId(), m33);

        assertEquals(List.of("M31", "M33"), sequence.targetHeaders().stream().map(SequenceNode::getName).toList());
    }

    @Test
    void spec_wrongVariantThrows() {
        SequenceNode node = SequenceNode.create("Park", new NodeSpec.Park());

        assertThrows(IllegalStateException.class, () -> node.spec(NodeSpec.Exposure.class));
    }
}
