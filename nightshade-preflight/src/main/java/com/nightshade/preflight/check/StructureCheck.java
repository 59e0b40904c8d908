package com.nightshade.preflight.check;

import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.tree.StructureReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Empty tree, missing root, dangling references, cycles, orphans, shared children and unknown node types.
 */
public final class StructureCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.STRUCTURE;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        Sequence sequence = context.sequence();
        List<ValidationIssue> issues = new ArrayList<>();
        if (sequence.isEmpty()) {
            issues.add(ValidationIssue.error(category(), "Empty Sequence",
                    "The sequence has no nodes. Add at least one instruction to run.", null,
                    "Add exposure or other instruction nodes to the sequence."));
            return issues;
        }
        StructureReport structure = context.structure();
        if (!structure.rootSet()) {
            issues.add(ValidationIssue.error(category(), "No Root Node",
                    "The sequence has no root node to execute.", null,
                    "Ensure the sequence has a root node."));
        } else if (!structure.rootFound()) {
            issues.add(ValidationIssue.error(category(), "Root Node Missing",
                    "The root node '" + sequence.getRootNodeId() + "' does not exist in the sequence.", null,
                    "Select an existing node as the root."));
        }
        for (StructureReport.DanglingReference ref : structure.danglingReferences()) {
            issues.add(ValidationIssue.error(category(), "Missing Child Node",
                    "Node \"" + nameOf(sequence, ref.parentId()) + "\" references child '" + ref.missingChildId()
                            + "' which does not exist.",
                    ref.parentId(), "Remove the reference or restore the missing node."));
        }
        for (List<String> cycle : structure.cycles()) {
            issues.add(ValidationIssue.error(category(), "Cycle Detected",
                    "Nodes form a loop through their child references: " + String.join(" -> ", cycle) + ".",
                    cycle.get(0), "Move one of these nodes so that no node is its own ancestor."));
        }
        if (structure.rootFound() && !structure.orphanedNodeIds().isEmpty()) {
            issues.add(ValidationIssue.warning(category(), "Orphaned Nodes",
                    structure.orphanedNodeIds().size() + " node(s) are not connected to the sequence.", null,
                    "Remove unused nodes or connect them to a parent."));
        }
        for (String sharedId : structure.sharedNodeIds()) {
            issues.add(ValidationIssue.warning(category(), "Shared Node",
                    "Node \"" + nameOf(sequence, sharedId) + "\" has more than one parent and will run once per parent.",
                    sharedId, "Duplicate the node instead of sharing it."));
        }
        for (String unknownId : structure.unknownTypeNodeIds()) {
            issues.add(ValidationIssue.warning(category(), "Unknown Node Type",
                    "Node \"" + nameOf(sequence, unknownId) + "\" was created by a newer version and will be skipped.",
                    unknownId, "Update the application or remove the node."));
        }
        return issues;
    }

    private static String nameOf(Sequence sequence, String nodeId) {
        return sequence.getNode(nodeId) != null ? sequence.getNode(nodeId).getName() : nodeId;
    }
}
