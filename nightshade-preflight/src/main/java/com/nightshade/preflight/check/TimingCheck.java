package com.nightshade.preflight.check;

import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.SequenceNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags timestamps that already precede the validation instant (stale plans) and loop end
 * conditions that are missing their limit.
 */
public final class TimingCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.TIMING;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        Instant now = context.validatedAt();
        List<ValidationIssue> issues = new ArrayList<>();
        for (SequenceNode node : context.sequence().getNodes().values()) {
            if (!node.isEnabled()) continue;
            if (node.getSpec() instanceof NodeSpec.WaitTime wait) {
                if (wait.waitUntil() != null && wait.waitUntil().isBefore(now)) {
                    issues.add(ValidationIssue.warning(category(), "Wait Time Passed",
                            "Wait node \"" + node.getName() + "\" is set for a time that has already passed.",
                            node.getId(), "Update the wait time or remove the node."));
                }
            } else if (node.getSpec() instanceof NodeSpec.Loop loop) {
                if (loop.conditionType() == LoopConditionType.UNTIL_TIME
                        && loop.repeatUntil() != null && loop.repeatUntil().isBefore(now)) {
                    issues.add(ValidationIssue.warning(category(), "Loop End Time Passed",
                            "Loop \"" + node.getName() + "\" end time has already passed.",
                            node.getId(), "Update the end time or change loop condition."));
                }
                if (loop.conditionType() == LoopConditionType.UNTIL_ALTITUDE && loop.repeatUntilAltitude() == null) {
                    issues.add(ValidationIssue.warning(category(), "Loop Altitude Not Set",
                            "Loop \"" + node.getName() + "\" repeats until an altitude but has no altitude limit; it will not run.",
                            node.getId(), "Set the altitude limit or change loop condition."));
                }
            } else if (node.getSpec() instanceof NodeSpec.TargetHeader target) {
                if (target.endBefore() != null && target.endBefore().isBefore(now)) {
                    issues.add(ValidationIssue.warning(category(), "Target Window Passed",
                            "Target \"" + node.getName() + "\" must finish before a time that has already passed.",
                            node.getId(), "Update the target's end time; it will be skipped as is."));
                }
            }
        }
        return issues;
    }
}
