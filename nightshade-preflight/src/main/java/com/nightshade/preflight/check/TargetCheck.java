package com.nightshade.preflight.check;

import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Coordinate ranges, empty targets and altitude constraints of enabled target headers.
 */
public final class TargetCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.TARGETS;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        Sequence sequence = context.sequence();
        List<ValidationIssue> issues = new ArrayList<>();
        List<SequenceNode> targets = sequence.targetHeaders();
        if (targets.isEmpty()) {
            if (!sequence.exposureNodes().isEmpty()) {
                issues.add(ValidationIssue.warning(category(), "No Targets Defined",
                        "Exposures exist but no target is defined. The mount will image at its current position.",
                        null, "Add a target node with coordinates."));
            }
            return issues;
        }
        double lowAltitude = context.config().getLowAltitudeDegrees();
        for (SequenceNode node : targets) {
            NodeSpec.TargetHeader target = node.spec(NodeSpec.TargetHeader.class);
            String name = target.targetName().isBlank() ? node.getName() : target.targetName();
            double ra = target.raHours();
            double dec = target.decDegrees();
            if (!(ra >= 0 && ra < 24)) {
                issues.add(ValidationIssue.error(category(), "Invalid RA",
                        "Target \"" + name + "\" has invalid RA: " + ra + "h", node.getId(),
                        "RA must be between 0 and 24 hours."));
            }
            if (!(dec >= -90 && dec <= 90)) {
                issues.add(ValidationIssue.error(category(), "Invalid Dec",
                        "Target \"" + name + "\" has invalid Dec: " + dec + "°", node.getId(),
                        "Declination must be between -90 and +90 degrees."));
            }
            if (node.getChildIds().isEmpty()) {
                issues.add(ValidationIssue.warning(category(), "Empty Target",
                        "Target \"" + name + "\" has no instructions.", node.getId(),
                        "Add exposure or other instruction nodes to the target."));
            }
            Double min = target.minAltitude();
            Double max = target.maxAltitude();
            if (min != null && min < lowAltitude) {
                issues.add(ValidationIssue.warning(category(), "Very Low Altitude Limit",
                        "Target \"" + name + "\" minimum altitude is " + min
                                + "°. Imaging near the horizon may result in poor quality.",
                        node.getId(), "Consider setting minimum altitude to 20° or higher."));
            }
            if (min != null && max != null && min > max) {
                issues.add(ValidationIssue.warning(category(), "Empty Altitude Window",
                        "Target \"" + name + "\" minimum altitude " + min + "° is above its maximum " + max + "°.",
                        node.getId(), "Swap or widen the altitude limits; the target will always be skipped."));
            }
        }
        return issues;
    }
}
