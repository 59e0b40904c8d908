package com.nightshade.preflight.check;

import com.nightshade.config.SequencerConfig;
import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.SequenceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Exposure parameters and total integration time.
 */
public final class ExposureCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.EXPOSURES;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SequencerConfig config = context.config();
        List<ValidationIssue> issues = new ArrayList<>();
        List<SequenceNode> exposures = context.sequence().exposureNodes();
        if (exposures.isEmpty()) {
            if (!context.sequence().isEmpty()) {
                issues.add(ValidationIssue.warning(category(), "No Exposures",
                        "No exposure nodes found. The sequence will run but capture no images.", null,
                        "Add Exposure nodes to capture images."));
            }
            return issues;
        }
        for (SequenceNode node : exposures) {
            NodeSpec.Exposure exposure = node.spec(NodeSpec.Exposure.class);
            double duration = exposure.durationSecs();
            if (!(duration > 0)) {
                issues.add(ValidationIssue.error(category(), "Invalid Exposure Time",
                        "Exposure \"" + node.getName() + "\" has invalid duration: " + duration + "s",
                        node.getId(), "Set a positive exposure duration."));
            } else if (duration > config.getExposureCeilingSecs()) {
                issues.add(ValidationIssue.warning(category(), "Very Long Exposure",
                        String.format("Exposure \"%s\" is %.0f minutes. Very long exposures may fail due to tracking errors.",
                                node.getName(), duration / 60),
                        node.getId(), "Consider breaking into shorter exposures or using auto-guiding."));
            }
            if (exposure.count() <= 0) {
                issues.add(ValidationIssue.error(category(), "Invalid Frame Count",
                        "Exposure \"" + node.getName() + "\" has count of " + exposure.count() + ".",
                        node.getId(), "Set at least 1 frame to capture."));
            }
            if (exposure.binning().getFactor() >= config.getHighBinningFactor()) {
                issues.add(ValidationIssue.info(category(), "High Binning",
                        "Exposure \"" + node.getName() + "\" uses " + exposure.binning().getLabel()
                                + " binning which reduces resolution.",
                        node.getId(), null));
            }
        }
        double totalSecs = context.estimate().getEstimatedSecs();
        if (totalSecs > config.getLongSequenceSecs()) {
            issues.add(ValidationIssue.warning(category(), "Very Long Sequence",
                    String.format("Total integration time is %.1f hours. Consider splitting across multiple nights.",
                            totalSecs / 3600),
                    null, "Split the plan into one sequence per session."));
        }
        return issues;
    }
}
