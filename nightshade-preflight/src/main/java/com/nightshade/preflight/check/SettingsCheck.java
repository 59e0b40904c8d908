package com.nightshade.preflight.check;

import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.sequence.model.Sequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory checks on sequence metadata.
 */
public final class SettingsCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.SETTINGS;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        Sequence sequence = context.sequence();
        List<ValidationIssue> issues = new ArrayList<>();
        if (sequence.getName().isBlank() || Sequence.DEFAULT_NAME.equals(sequence.getName())) {
            issues.add(ValidationIssue.info(category(), "Default Sequence Name",
                    "Consider naming your sequence for easier identification.", null, null));
        }
        Integer mins = sequence.getEstimatedDurationMins();
        if (mins != null && mins > context.config().getLongEstimateMins()) {
            issues.add(ValidationIssue.info(category(), "Long Sequence",
                    "This sequence is estimated to run for over " + context.config().getLongEstimateMins() / 60 + " hours.",
                    null, null));
        }
        return issues;
    }
}
