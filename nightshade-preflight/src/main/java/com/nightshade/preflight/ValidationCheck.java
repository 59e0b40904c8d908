package com.nightshade.preflight;

import java.util.List;

/**
 * One independently computable category of preflight checks. Implementations must be read-only.
 */
public interface ValidationCheck {

    String category();

    List<ValidationIssue> check(ValidationContext context);
}
