package com.nightshade.preflight;

import java.time.Instant;
import java.util.List;

/**
 * Ordered preflight findings. Errors block a run; warnings need an operator override; info never blocks.
 */
public final class ValidationResult {

    private final List<ValidationIssue> issues;
    private final Instant validatedAt;

    public ValidationResult(List<ValidationIssue> issues, Instant validatedAt) {
        this.issues = issues != null ? List.copyOf(issues) : List.of();
        this.validatedAt = validatedAt;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public boolean hasErrors() {
        return count(ValidationSeverity.ERROR) > 0;
    }

    public boolean hasWarnings() {
        return count(ValidationSeverity.WARNING) > 0;
    }

    /** True when nothing blocks the run (warnings and info allowed). */
    public boolean isValid() {
        return !hasErrors();
    }

    /** True when there are no issues at all. */
    public boolean isClean() {
        return issues.isEmpty();
    }

    public int getErrorCount() {
        return count(ValidationSeverity.ERROR);
    }

    public int getWarningCount() {
        return count(ValidationSeverity.WARNING);
    }

    public int getInfoCount() {
        return count(ValidationSeverity.INFO);
    }

    public List<ValidationIssue> issuesIn(String category) {
        return issues.stream().filter(i -> i.category().equals(category)).toList();
    }

    public List<ValidationIssue> withSeverity(ValidationSeverity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    private int count(ValidationSeverity severity) {
        int n = 0;
        for (ValidationIssue issue : issues) {
            if (issue.severity() == severity) n++;
        }
        return n;
    }

    /** One-line summary, e.g. {@code "2 errors, 1 warning, 0 info"}. */
    public String summary() {
        int errors = getErrorCount();
        int warnings = getWarningCount();
        return errors + (errors == 1 ? " error, " : " errors, ")
                + warnings + (warnings == 1 ? " warning, " : " warnings, ")
                + getInfoCount() + " info";
    }

    @Override
    public String toString() {
        return "ValidationResult{" + summary() + ", validatedAt=" + validatedAt + "}";
    }
}
