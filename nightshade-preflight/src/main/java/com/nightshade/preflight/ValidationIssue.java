package com.nightshade.preflight;

import java.util.Objects;

/**
 * One preflight finding. {@code nodeId} and {@code resolution} are optional.
 */
public record ValidationIssue(ValidationSeverity severity,
                              String category,
                              String title,
                              String description,
                              String nodeId,
                              String resolution) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(title, "title");
        description = description != null ? description : "";
    }

    public static ValidationIssue error(String category, String title, String description,
                                        String nodeId, String resolution) {
        return new ValidationIssue(ValidationSeverity.ERROR, category, title, description, nodeId, resolution);
    }

    public static ValidationIssue warning(String category, String title, String description,
                                          String nodeId, String resolution) {
        return new ValidationIssue(ValidationSeverity.WARNING, category, title, description, nodeId, resolution);
    }

    public static ValidationIssue info(String category, String title, String description,
                                       String nodeId, String resolution) {
        return new ValidationIssue(ValidationSeverity.INFO, category, title, description, nodeId, resolution);
    }
}
