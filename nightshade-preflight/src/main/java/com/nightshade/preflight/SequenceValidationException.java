package com.nightshade.preflight;

/**
 * Thrown when a run is requested for a sequence whose preflight result does not allow it.
 * Carries the result so callers can show the blocking issues.
 */
public class SequenceValidationException extends RuntimeException {

    private final ValidationResult result;

    public SequenceValidationException(String message, ValidationResult result) {
        super(message);
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
