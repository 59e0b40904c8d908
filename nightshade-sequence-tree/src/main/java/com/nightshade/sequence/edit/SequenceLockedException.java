package com.nightshade.sequence.edit;

/**
 * Thrown when a structural edit (or a second run) is attempted while a sequence is leased to a run.
 */
public class SequenceLockedException extends RuntimeException {

    private final String sequenceId;

    public SequenceLockedException(String sequenceId, String message) {
        super(message);
        this.sequenceId = sequenceId;
    }

    public String getSequenceId() {
        return sequenceId;
    }
}
