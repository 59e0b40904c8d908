package com.nightshade.sequence.edit;

import com.nightshade.sequence.model.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Authoring context that owns the current version of a sequence. Edits replace the held value;
 * while a run holds the lease, edits are rejected with {@link SequenceLockedException}.
 */
public final class SequenceWorkspace {

    private static final Logger log = LoggerFactory.getLogger(SequenceWorkspace.class);

    private final Object lock = new Object();
    private Sequence current;
    private RunLease activeLease;

    public SequenceWorkspace(Sequence initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public Sequence current() {
        synchronized (lock) {
            return current;
        }
    }

    /**
     * Applies an edit and returns the new version.
     *
     * @throws SequenceLockedException while a run holds the lease
     */
    public Sequence update(UnaryOperator<Sequence> edit) {
        synchronized (lock) {
            if (activeLease != null) {
                log.warn("Workspace edit rejected | sequenceId={} | leasedBy={}", current.getId(), activeLease.getHolder());
                throw new SequenceLockedException(current.getId(),
                        "Sequence '" + current.getName() + "' is running; edits are not allowed until the run ends");
            }
            current = Objects.requireNonNull(edit.apply(current), "edit result");
            return current;
        }
    }

    public boolean isLeased() {
        synchronized (lock) {
            return activeLease != null;
        }
    }

    /**
     * Takes the exclusive run lease. The leased value is the version current at this moment.
     *
     * @throws SequenceLockedException if another run already holds it
     */
    public RunLease acquireRunLease(String holder) {
        synchronized (lock) {
            if (activeLease != null) {
                throw new SequenceLockedException(current.getId(),
                        "Sequence '" + current.getName() + "' is already leased by " + activeLease.getHolder());
            }
            activeLease = new RunLease(this, current, holder);
            if (log.isInfoEnabled()) {
                log.info("Workspace lease acquired | sequenceId={} | holder={}", current.getId(), holder);
            }
            return activeLease;
        }
    }

    void release(RunLease lease) {
        synchronized (lock) {
            if (activeLease == lease) {
                activeLease = null;
                if (log.isInfoEnabled()) {
                    log.info("Workspace lease released | sequenceId={} | holder={}", current.getId(), lease.getHolder());
                }
            }
        }
    }

    /** Exclusive read lease on one version of the sequence. Closing it is idempotent. */
    public static final class RunLease implements AutoCloseable {

        private final SequenceWorkspace owner;
        private final Sequence sequence;
        private final String holder;

        private RunLease(SequenceWorkspace owner, Sequence sequence, String holder) {
            this.owner = owner;
            this.sequence = sequence;
            this.holder = holder != null ? holder : "run";
        }

        public Sequence getSequence() {
            return sequence;
        }

        public String getHolder() {
            return holder;
        }

        @Override
        public void close() {
            owner.release(this);
        }
    }
}
