package com.nightshade.estimate;

import com.nightshade.sequence.model.LoopConditionType;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of integration-time estimation.
 * <p>
 * {@code singleIterationSecs} stays meaningful for unbounded plans, where {@code estimatedSecs}
 * covers one iteration only. {@code untilTime} is set for time-bounded loops and
 * {@code conditionType} for unbounded ones; containers carry the first value found among their children.
 */
public final class SequenceEstimate {

    public static final SequenceEstimate ZERO = new SequenceEstimate(0, 0, false, null, null, 0);

    private final double estimatedSecs;
    private final double singleIterationSecs;
    private final boolean unbounded;
    private final Instant untilTime;
    private final LoopConditionType conditionType;
    private final long estimatedExposures;

    public SequenceEstimate(double estimatedSecs, double singleIterationSecs, boolean unbounded,
                            Instant untilTime, LoopConditionType conditionType, long estimatedExposures) {
        this.estimatedSecs = estimatedSecs;
        this.singleIterationSecs = singleIterationSecs;
        this.unbounded = unbounded;
        this.untilTime = untilTime;
        this.conditionType = conditionType;
        this.estimatedExposures = estimatedExposures;
    }

    public double getEstimatedSecs() {
        return estimatedSecs;
    }

    public double getSingleIterationSecs() {
        return singleIterationSecs;
    }

    public boolean isUnbounded() {
        return unbounded;
    }

    public Instant getUntilTime() {
        return untilTime;
    }

    public LoopConditionType getConditionType() {
        return conditionType;
    }

    /** Frames the estimate accounts for, with the same loop multipliers as the seconds. */
    public long getEstimatedExposures() {
        return estimatedExposures;
    }

    /**
     * Human-readable form: {@code "12m/iter (unbounded)"}, {@code "3h 20m"} or {@code "45m"}.
     */
    public String format() {
        if (unbounded) {
            return Math.round(singleIterationSecs / 60) + "m/iter (unbounded)";
        }
        long hours = (long) Math.floor(estimatedSecs / 3600);
        long mins = Math.round((estimatedSecs % 3600) / 60);
        if (hours > 0) {
            return hours + "h " + mins + "m";
        }
        return mins + "m";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SequenceEstimate that = (SequenceEstimate) o;
        return Double.compare(estimatedSecs, that.estimatedSecs) == 0
                && Double.compare(singleIterationSecs, that.singleIterationSecs) == 0
                && unbounded == that.unbounded && estimatedExposures == that.estimatedExposures
                && Objects.equals(untilTime, that.untilTime) && conditionType == that.conditionType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(estimatedSecs, singleIterationSecs, unbounded, untilTime, conditionType, estimatedExposures);
    }

    @Override
    public String toString() {
        return "SequenceEstimate{" + format() + ", secs=" + estimatedSecs + ", iter=" + singleIterationSecs
                + ", exposures=" + estimatedExposures + "}";
    }
}
