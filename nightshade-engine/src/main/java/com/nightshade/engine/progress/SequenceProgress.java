package com.nightshade.engine.progress;

import com.nightshade.engine.SequenceExecutionState;
import com.nightshade.engine.runtime.NodeStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a run, published after every node transition and periodically during
 * long instructions. Exposure and integration counters never decrease within a run.
 */
public final class SequenceProgress {

    private final String sequenceId;
    private final String sequenceName;
    private final SequenceExecutionState state;
    private final String currentNodeId;
    private final String currentNodeName;
    private final NodeStatus currentNodeStatus;
    private final long totalExposures;
    private final long completedExposures;
    private final double totalIntegrationSecs;
    private final double completedIntegrationSecs;
    private final double elapsedSecs;
    private final double estimatedRemainingSecs;
    private final String currentTarget;
    private final String currentFilter;
    private final String message;
    private final Map<String, Double> nodeProgress;
    private final Map<String, String> nodeDetails;
    private final Instant updatedAt;

    private SequenceProgress(Builder b) {
        this.sequenceId = b.sequenceId;
        this.sequenceName = b.sequenceName;
        this.state = b.state != null ? b.state : SequenceExecutionState.IDLE;
        this.currentNodeId = b.currentNodeId;
        this.currentNodeName = b.currentNodeName;
        this.currentNodeStatus = b.currentNodeStatus;
        this.totalExposures = b.totalExposures;
        this.completedExposures = b.completedExposures;
        this.totalIntegrationSecs = b.totalIntegrationSecs;
        this.completedIntegrationSecs = b.completedIntegrationSecs;
        this.elapsedSecs = b.elapsedSecs;
        this.estimatedRemainingSecs = b.estimatedRemainingSecs;
        this.currentTarget = b.currentTarget;
        this.currentFilter = b.currentFilter;
        this.message = b.message;
        this.nodeProgress = b.nodeProgress != null ? Map.copyOf(b.nodeProgress) : Map.of();
        this.nodeDetails = b.nodeDetails != null ? Map.copyOf(b.nodeDetails) : Map.of();
        this.updatedAt = b.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSequenceId() { return sequenceId; }
    public String getSequenceName() { return sequenceName; }
    public SequenceExecutionState getState() { return state; }
    public String getCurrentNodeId() { return currentNodeId; }
    public String getCurrentNodeName() { return currentNodeName; }
    public NodeStatus getCurrentNodeStatus() { return currentNodeStatus; }
    public long getTotalExposures() { return totalExposures; }
    public long getCompletedExposures() { return completedExposures; }
    public double getTotalIntegrationSecs() { return totalIntegrationSecs; }
    public double getCompletedIntegrationSecs() { return completedIntegrationSecs; }
    public double getElapsedSecs() { return elapsedSecs; }
    public double getEstimatedRemainingSecs() { return estimatedRemainingSecs; }
    public String getCurrentTarget() { return currentTarget; }
    public String getCurrentFilter() { return currentFilter; }
    public String getMessage() { return message; }
    /** Fractional progress (0..1) of long-running nodes, keyed by node id. */
    public Map<String, Double> getNodeProgress() { return nodeProgress; }
    public Map<String, String> getNodeDetails() { return nodeDetails; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Completed fraction of integration time, 0 when the total is unknown. */
    public double getFractionComplete() {
        return totalIntegrationSecs > 0 ? Math.min(1.0, completedIntegrationSecs / totalIntegrationSecs) : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SequenceProgress that)) return false;
        return totalExposures == that.totalExposures
                && completedExposures == that.completedExposures
                && Double.compare(totalIntegrationSecs, that.totalIntegrationSecs) == 0
                && Double.compare(completedIntegrationSecs, that.completedIntegrationSecs) == 0
                && Double.compare(elapsedSecs, that.elapsedSecs) == 0
                && Objects.equals(sequenceId, that.sequenceId)
                && state == that.state
                && Objects.equals(currentNodeId, that.currentNodeId)
                && currentNodeStatus == that.currentNodeStatus
                && Objects.equals(currentTarget, that.currentTarget)
                && Objects.equals(currentFilter, that.currentFilter)
                && Objects.equals(message, that.message)
                && nodeProgress.equals(that.nodeProgress)
                && nodeDetails.equals(that.nodeDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, state, currentNodeId, completedExposures, completedIntegrationSecs, message);
    }

    @Override
    public String toString() {
        return "SequenceProgress{state=" + state
                + ", node=" + currentNodeName + "(" + currentNodeStatus + ")"
                + ", exposures=" + completedExposures + "/" + totalExposures
                + ", integrationSecs=" + completedIntegrationSecs + "/" + totalIntegrationSecs
                + ", target=" + currentTarget
                + ", message=" + message + "}";
    }

    public static final class Builder {
        private String sequenceId;
        private String sequenceName;
        private SequenceExecutionState state;
        private String currentNodeId;
        private String currentNodeName;
        private NodeStatus currentNodeStatus;
        private long totalExposures;
        private long completedExposures;
        private double totalIntegrationSecs;
        private double completedIntegrationSecs;
        private double elapsedSecs;
        private double estimatedRemainingSecs;
        private String currentTarget;
        private String currentFilter;
        private String message;
        private Map<String, Double> nodeProgress;
        private Map<String, String> nodeDetails;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder sequenceId(String v) { this.sequenceId = v; return this; }
        public Builder sequenceName(String v) { this.sequenceName = v; return this; }
        public Builder state(SequenceExecutionState v) { this.state = v; return this; }
        public Builder currentNodeId(String v) { this.currentNodeId = v; return this; }
        public Builder currentNodeName(String v) { this.currentNodeName = v; return this; }
        public Builder currentNodeStatus(NodeStatus v) { this.currentNodeStatus = v; return this; }
        public Builder totalExposures(long v) { this.totalExposures = v; return this; }
        public Builder completedExposures(long v) { this.completedExposures = v; return this; }
        public Builder totalIntegrationSecs(double v) { this.totalIntegrationSecs = v; return this; }
        public Builder completedIntegrationSecs(double v) { this.completedIntegrationSecs = v; return this; }
        public Builder elapsedSecs(double v) { this.elapsedSecs = v; return this; }
        public Builder estimatedRemainingSecs(double v) { this.estimatedRemainingSecs = v; return this; }
        public Builder currentTarget(String v) { this.currentTarget = v; return this; }
        public Builder currentFilter(String v) { this.currentFilter = v; return this; }
        public Builder message(String v) { this.message = v; return this; }
        public Builder nodeProgress(Map<String, Double> v) { this.nodeProgress = v; return this; }
        public Builder nodeDetails(Map<String, String> v) { this.nodeDetails = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }

        public SequenceProgress build() {
            return new SequenceProgress(this);
        }
    }
}
