package com.nightshade.engine.progress;

import com.nightshade.engine.SequenceExecutionState;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.engine.runtime.NodeStatusListener;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates node transitions and frame completions into {@link SequenceProgress} snapshots and
 * pushes them to listeners. All mutation goes through this class; once the run reaches a terminal
 * state the snapshot is frozen and further updates are ignored.
 */
public final class ProgressTracker implements NodeStatusListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String sequenceId;
    private final String sequenceName;
    private final Clock clock;
    private final long publishIntervalNanos;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private SequenceExecutionState state = SequenceExecutionState.IDLE;
    private String currentNodeId;
    private String currentNodeName;
    private NodeStatus currentNodeStatus;
    private long totalExposures;
    private long completedExposures;
    private double totalIntegrationSecs;
    private double completedIntegrationSecs;
    private String currentTarget;
    private String currentFilter;
    private String message;
    private final Map<String, Double> nodeProgress = new LinkedHashMap<>();
    private final Map<String, String> nodeDetails = new LinkedHashMap<>();
    private Instant startedAt;
    private Instant finishedAt;
    private long lastPublishNanos;

    private volatile SequenceProgress current;

    public ProgressTracker(String sequenceId, String sequenceName, Clock clock, Duration publishInterval) {
        this.sequenceId = sequenceId;
        this.sequenceName = sequenceName;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.publishIntervalNanos = publishInterval != null ? publishInterval.toNanos() : 0L;
        this.current = build();
    }

    public void addListener(ProgressListener listener) {
        if (listener != null) listeners.add(listener);
    }

    /** Latest published snapshot. */
    public SequenceProgress snapshot() {
        return current;
    }

    public synchronized SequenceExecutionState getState() {
        return state;
    }

    public synchronized String getCurrentFilter() {
        return currentFilter;
    }

    public synchronized void start(long expectedExposures, double expectedIntegrationSecs) {
        if (state != SequenceExecutionState.IDLE) {
            throw new IllegalStateException("Run already started | state=" + state);
        }
        totalExposures = Math.max(0, expectedExposures);
        totalIntegrationSecs = Math.max(0, expectedIntegrationSecs);
        startedAt = clock.instant();
        state = SequenceExecutionState.RUNNING;
        message = "Running";
        publish();
    }

    /** Non-terminal state change (pause, resume, stopping). */
    public synchronized void updateState(SequenceExecutionState next, String statusMessage) {
        if (state.isTerminal()) {
            log.debug("Progress updateState ignored | sequenceId={} | terminal={} | requested={}", sequenceId, state, next);
            return;
        }
        state = next;
        if (statusMessage != null) message = statusMessage;
        publish();
    }

    public synchronized void finish(SequenceExecutionState terminal, String statusMessage) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (state.isTerminal()) return;
        state = terminal;
        message = statusMessage;
        finishedAt = clock.instant();
        publish();
        if (log.isInfoEnabled()) {
            log.info("Run finished | sequenceId={} | state={} | exposures={}/{} | message={}",
                    sequenceId, terminal, completedExposures, totalExposures, statusMessage);
        }
    }

    @Override
    public synchronized void onTransition(SequenceNode node, NodeStatus from, NodeStatus to) {
        if (state.isTerminal()) return;
        if (to == NodeStatus.RUNNING && !node.getType().isContainer()) {
            currentNodeId = node.getId();
            currentNodeName = node.getName();
        }
        if (node.getId().equals(currentNodeId)) {
            currentNodeStatus = to;
        }
        for (ProgressListener listener : listeners) {
            try {
                listener.onNodeStatusChanged(node, from, to);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed on transition | nodeId={} | error={}", node.getId(), e.getMessage(), e);
            }
        }
        publish();
    }

    /** One frame captured successfully. */
    public synchronized void frameCompleted(String nodeId, double durationSecs) {
        if (state.isTerminal()) return;
        completedExposures++;
        completedIntegrationSecs += Math.max(0, durationSecs);
        totalExposures = Math.max(totalExposures, completedExposures);
        totalIntegrationSecs = Math.max(totalIntegrationSecs, completedIntegrationSecs);
        publish();
    }

    /** Sub-progress of a long-running node; published at most once per interval. */
    public synchronized void reportNodeProgress(String nodeId, double fraction, String detail) {
        if (state.isTerminal()) return;
        nodeProgress.put(nodeId, Math.max(0.0, Math.min(1.0, fraction)));
        if (detail != null) nodeDetails.put(nodeId, detail);
        heartbeat();
    }

    public synchronized void currentTarget(String targetName) {
        if (state.isTerminal()) return;
        currentTarget = targetName;
        publish();
    }

    public synchronized void currentFilter(String filterName) {
        if (state.isTerminal()) return;
        currentFilter = filterName;
        publish();
    }

    public synchronized void message(String statusMessage) {
        if (state.isTerminal()) return;
        message = statusMessage;
        publish();
    }

    /** Publishes if the interval has elapsed since the last snapshot. */
    public synchronized void heartbeat() {
        if (state.isTerminal()) return;
        if (System.nanoTime() - lastPublishNanos >= publishIntervalNanos) {
            publish();
        }
    }

    private void publish() {
        current = build();
        lastPublishNanos = System.nanoTime();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(current);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed | sequenceId={} | error={}", sequenceId, e.getMessage(), e);
            }
        }
    }

    private SequenceProgress build() {
        Instant now = clock.instant();
        Instant end = finishedAt != null ? finishedAt : now;
        double elapsed = startedAt != null ? Math.max(0, Duration.between(startedAt, end).toMillis() / 1000.0) : 0.0;
        return SequenceProgress.builder()
                .sequenceId(sequenceId)
                .sequenceName(sequenceName)
                .state(state)
                .currentNodeId(currentNodeId)
                .currentNodeName(currentNodeName)
                .currentNodeStatus(currentNodeStatus)
                .totalExposures(totalExposures)
                .completedExposures(completedExposures)
                .totalIntegrationSecs(totalIntegrationSecs)
                .completedIntegrationSecs(completedIntegrationSecs)
                .elapsedSecs(elapsed)
                .estimatedRemainingSecs(Math.max(0, totalIntegrationSecs - completedIntegrationSecs))
                .currentTarget(currentTarget)
                .currentFilter(currentFilter)
                .message(message)
                .nodeProgress(nodeProgress)
                .nodeDetails(nodeDetails)
                .updatedAt(now)
                .build();
    }
}
