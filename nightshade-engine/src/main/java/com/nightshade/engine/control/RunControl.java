package com.nightshade.engine.control;

import com.nightshade.engine.SequenceExecutionState;
import com.nightshade.engine.progress.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator commands for one run and the cooperative checkpoint every handler passes through.
 * Pause takes effect at the next node or frame boundary; stop cancels the root token, which
 * in-flight device waits observe within one poll interval.
 */
public final class RunControl {

    private static final Logger log = LoggerFactory.getLogger(RunControl.class);

    private final CancellationToken rootToken = CancellationToken.root();
    private final ProgressTracker tracker;
    private final long pollMillis;
    private final Set<String> skipRequests = ConcurrentHashMap.newKeySet();
    private final Object monitor = new Object();
    private boolean paused;

    public RunControl(ProgressTracker tracker, Duration pollInterval) {
        this.tracker = tracker;
        this.pollMillis = Math.max(1, pollInterval.toMillis());
    }

    public CancellationToken rootToken() {
        return rootToken;
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollMillis);
    }

    /** @throws IllegalStateException unless the run is RUNNING */
    public void pause(String reason) {
        synchronized (monitor) {
            SequenceExecutionState state = tracker.getState();
            if (state != SequenceExecutionState.RUNNING) {
                throw new IllegalStateException("Cannot pause a run in state " + state);
            }
            paused = true;
            tracker.updateState(SequenceExecutionState.PAUSED, reason != null ? reason : "Paused");
            log.info("Run paused | reason={}", reason);
        }
    }

    /** Pauses unless the run is already paused, stopping or finished. Returns whether it paused. */
    public boolean pauseIfRunning(String reason) {
        synchronized (monitor) {
            if (tracker.getState() != SequenceExecutionState.RUNNING) return false;
            pause(reason);
            return true;
        }
    }

    /** @throws IllegalStateException unless the run is PAUSED */
    public void resume() {
        synchronized (monitor) {
            SequenceExecutionState state = tracker.getState();
            if (state != SequenceExecutionState.PAUSED) {
                throw new IllegalStateException("Cannot resume a run in state " + state);
            }
            paused = false;
            tracker.updateState(SequenceExecutionState.RUNNING, "Resumed");
            monitor.notifyAll();
            log.info("Run resumed");
        }
    }

    /**
     * Requests a stop. Idempotent while stopping.
     *
     * @throws IllegalStateException if the run already finished or never started
     */
    public void stop() {
        synchronized (monitor) {
            SequenceExecutionState state = tracker.getState();
            if (state == SequenceExecutionState.STOPPING) return;
            if (!state.isActive()) {
                throw new IllegalStateException("Cannot stop a run in state " + state);
            }
            paused = false;
            tracker.updateState(SequenceExecutionState.STOPPING, "Stop requested");
            rootToken.cancel(CancellationReason.STOP);
            monitor.notifyAll();
            log.info("Run stop requested");
        }
    }

    public boolean isStopRequested() {
        return rootToken.isCancelled();
    }

    /** Marks the given running instructions to be skipped at their next poll. */
    public void requestSkip(Collection<String> nodeIds) {
        skipRequests.addAll(nodeIds);
        if (log.isInfoEnabled()) {
            log.info("Skip requested | nodeIds={}", nodeIds);
        }
    }

    public boolean isSkipRequested(String nodeId) {
        return skipRequests.contains(nodeId);
    }

    public void clearSkip(String nodeId) {
        skipRequests.remove(nodeId);
    }

    /** A fresh execution of {@code nodeId} starts: a skip aimed at an earlier execution no longer applies. */
    public void enterNode(String nodeId) {
        if (skipRequests.remove(nodeId)) {
            log.debug("Stale skip request dropped | nodeId={}", nodeId);
        }
    }

    /**
     * Node or frame boundary: throws when cancelled or skipped, blocks while paused.
     */
    public void checkpoint(CancellationToken token, String nodeId) {
        token.throwIfCancelled(nodeId, false);
        if (isSkipRequested(nodeId)) {
            throw new ExecutionCancelledException(CancellationReason.SKIP, nodeId, false);
        }
        awaitResume(token, nodeId);
        token.throwIfCancelled(nodeId, false);
    }

    /** Blocks while paused; returns when resumed, throws when cancelled. */
    public void awaitResume(CancellationToken token, String nodeId) {
        synchronized (monitor) {
            while (paused && !token.isCancelled()) {
                try {
                    monitor.wait(pollMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExecutionCancelledException(CancellationReason.STOP, nodeId, false);
                }
            }
        }
        token.throwIfCancelled(nodeId, false);
    }
}
