package com.nightshade.engine;

import com.nightshade.engine.control.RunControl;
import com.nightshade.engine.progress.ProgressTracker;
import com.nightshade.engine.progress.SequenceProgress;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.engine.runtime.RuntimeSequenceTree;
import com.nightshade.estimate.SequenceEstimate;
import com.nightshade.preflight.ValidationResult;
import com.nightshade.sequence.model.Sequence;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Handle to one started run: operator commands, live progress and node statuses, and completion.
 * Commands are safe to call from any thread.
 */
public final class SequenceRun {

    private final String runId;
    private final Sequence sequence;
    private final ProgressTracker tracker;
    private final RunControl control;
    private final RuntimeSequenceTree tree;
    private final ValidationResult validation;
    private final SequenceEstimate estimate;
    private final Supplier<SequenceEstimate> estimator;
    private final CompletableFuture<SequenceProgress> completion = new CompletableFuture<>();

    SequenceRun(String runId, Sequence sequence, ProgressTracker tracker, RunControl control,
                RuntimeSequenceTree tree, ValidationResult validation, SequenceEstimate estimate,
                Supplier<SequenceEstimate> estimator) {
        this.runId = runId;
        this.sequence = sequence;
        this.tracker = tracker;
        this.control = control;
        this.tree = tree;
        this.validation = validation;
        this.estimate = estimate;
        this.estimator = estimator;
    }

    public String getRunId() {
        return runId;
    }

    /** The leased version of the sequence this run executes. */
    public Sequence getSequence() {
        return sequence;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    /** Estimate taken when the run started. */
    public SequenceEstimate getEstimate() {
        return estimate;
    }

    /** Re-estimates the leased sequence against the current time, e.g. for until-time loops. */
    public SequenceEstimate refreshEstimate() {
        return estimator.get();
    }

    // ---- commands ----

    /** @throws IllegalStateException unless the run is RUNNING */
    public void pause() {
        control.pause("Paused by operator");
    }

    /** @throws IllegalStateException unless the run is PAUSED */
    public void resume() {
        control.resume();
    }

    /** @throws IllegalStateException if the run already finished */
    public void stop() {
        control.stop();
    }

    /**
     * Cancels the instructions currently running and marks them skipped; the run continues
     * with the next node. Returns the ids that were asked to skip (empty between instructions).
     *
     * @throws IllegalStateException unless the run is RUNNING or PAUSED
     */
    public List<String> skipCurrent() {
        SequenceExecutionState state = tracker.getState();
        if (state != SequenceExecutionState.RUNNING && state != SequenceExecutionState.PAUSED) {
            throw new IllegalStateException("Cannot skip in state " + state);
        }
        // the tree lock orders this against status transitions: a node cannot finish between
        // being seen RUNNING and being marked, so no request outlives its execution
        synchronized (tree) {
            List<String> running = tree.runningInstructionIds();
            if (!running.isEmpty()) {
                control.requestSkip(running);
            }
            return running;
        }
    }

    // ---- observation ----

    public SequenceProgress progress() {
        return tracker.snapshot();
    }

    public SequenceExecutionState getState() {
        return tracker.getState();
    }

    public NodeStatus statusOf(String nodeId) {
        return tree.statusOf(nodeId);
    }

    /** Number of times the node entered FAILURE during this run. */
    public int failureCount(String nodeId) {
        return tree.failureCount(nodeId);
    }

    public Map<String, NodeStatus> statuses() {
        return tree.statuses();
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    /** Completes with the final snapshot once the run settles; never completes exceptionally. */
    public CompletableFuture<SequenceProgress> completion() {
        return completion.copy();
    }

    public SequenceProgress awaitCompletion(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " completed exceptionally", e.getCause());
        }
    }

    void complete(SequenceProgress finalProgress) {
        completion.complete(finalProgress);
    }
}
