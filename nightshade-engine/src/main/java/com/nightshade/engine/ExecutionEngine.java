package com.nightshade.engine;

import com.nightshade.config.SequencerConfig;
import com.nightshade.device.DeviceCapabilityRegistry;
import com.nightshade.device.DeviceOperations;
import com.nightshade.device.DeviceSnapshot;
import com.nightshade.device.Telemetry;
import com.nightshade.engine.control.ExecutionCancelledException;
import com.nightshade.engine.control.RunControl;
import com.nightshade.engine.device.DeviceLocks;
import com.nightshade.engine.handler.ExecutionContext;
import com.nightshade.engine.handler.NodeHandlerRegistry;
import com.nightshade.engine.progress.MetricsProgressListener;
import com.nightshade.engine.progress.ProgressListener;
import com.nightshade.engine.progress.ProgressTracker;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.engine.runtime.RuntimeSequenceTree;
import com.nightshade.engine.sky.LocationTelemetry;
import com.nightshade.estimate.IntegrationTimeEstimator;
import com.nightshade.estimate.SequenceEstimate;
import com.nightshade.preflight.PreflightValidator;
import com.nightshade.preflight.SequenceValidationException;
import com.nightshade.preflight.ValidationResult;
import com.nightshade.sequence.edit.SequenceWorkspace;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.tree.StructureAnalyzer;
import com.nightshade.sequence.tree.StructureReport;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts sequence runs. A run leases its workspace, validates against a fresh device snapshot,
 * then walks the live tree on a dedicated run thread: the root first, then independent targets by
 * priority and order. Parallel branches run on a per-run pool.
 * <p>
 * Prefer {@link #start(SequenceWorkspace, boolean, ProgressListener...)}: the lease rejects
 * structural edits until the run settles.
 */
public final class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String ACTIVE_RUNS = "nightshade.runs.active";

    private final DeviceOperations devices;
    private final Telemetry telemetry;
    private final DeviceCapabilityRegistry registry;
    private final SequencerConfig config;
    private final Clock clock;
    private final NodeHandlerRegistry handlers;
    private final PreflightValidator validator;
    private final IntegrationTimeEstimator estimator;
    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeRuns = new AtomicInteger();

    public ExecutionEngine(DeviceOperations devices, Telemetry telemetry, DeviceCapabilityRegistry registry,
                           SequencerConfig config) {
        this(devices, telemetry, registry, config, Clock.systemUTC(), NodeHandlerRegistry.standard(), null);
    }

    /**
     * @param meterRegistry optional; when set, node transitions, exposures, integration time and run
     *                      durations are recorded
     */
    public ExecutionEngine(DeviceOperations devices, Telemetry telemetry, DeviceCapabilityRegistry registry,
                           SequencerConfig config, Clock clock, NodeHandlerRegistry handlers,
                           MeterRegistry meterRegistry) {
        this.devices = Objects.requireNonNull(devices, "devices");
        this.config = config != null ? config : SequencerConfig.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.registry = registry;
        this.telemetry = withSite(Objects.requireNonNull(telemetry, "telemetry"), this.config, this.clock);
        this.estimator = new IntegrationTimeEstimator();
        this.validator = new PreflightValidator(PreflightValidator.defaultChecks(), this.config, this.clock, estimator);
        this.meterRegistry = meterRegistry;
        if (meterRegistry != null) {
            meterRegistry.gauge(ACTIVE_RUNS, activeRuns);
        }
    }

    private static Telemetry withSite(Telemetry feed, SequencerConfig config, Clock clock) {
        Double latitude = config.getSiteLatitude();
        Double longitude = config.getSiteLongitude();
        if (latitude == null || longitude == null || feed instanceof LocationTelemetry) {
            return feed;
        }
        if (log.isInfoEnabled()) {
            log.info("Site telemetry enabled | latitude={} | longitude={}", latitude, longitude);
        }
        return new LocationTelemetry(latitude, longitude, clock, feed);
    }

    /** Re-check: validates against a fresh device snapshot without starting anything. */
    public ValidationResult validate(Sequence sequence) {
        return validator.validate(sequence, registry);
    }

    public SequenceEstimate estimate(Sequence sequence) {
        return estimator.estimateRoots(sequence, StructureAnalyzer.executionRoots(sequence, StructureAnalyzer.analyze(sequence)),
                clock.instant());
    }

    public int getActiveRunCount() {
        return activeRuns.get();
    }

    /** Runs a detached copy; nothing else can edit it, so no workspace is needed. */
    public SequenceRun start(Sequence sequence, boolean overrideWarnings, ProgressListener... listeners) {
        return start(new SequenceWorkspace(sequence), overrideWarnings, listeners);
    }

    /**
     * Leases the workspace, validates and starts the run. Errors always block; warnings block
     * unless {@code overrideWarnings} is set.
     *
     * @throws SequenceValidationException when validation blocks the run (the lease is released)
     * @throws com.nightshade.sequence.edit.SequenceLockedException when another run holds the lease
     */
    public SequenceRun start(SequenceWorkspace workspace, boolean overrideWarnings, ProgressListener... listeners) {
        String runId = UUID.randomUUID().toString();
        SequenceWorkspace.RunLease lease = workspace.acquireRunLease("run-" + runId);
        try {
            return launch(runId, lease, overrideWarnings, listeners);
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
    }

    private SequenceRun launch(String runId, SequenceWorkspace.RunLease lease, boolean overrideWarnings,
                               ProgressListener... listeners) {
        Sequence sequence = lease.getSequence();
        DeviceSnapshot snapshot = DeviceSnapshot.capture(registry);
        ValidationResult validation = validator.validate(sequence, snapshot);
        if (validation.hasErrors()) {
            log.warn("Run blocked by validation | sequenceId={} | {}", sequence.getId(), validation.summary());
            throw new SequenceValidationException("Sequence '" + sequence.getName()
                    + "' cannot run: " + validation.summary(), validation);
        }
        if (validation.hasWarnings() && !overrideWarnings) {
            log.warn("Run needs warning override | sequenceId={} | {}", sequence.getId(), validation.summary());
            throw new SequenceValidationException("Sequence '" + sequence.getName()
                    + "' has warnings that must be confirmed: " + validation.summary(), validation);
        }

        StructureReport structure = StructureAnalyzer.analyze(sequence);
        List<String> roots = StructureAnalyzer.executionRoots(sequence, structure);
        SequenceEstimate estimate = estimator.estimateRoots(sequence, roots, clock.instant());

        ProgressTracker tracker = new ProgressTracker(sequence.getId(), sequence.getName(), clock,
                config.getProgressInterval());
        for (ProgressListener listener : listeners) {
            tracker.addListener(listener);
        }
        if (meterRegistry != null) {
            tracker.addListener(new MetricsProgressListener(meterRegistry));
        }
        RuntimeSequenceTree tree = new RuntimeSequenceTree(sequence, structure.liveNodeIds(), tracker);
        RunControl control = new RunControl(tracker, config.getPollInterval());
        ExecutorService branchPool = newBranchPool(runId);
        ExecutionContext ctx = new ExecutionContext(sequence, tree, handlers, devices, telemetry, snapshot, config,
                clock, control, new DeviceLocks(), tracker, branchPool);
        SequenceRun run = new SequenceRun(runId, sequence, tracker, control, tree, validation, estimate,
                () -> estimator.estimateRoots(sequence, roots, clock.instant()));

        tracker.start(estimate.getEstimatedExposures(), estimate.getEstimatedSecs());
        if (log.isInfoEnabled()) {
            log.info("Run started | runId={} | sequenceId={} | roots={} | expectedExposures={} | estimate={}",
                    runId, sequence.getId(), roots.size(), estimate.getEstimatedExposures(), estimate.format());
        }
        activeRuns.incrementAndGet();
        Thread runner = new Thread(() -> execute(run, ctx, roots, lease, branchPool),
                "nightshade-run-" + runId.substring(0, 8));
        try {
            runner.start();
        } catch (RuntimeException e) {
            activeRuns.decrementAndGet();
            branchPool.shutdownNow();
            tracker.finish(SequenceExecutionState.FAILED, "Run thread could not start: " + e.getMessage());
            throw e;
        }
        return run;
    }

    private void execute(SequenceRun run, ExecutionContext ctx, List<String> roots,
                         SequenceWorkspace.RunLease lease, ExecutorService branchPool) {
        ProgressTracker tracker = ctx.progress();
        RuntimeSequenceTree tree = ctx.tree();
        String runId = run.getRunId();
        try {
            for (String rootId : roots) {
                try {
                    ctx.runNode(rootId);
                } catch (TargetSkippedException e) {
                    log.warn("Root skipped by recovery | runId={} | rootId={} | requestedBy={} | reason={}",
                            runId, rootId, e.getNodeId(), e.getMessage());
                    tree.settlePendingDescendants(rootId, NodeStatus.SKIPPED);
                }
            }
            tracker.finish(SequenceExecutionState.COMPLETED, "Sequence completed");
        } catch (ExecutionCancelledException e) {
            tree.cancelPending();
            if (e.isMidOperation()) {
                tracker.finish(SequenceExecutionState.FAILED,
                        "Stopped while node " + e.getNodeId() + " had a device operation in progress");
            } else {
                tracker.finish(SequenceExecutionState.STOPPED, "Stopped by operator");
            }
        } catch (NodeExecutionException e) {
            tree.cancelPending();
            tracker.finish(SequenceExecutionState.FAILED, "Node " + e.getNodeId() + " failed: " + e.getMessage());
        } catch (SequenceAbortedException e) {
            tree.cancelPending();
            tracker.finish(SequenceExecutionState.FAILED, "Node " + e.getNodeId() + " aborted the run: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run crashed | runId={} | error={}", runId, e.getMessage(), e);
            tree.cancelPending();
            tracker.finish(SequenceExecutionState.FAILED, "Run failed: " + e.getMessage());
        } finally {
            shutdown(branchPool);
            lease.close();
            activeRuns.decrementAndGet();
            run.complete(tracker.snapshot());
        }
    }

    /**
     * Core threads cover the configured parallelism; a nested Parallel may still start more
     * branches than that, so the pool grows on demand instead of queueing.
     */
    private ExecutorService newBranchPool(String runId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "nightshade-branch-" + runId.substring(0, 8) + "-";
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(config.getParallelThreads(), Integer.MAX_VALUE, 30, TimeUnit.SECONDS,
                new SynchronousQueue<>(), factory);
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
