package com.nightshade.engine.handler;

import com.nightshade.config.SequencerConfig;
import com.nightshade.device.DeviceOperations;
import com.nightshade.device.DeviceSnapshot;
import com.nightshade.device.DeviceType;
import com.nightshade.device.OperationProgress;
import com.nightshade.device.Telemetry;
import com.nightshade.engine.NodeExecutionException;
import com.nightshade.engine.SequenceAbortedException;
import com.nightshade.engine.TargetSkippedException;
import com.nightshade.engine.control.CancellationReason;
import com.nightshade.engine.control.CancellationToken;
import com.nightshade.engine.control.ExecutionCancelledException;
import com.nightshade.engine.control.RunControl;
import com.nightshade.engine.device.DeviceLocks;
import com.nightshade.engine.progress.ProgressTracker;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.engine.runtime.RuntimeSequenceTree;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import com.nightshade.sequence.requirements.DeviceRequirements;
import com.nightshade.sequence.tree.StructureAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Everything a handler needs for one branch of a run: the leased sequence, runtime tree, device
 * access, telemetry, control signals and progress, plus branch-local state (cancellation token,
 * current target, active recovery triggers). Branch-local state is replaced through the
 * {@code with*} methods; the shared run state is never copied.
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final Sequence sequence;
    private final RuntimeSequenceTree tree;
    private final NodeHandlerRegistry handlers;
    private final DeviceOperations devices;
    private final Telemetry telemetry;
    private final DeviceSnapshot snapshot;
    private final SequencerConfig config;
    private final Clock clock;
    private final RunControl control;
    private final DeviceLocks locks;
    private final ProgressTracker progress;
    private final ExecutorService branchExecutor;

    private final CancellationToken token;
    private final NodeSpec.TargetHeader target;
    private final List<TriggerMonitor> triggers;

    public ExecutionContext(Sequence sequence, RuntimeSequenceTree tree, NodeHandlerRegistry handlers,
                            DeviceOperations devices, Telemetry telemetry, DeviceSnapshot snapshot,
                            SequencerConfig config, Clock clock, RunControl control, DeviceLocks locks,
                            ProgressTracker progress, ExecutorService branchExecutor) {
        this(sequence, tree, handlers, devices, telemetry, snapshot, config, clock, control, locks, progress,
                branchExecutor, control.rootToken(), null, List.of());
    }

    private ExecutionContext(Sequence sequence, RuntimeSequenceTree tree, NodeHandlerRegistry handlers,
                             DeviceOperations devices, Telemetry telemetry, DeviceSnapshot snapshot,
                             SequencerConfig config, Clock clock, RunControl control, DeviceLocks locks,
                             ProgressTracker progress, ExecutorService branchExecutor,
                             CancellationToken token, NodeSpec.TargetHeader target, List<TriggerMonitor> triggers) {
        this.sequence = sequence;
        this.tree = tree;
        this.handlers = handlers;
        this.devices = devices;
        this.telemetry = telemetry;
        this.snapshot = snapshot;
        this.config = config;
        this.clock = clock;
        this.control = control;
        this.locks = locks;
        this.progress = progress;
        this.branchExecutor = branchExecutor;
        this.token = token;
        this.target = target;
        this.triggers = triggers;
    }

    public ExecutionContext withToken(CancellationToken branchToken) {
        return new ExecutionContext(sequence, tree, handlers, devices, telemetry, snapshot, config, clock, control,
                locks, progress, branchExecutor, branchToken, target, triggers);
    }

    public ExecutionContext withTarget(NodeSpec.TargetHeader currentTarget) {
        return new ExecutionContext(sequence, tree, handlers, devices, telemetry, snapshot, config, clock, control,
                locks, progress, branchExecutor, token, currentTarget, triggers);
    }

    public ExecutionContext withTrigger(TriggerMonitor monitor) {
        List<TriggerMonitor> next = new ArrayList<>(triggers);
        next.add(monitor);
        return new ExecutionContext(sequence, tree, handlers, devices, telemetry, snapshot, config, clock, control,
                locks, progress, branchExecutor, token, target, List.copyOf(next));
    }

    public Sequence sequence() { return sequence; }
    public RuntimeSequenceTree tree() { return tree; }
    public DeviceOperations devices() { return devices; }
    public Telemetry telemetry() { return telemetry; }
    public DeviceSnapshot snapshot() { return snapshot; }
    public SequencerConfig config() { return config; }
    public Clock clock() { return clock; }
    public RunControl control() { return control; }
    public ProgressTracker progress() { return progress; }
    public ExecutorService branchExecutor() { return branchExecutor; }
    public CancellationToken token() { return token; }

    /** Target header enclosing the current branch, or null outside any target. */
    public NodeSpec.TargetHeader currentTarget() {
        return target;
    }

    /** Live altitude of the current target, or null when there is no target or no reading. */
    public Double currentTargetAltitude() {
        return target != null ? telemetry.altitudeOf(target.raHours(), target.decDegrees()) : null;
    }

    // ---- dispatch ----

    /**
     * Runs one node: honours pause and cancellation, acquires its devices, moves it through
     * RUNNING to a terminal status and rethrows failures to the parent.
     */
    public NodeStatus runNode(String nodeId) {
        SequenceNode node = sequence.getNode(nodeId);
        if (node == null) {
            throw new NodeExecutionException(nodeId, "Node '" + nodeId + "' does not exist in the sequence");
        }
        if (!node.isEnabled()) {
            tree.transition(nodeId, NodeStatus.SKIPPED, "disabled");
            return NodeStatus.SKIPPED;
        }
        control.enterNode(nodeId);
        control.checkpoint(token, nodeId);
        NodeHandler handler = handlers.forType(node.getType());
        Set<DeviceType> required = node.getType().isContainer() ? Set.of() : DeviceRequirements.of(node);
        try (DeviceLocks.Lease ignored = locks.acquire(required, token, nodeId, control.pollInterval())) {
            tree.transition(nodeId, NodeStatus.RUNNING);
            NodeStatus result;
            try {
                result = handler.execute(node, this);
            } catch (NodeExecutionException | SequenceAbortedException e) {
                tree.transition(nodeId, NodeStatus.FAILURE, e.getMessage());
                throw e;
            } catch (TargetSkippedException e) {
                tree.transition(nodeId, NodeStatus.SKIPPED, e.getMessage());
                throw e;
            } catch (ExecutionCancelledException e) {
                if (e.getReason() == CancellationReason.SKIP && nodeId.equals(e.getNodeId())) {
                    tree.transition(nodeId, NodeStatus.SKIPPED, "skipped by operator");
                    return NodeStatus.SKIPPED;
                }
                tree.transition(nodeId, NodeStatus.CANCELLED);
                throw e;
            } catch (RuntimeException e) {
                log.error("Handler error | nodeId={} | type={} | error={}", nodeId, node.getType(), e.getMessage(), e);
                tree.transition(nodeId, NodeStatus.FAILURE, e.getMessage());
                throw new NodeExecutionException(nodeId, describe(node) + " failed: " + e.getMessage(), e);
            }
            tree.transition(nodeId, result);
            return result;
        } finally {
            control.clearSkip(nodeId);
        }
    }

    /** Runs the children of {@code parent} one after another; the first failure propagates. */
    public void runChildren(SequenceNode parent) {
        for (SequenceNode child : orderedChildren(parent)) {
            runNode(child.getId());
        }
    }

    /**
     * Children in execution order: authored order, except that sibling target headers are
     * rearranged among their own positions by {@link StructureAnalyzer#TARGET_ORDER}.
     */
    public List<SequenceNode> orderedChildren(SequenceNode parent) {
        List<SequenceNode> children = new ArrayList<>(sequence.getChildren(parent.getId()));
        List<Integer> slots = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getType() == NodeType.TARGET_HEADER) slots.add(i);
        }
        if (slots.size() < 2) return children;
        List<SequenceNode> targets = new ArrayList<>();
        for (int slot : slots) targets.add(children.get(slot));
        targets.sort(StructureAnalyzer.TARGET_ORDER);
        for (int i = 0; i < slots.size(); i++) {
            children.set(slots.get(i), targets.get(i));
        }
        return children;
    }

    // ---- cooperative waiting ----

    /** Node or frame boundary. */
    public void checkpoint(SequenceNode node) {
        control.checkpoint(token, node.getId());
    }

    /**
     * Waits for a device operation, polling cancellation, operator skip, recovery triggers and the
     * timeout every poll interval. Any of these cancels the future. Device errors and timeouts
     * become {@link NodeExecutionException}.
     */
    public <T> T await(SequenceNode node, CompletableFuture<T> future, Duration timeout) {
        String id = node.getId();
        long pollMillis = control.pollInterval().toMillis();
        long started = System.nanoTime();
        while (true) {
            try {
                return future.get(pollMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // still running
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new NodeExecutionException(id, describe(node) + " failed: " + cause.getMessage(), cause);
            } catch (CancellationException e) {
                throw new NodeExecutionException(id, describe(node) + " was cancelled by the device layer", e);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new ExecutionCancelledException(CancellationReason.STOP, id, true);
            }
            if (token.isCancelled()) {
                future.cancel(true);
                throw new ExecutionCancelledException(token.reason(), id, true);
            }
            if (control.isSkipRequested(id)) {
                future.cancel(true);
                throw new ExecutionCancelledException(CancellationReason.SKIP, id, true);
            }
            String fired = firedTrigger(id);
            if (fired != null) {
                future.cancel(true);
                throw new NodeExecutionException(id, "Trigger fired: " + fired);
            }
            if (timeout != null && System.nanoTime() - started > timeout.toNanos()) {
                future.cancel(true);
                throw new NodeExecutionException(id, describe(node) + " timed out after " + timeout.toSeconds() + "s");
            }
            progress.heartbeat();
        }
    }

    /**
     * Polls {@code done} until it holds or {@code timeout} (nullable) expires. Cancellation,
     * operator skip and recovery triggers interrupt the wait. Returns whether the condition was met.
     */
    public boolean waitFor(SequenceNode node, BooleanSupplier done, Duration timeout) {
        String id = node.getId();
        long pollMillis = control.pollInterval().toMillis();
        long started = System.nanoTime();
        while (!done.getAsBoolean()) {
            token.throwIfCancelled(id, false);
            if (control.isSkipRequested(id)) {
                throw new ExecutionCancelledException(CancellationReason.SKIP, id, false);
            }
            String fired = firedTrigger(id);
            if (fired != null) {
                throw new NodeExecutionException(id, "Trigger fired: " + fired);
            }
            if (timeout != null && System.nanoTime() - started > timeout.toNanos()) {
                return false;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionCancelledException(CancellationReason.STOP, id, false);
            }
            progress.heartbeat();
        }
        return true;
    }

    public void sleep(SequenceNode node, Duration duration) {
        long end = System.nanoTime() + duration.toNanos();
        waitFor(node, () -> System.nanoTime() - end >= 0, null);
    }

    public void sleepUntil(SequenceNode node, Instant until) {
        waitFor(node, () -> !clock.instant().isBefore(until), null);
    }

    /** Reason of the first active recovery trigger whose condition holds, else null. */
    private String firedTrigger(String nodeId) {
        for (TriggerMonitor trigger : triggers) {
            String fired = trigger.check(this);
            if (fired != null) {
                log.warn("Trigger fired | nodeId={} | recoveryNodeId={} | reason={}", nodeId, trigger.getRecoveryNodeId(), fired);
                return fired;
            }
        }
        return null;
    }

    // ---- helpers ----

    /** Holds extra devices for work a handler does beyond its own node type (dither inside an exposure). */
    public DeviceLocks.Lease lockDevices(SequenceNode node, Set<DeviceType> extra) {
        return locks.acquire(extra, token, node.getId(), control.pollInterval());
    }

    public OperationProgress progressFor(SequenceNode node) {
        return (fraction, detail) -> progress.reportNodeProgress(node.getId(), fraction, detail);
    }

    static String describe(SequenceNode node) {
        return node.getType().toValue() + " '" + node.getName() + "'";
    }
}
