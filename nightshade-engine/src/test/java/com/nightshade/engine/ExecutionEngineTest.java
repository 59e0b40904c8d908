package com.nightshade.engine;

import com.nightshade.engine.progress.MetricsProgressListener;
import com.nightshade.engine.progress.ProgressListener;
import com.nightshade.engine.progress.SequenceProgress;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.preflight.SequenceValidationException;
import com.nightshade.preflight.ValidationCategory;
import com.nightshade.sequence.edit.SequenceLockedException;
import com.nightshade.sequence.edit.SequenceWorkspace;
import com.nightshade.sequence.model.ConditionalType;
import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.nightshade.engine.EngineTestSupport.NOW;
import static com.nightshade.engine.EngineTestSupport.TIMEOUT;
import static com.nightshade.engine.EngineTestSupport.awaitCondition;
import static com.nightshade.engine.EngineTestSupport.awaitStatus;
import static com.nightshade.engine.EngineTestSupport.engine;
import static com.nightshade.engine.EngineTestSupport.exposure;
import static com.nightshade.engine.EngineTestSupport.node;
import static com.nightshade.engine.EngineTestSupport.root;
import static com.nightshade.engine.EngineTestSupport.sequence;
import static com.nightshade.engine.EngineTestSupport.target;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionEngineTest {

    private final FakeDeviceOperations devices = new FakeDeviceOperations();
    private final FakeTelemetry telemetry = new FakeTelemetry();

    /** Root > target > [slew, exposure x3, loop(2) > exposure x2]. */
    private static Sequence imagingPlan() {
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode loop = node("Twice", NodeSpec.Loop.count(2));
        Sequence seq = sequence("M31 LRGB", root)
                .withChild(root.getId(), m31)
                .withChild(m31.getId(), node("Slew", new NodeSpec.Slew(null, null, null)))
                .withChild(m31.getId(), exposure("Luminance", 3))
                .withChild(m31.getId(), loop);
        return seq.withChild(loop.getId(), exposure("Red", 2));
    }

    @Test
    void start_fullRunCompletesWithMonotonicCounters() throws Exception {
        List<SequenceProgress> seen = new CopyOnWriteArrayList<>();
        SequenceRun run = engine(devices, telemetry).start(imagingPlan(), true, seen::add);

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(7, done.getCompletedExposures());
        assertEquals(7, done.getTotalExposures());
        assertEquals(7.0, done.getCompletedIntegrationSecs(), 1e-9);
        assertEquals("M31", done.getCurrentTarget());
        assertEquals("L", done.getCurrentFilter());
        assertEquals(7, devices.count("expose"));
        assertEquals(1, devices.count("slew"));

        long previous = 0;
        for (SequenceProgress p : seen) {
            assertTrue(p.getCompletedExposures() >= previous, "completed exposures went backwards");
            assertTrue(p.getCompletedExposures() <= p.getTotalExposures(), "completed exceeds total");
            previous = p.getCompletedExposures();
        }
        for (NodeStatus status : run.statuses().values()) {
            assertEquals(NodeStatus.SUCCESS, status);
        }
    }

    @Test
    void start_emptySequenceIsBlockedAndLeaseReleased() {
        SequenceWorkspace workspace = new SequenceWorkspace(Sequence.empty("Nothing", NOW));
        ExecutionEngine engine = engine(devices, telemetry);

        SequenceValidationException e = assertThrows(SequenceValidationException.class,
                () -> engine.start(workspace, true));

        assertTrue(e.getResult().hasErrors());
        assertFalse(workspace.isLeased());
        assertEquals(0, engine.getActiveRunCount());
    }

    @Test
    void start_warningsBlockUnlessOverridden() throws Exception {
        // exposures without any target header warn
        SequenceNode root = root();
        Sequence seq = sequence("Darks", root).withChild(root.getId(), exposure("Dark", 1));
        ExecutionEngine engine = engine(devices, telemetry);

        SequenceValidationException e = assertThrows(SequenceValidationException.class, () -> engine.start(seq, false));
        assertTrue(e.getResult().hasWarnings());

        SequenceRun run = engine.start(seq, true);
        assertEquals(SequenceExecutionState.COMPLETED, run.awaitCompletion(TIMEOUT).getState());
        assertTrue(run.getValidation().hasWarnings());
    }

    @Test
    void workspace_rejectsEditsWhileRunning() throws Exception {
        devices.hanging("expose");
        SequenceNode root = root();
        SequenceNode m42 = target("M42", 5.58);
        SequenceNode lights = exposure("Lights", 1);
        SequenceWorkspace workspace = new SequenceWorkspace(
                sequence("M42", root).withChild(root.getId(), m42).withChild(m42.getId(), lights));

        SequenceRun run = engine(devices, telemetry).start(workspace, true);
        awaitStatus(run, lights.getId(), NodeStatus.RUNNING);

        assertThrows(SequenceLockedException.class, () -> workspace.update(s -> s.withName("Renamed")));

        run.stop();
        run.awaitCompletion(TIMEOUT);
        assertFalse(workspace.isLeased());
        assertEquals("Renamed", workspace.update(s -> s.withName("Renamed")).getName());
    }

    @Test
    void stop_midExposureFailsRun() throws Exception {
        devices.hanging("expose");
        SequenceNode root = root();
        SequenceNode m42 = target("M42", 5.58);
        SequenceNode lights = exposure("Lights", 5);
        SequenceNode later = exposure("Later", 5);
        Sequence seq = sequence("M42", root).withChild(root.getId(), m42)
                .withChild(m42.getId(), lights).withChild(m42.getId(), later);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        awaitStatus(run, lights.getId(), NodeStatus.RUNNING);
        run.stop();
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.FAILED, done.getState());
        assertTrue(done.getMessage().contains(lights.getId()), done.getMessage());
        assertEquals(NodeStatus.CANCELLED, run.statusOf(lights.getId()));
        assertEquals(NodeStatus.CANCELLED, run.statusOf(later.getId()));
        assertTrue(devices.hungFutures().get(0).isCancelled());
        assertEquals(0, done.getCompletedExposures());
    }

    @Test
    void stop_betweenOperationsIsCleanStop() throws Exception {
        SequenceNode root = root();
        SequenceNode wait = node("Wait", new NodeSpec.Delay(30.0));
        SequenceNode lights = exposure("Lights", 1);
        Sequence seq = sequence("Delayed", root).withChild(root.getId(), wait).withChild(root.getId(), lights);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        awaitStatus(run, wait.getId(), NodeStatus.RUNNING);
        run.stop();
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.STOPPED, done.getState());
        assertEquals(NodeStatus.CANCELLED, run.statusOf(wait.getId()));
        assertEquals(NodeStatus.CANCELLED, run.statusOf(lights.getId()));
        assertEquals(0, devices.count("expose"));
        assertThrows(IllegalStateException.class, run::stop);
    }

    @Test
    void pauseAndResume_holdAtFrameBoundary() throws Exception {
        devices.delayed("expose", 20);
        SequenceNode root = root();
        SequenceNode lights = exposure("Lights", 5);
        Sequence seq = sequence("Pausable", root).withChild(root.getId(), lights);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        awaitCondition("first frame", () -> run.progress().getCompletedExposures() >= 1);
        run.pause();
        assertEquals(SequenceExecutionState.PAUSED, run.getState());
        assertThrows(IllegalStateException.class, run::pause);

        Thread.sleep(100);
        long heldAt = run.progress().getCompletedExposures();
        Thread.sleep(100);
        assertEquals(heldAt, run.progress().getCompletedExposures());
        assertTrue(heldAt < 5);

        run.resume();
        SequenceProgress done = run.awaitCompletion(TIMEOUT);
        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(5, done.getCompletedExposures());
    }

    @Test
    void skipCurrent_skipsRunningInstructionAndContinues() throws Exception {
        SequenceNode root = root();
        SequenceNode wait = node("Long wait", new NodeSpec.Delay(600.0));
        SequenceNode lights = exposure("Lights", 2);
        Sequence seq = sequence("Skippable", root).withChild(root.getId(), wait).withChild(root.getId(), lights);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        awaitStatus(run, wait.getId(), NodeStatus.RUNNING);
        assertEquals(List.of(wait.getId()), run.skipCurrent());
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.SKIPPED, run.statusOf(wait.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(lights.getId()));
        assertEquals(2, done.getCompletedExposures());
    }

    @Test
    void conditional_unmetSkipsSubtreeWithoutFailing() throws Exception {
        telemetry.hfr = 3.5;
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode sharp = node("If sharp", new NodeSpec.Conditional(ConditionalType.HFR_BELOW, 3.0, null));
        SequenceNode gated = exposure("Gated", 4);
        SequenceNode always = exposure("Always", 1);
        Sequence seq = sequence("Gated", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), sharp).withChild(sharp.getId(), gated)
                .withChild(m31.getId(), always);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.SKIPPED, run.statusOf(sharp.getId()));
        assertEquals(NodeStatus.SKIPPED, run.statusOf(gated.getId()));
        assertEquals(1, done.getCompletedExposures());
    }

    @Test
    void whileDarkLoop_reevaluatesDarknessEachIteration() throws Exception {
        AtomicInteger frames = new AtomicInteger();
        devices.onCall("expose", () -> {
            if (frames.incrementAndGet() == 3) telemetry.dark = false;
        });
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode loop = node("While dark", NodeSpec.Loop.of(LoopConditionType.WHILE_DARK));
        Sequence seq = sequence("All night", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), loop).withChild(loop.getId(), exposure("Frame", 1));

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(3, done.getCompletedExposures());
        assertTrue(run.getEstimate().isUnbounded());
    }

    @Test
    void untilTimeLoop_stopsOnceRunClockPassesEnd() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        devices.onCall("expose", () -> clock.advance(Duration.ofMinutes(20)));
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode loop = node("For an hour", NodeSpec.Loop.until(NOW.plus(Duration.ofHours(1))));
        SequenceNode frame = exposure("Frame", 1);
        Sequence seq = sequence("Timed", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), loop).withChild(loop.getId(), frame);

        SequenceRun run = engine(devices, telemetry, clock, null).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        // frames end at +20, +40 and +60 min; the fourth iteration would start at the end time
        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(3, devices.count("expose"));
        assertEquals(3, done.getCompletedExposures());
        assertEquals(NodeStatus.SUCCESS, run.statusOf(loop.getId()));
    }

    @Test
    void untilAltitudeLoop_stopsWhenTargetSinksBelowLimit() throws Exception {
        AtomicInteger frames = new AtomicInteger();
        devices.onCall("expose", () -> {
            if (frames.incrementAndGet() == 4) telemetry.altitude = 28.0;
        });
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode loop = node("Until 30 deg",
                new NodeSpec.Loop(LoopConditionType.UNTIL_ALTITUDE, null, null, 30.0));
        Sequence seq = sequence("Altitude bound", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), loop).withChild(loop.getId(), exposure("Frame", 1));

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(4, devices.count("expose"));
        assertEquals(4, done.getCompletedExposures());
    }

    @Test
    void untilAltitudeLoop_withoutLimitNeverIterates() throws Exception {
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode loop = node("Unbounded",
                new NodeSpec.Loop(LoopConditionType.UNTIL_ALTITUDE, null, null, null));
        SequenceNode frame = exposure("Frame", 1);
        SequenceNode after = exposure("After", 1);
        Sequence seq = sequence("No limit", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), loop).withChild(loop.getId(), frame)
                .withChild(m31.getId(), after);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertTrue(run.getValidation().issuesIn(ValidationCategory.TIMING).stream()
                .anyMatch(i -> i.title().equals("Loop Altitude Not Set")), run.getValidation().getIssues().toString());
        assertEquals(NodeStatus.SUCCESS, run.statusOf(loop.getId()));
        assertEquals(NodeStatus.SKIPPED, run.statusOf(frame.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(after.getId()));
        assertEquals(1, devices.count("expose"));
    }

    @Test
    void untilAltitudeLoop_withoutTargetNeverIterates() throws Exception {
        SequenceNode root = root();
        SequenceNode loop = node("No target", new NodeSpec.Loop(LoopConditionType.UNTIL_ALTITUDE, null, null, 30.0));
        Sequence seq = sequence("Targetless", root).withChild(root.getId(), loop)
                .withChild(loop.getId(), exposure("Frame", 1));

        SequenceRun run = engine(devices, telemetry).start(seq, true);

        assertEquals(SequenceExecutionState.COMPLETED, run.awaitCompletion(TIMEOUT).getState());
        assertEquals(0, devices.count("expose"));
    }

    @Test
    void skipCurrent_requestAsFrameFinishesDoesNotSkipNextIteration() throws Exception {
        AtomicReference<SequenceRun> handle = new AtomicReference<>();
        List<String> skipped = new CopyOnWriteArrayList<>();
        AtomicInteger frames = new AtomicInteger();
        // the first frame's future is already complete when the skip lands
        devices.onCall("expose", () -> {
            if (frames.incrementAndGet() == 1) {
                awaitCondition("run handle", () -> handle.get() != null);
                skipped.addAll(handle.get().skipCurrent());
            }
        });
        SequenceNode root = root();
        SequenceNode loop = node("Twice", NodeSpec.Loop.count(2));
        SequenceNode frame = exposure("Frame", 1);
        Sequence seq = sequence("Racy skip", root).withChild(root.getId(), loop).withChild(loop.getId(), frame);

        handle.set(engine(devices, telemetry).start(seq, true));
        SequenceRun run = handle.get();
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(List.of(frame.getId()), skipped);
        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(2, devices.count("expose"));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(frame.getId()));
    }

    @Test
    void targets_runByPriorityThenOrder() throws Exception {
        SequenceNode root = root();
        SequenceNode low = target("Low", 1.0, 0);
        SequenceNode high = target("High", 2.0, 5);
        SequenceNode tie = target("Tie", 3.0, 0);
        Sequence seq = sequence("Three targets", root)
                .withChild(root.getId(), low).withChild(root.getId(), high).withChild(root.getId(), tie);
        for (SequenceNode t : List.of(low, high, tie)) {
            seq = seq.withChild(t.getId(), node("Slew", new NodeSpec.Slew(null, null, null)))
                    .withChild(t.getId(), exposure("Frames", 1));
        }

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        run.awaitCompletion(TIMEOUT);

        assertEquals(List.of(2.0, 1.0, 3.0), devices.slewTargets());
    }

    @Test
    void targetHeader_belowMinimumAltitudeIsSkipped() throws Exception {
        telemetry.altitude = 12.0;
        SequenceNode root = root();
        SequenceNode low = node("Low", new NodeSpec.TargetHeader("Low", 1.0, -20.0, null, null, 25.0,
                null, null, null, null));
        SequenceNode frames = exposure("Frames", 3);
        Sequence seq = sequence("Low target", root).withChild(root.getId(), low).withChild(low.getId(), frames);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.SKIPPED, run.statusOf(low.getId()));
        assertEquals(NodeStatus.SKIPPED, run.statusOf(frames.getId()));
        assertEquals(0, devices.count("expose"));
    }

    @Test
    void waitTime_followsRunClock() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        SequenceNode root = root();
        SequenceNode wait = node("Until midnight", new NodeSpec.WaitTime(NOW.plus(Duration.ofHours(2)), null));
        Sequence seq = sequence("Wait", root).withChild(root.getId(), wait).withChild(root.getId(), exposure("F", 1));

        SequenceRun run = engine(devices, telemetry, clock, null).start(seq, true);
        awaitStatus(run, wait.getId(), NodeStatus.RUNNING);
        assertEquals(0, devices.count("expose"));

        clock.advance(Duration.ofHours(3));
        SequenceProgress done = run.awaitCompletion(TIMEOUT);
        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(1, done.getCompletedExposures());
    }

    @Test
    void script_nonZeroExitFailsRun() throws Exception {
        devices.scriptExitCode(3);
        SequenceNode root = root();
        SequenceNode script = node("Flats", new NodeSpec.Script("/opt/obs/flats.sh", List.of("--fast"), null));
        Sequence seq = sequence("Scripted", root).withChild(root.getId(), script);

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.FAILED, done.getState());
        assertTrue(done.getMessage().contains("exited with code 3"), done.getMessage());
        assertEquals(NodeStatus.FAILURE, run.statusOf(script.getId()));
    }

    @Test
    void unknownNode_isSkipped() throws Exception {
        SequenceNode root = root();
        SequenceNode future = node("From a newer release", new NodeSpec.Unknown());
        Sequence seq = sequence("Mixed", root).withChild(root.getId(), future)
                .withChild(root.getId(), exposure("Frames", 1));

        SequenceRun run = engine(devices, telemetry).start(seq, true);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.SKIPPED, run.statusOf(future.getId()));
    }

    @Test
    void metrics_recordedWhenRegistryPresent() throws Exception {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ExecutionEngine engine = engine(devices, telemetry, new MutableClock(NOW), meters);

        SequenceRun run = engine.start(imagingPlan(), true);
        run.awaitCompletion(TIMEOUT);

        assertEquals(7.0, meters.get(MetricsProgressListener.EXPOSURES_COMPLETED).counter().count(), 1e-9);
        assertEquals(7.0, meters.get(MetricsProgressListener.INTEGRATION_SECONDS).counter().count(), 1e-9);
        assertEquals(1, meters.get(MetricsProgressListener.RUN_DURATION).tag("state", "completed").timer().count());
        assertEquals(3.0, meters.get(MetricsProgressListener.NODE_TRANSITIONS)
                .tags("nodeType", "Exposure", "status", "success").counter().count(), 1e-9);
        assertNotNull(meters.find(ExecutionEngine.ACTIVE_RUNS).gauge());
    }

    @Test
    void listener_failureDoesNotBreakRun() throws Exception {
        ProgressListener broken = p -> {
            throw new IllegalStateException("listener bug");
        };
        SequenceRun run = engine(devices, telemetry).start(imagingPlan(), true, broken);

        assertEquals(SequenceExecutionState.COMPLETED, run.awaitCompletion(TIMEOUT).getState());
    }
}
