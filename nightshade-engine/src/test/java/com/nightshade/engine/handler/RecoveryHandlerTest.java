package com.nightshade.engine.handler;

import com.nightshade.engine.FakeDeviceOperations;
import com.nightshade.engine.FakeTelemetry;
import com.nightshade.engine.SequenceExecutionState;
import com.nightshade.engine.SequenceRun;
import com.nightshade.engine.progress.SequenceProgress;
import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.RecoveryAction;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import com.nightshade.sequence.model.TriggerType;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecoveryHandlerTest {

    private final FakeDeviceOperations devices = new FakeDeviceOperations();
    private final FakeTelemetry telemetry = new FakeTelemetry();

    private SequenceNode recoveryNode;
    private SequenceNode failingNode;
    private SequenceNode followUp;

    /** Root > target > [recovery > center, exposure]; center is the node made to fail. */
    private Sequence planWith(NodeSpec.Recovery recovery) {
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        recoveryNode = node("Guard", recovery);
        failingNode = node("Center", new NodeSpec.Center(null, null, null));
        followUp = exposure("Lights", 2);
        return sequence("Recovery", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), recoveryNode)
                .withChild(recoveryNode.getId(), failingNode)
                .withChild(m31.getId(), followUp);
    }

    private SequenceRun run(Sequence sequence) {
        return engine(devices, telemetry).start(sequence, true);
    }

    @Test
    void retry_failsChildExactlyMaxRetriesPlusOneTimes() throws Exception {
        devices.failing("center");
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.RETRY, 3)));

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(4, run.failureCount(failingNode.getId()));
        assertEquals(4, devices.count("center"));
        assertEquals(SequenceExecutionState.FAILED, done.getState());
        assertEquals(NodeStatus.FAILURE, run.statusOf(recoveryNode.getId()));
        assertEquals(NodeStatus.CANCELLED, run.statusOf(followUp.getId()));
        assertTrue(done.getMessage().contains("exhausted after 4 attempts"), done.getMessage());
    }

    @Test
    void retry_succeedsOnLaterAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        devices.failing("center").onCall("center", () -> {
            if (calls.incrementAndGet() == 2) devices.succeeding("center");
        });
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.RETRY, 3)));

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(1, run.failureCount(failingNode.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(failingNode.getId()));
        assertEquals(2, done.getCompletedExposures());
    }

    @Test
    void continue_absorbsExhaustedFailure() throws Exception {
        devices.failing("center");
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.CONTINUE, 1)));

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(2, run.failureCount(failingNode.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(recoveryNode.getId()));
        assertEquals(2, done.getCompletedExposures());
    }

    @Test
    void nextTarget_skipsRestOfTargetAndMovesOn() throws Exception {
        devices.failing("center");
        SequenceNode root = root();
        SequenceNode first = target("First", 1.0);
        SequenceNode second = target("Second", 2.0);
        SequenceNode guard = node("Guard", NodeSpec.Recovery.of(RecoveryAction.NEXT_TARGET, 0));
        SequenceNode skipped = exposure("First lights", 3);
        SequenceNode secondLights = exposure("Second lights", 2);
        Sequence seq = sequence("Two targets", root)
                .withChild(root.getId(), first).withChild(root.getId(), second)
                .withChild(first.getId(), guard)
                .withChild(guard.getId(), node("Center", new NodeSpec.Center(null, null, null)))
                .withChild(first.getId(), skipped)
                .withChild(second.getId(), secondLights);

        SequenceRun run = run(seq);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.SKIPPED, run.statusOf(first.getId()));
        assertEquals(NodeStatus.SKIPPED, run.statusOf(skipped.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(secondLights.getId()));
        assertEquals(2, done.getCompletedExposures());
    }

    @Test
    void parkAndAbort_parksThenFailsRun() throws Exception {
        devices.failing("center");
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.PARK_AND_ABORT, 1)));

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.FAILED, done.getState());
        assertEquals(1, devices.count("park"));
        assertEquals(2, run.failureCount(failingNode.getId()));
        assertTrue(done.getMessage().contains("aborted"), done.getMessage());
        assertEquals(0, done.getCompletedExposures());
    }

    @Test
    void customBranch_runsBranchOnlyAfterExhaustion() throws Exception {
        devices.failing("center");
        SequenceNode branch = node("Alert", new NodeSpec.Notification("Centering failed", "Check the mount", null));
        Sequence seq = planWith(new NodeSpec.Recovery(RecoveryAction.CUSTOM_BRANCH, 1, null, null,
                branch.getId(), null));
        seq = seq.withChild(recoveryNode.getId(), branch);

        SequenceRun run = run(seq);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(1, devices.count("notify"));
        assertEquals(2, devices.count("center"));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(branch.getId()));
    }

    @Test
    void customBranch_notNeededIsSkipped() throws Exception {
        SequenceNode branch = node("Alert", new NodeSpec.Notification("Centering failed", "", null));
        Sequence seq = planWith(new NodeSpec.Recovery(RecoveryAction.CUSTOM_BRANCH, 1, null, null,
                branch.getId(), null)).withChild(recoveryNode.getId(), branch);

        SequenceRun run = run(seq);
        run.awaitCompletion(TIMEOUT);

        assertEquals(0, devices.count("notify"));
        assertEquals(NodeStatus.SKIPPED, run.statusOf(branch.getId()));
    }

    @Test
    void autofocusAction_refocusesBeforeRetry() throws Exception {
        devices.failing("center").onCall("autofocus", () -> devices.succeeding("center"));
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.AUTOFOCUS, 2)));

        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(1, devices.count("autofocus"));
        assertEquals(1, run.failureCount(failingNode.getId()));
    }

    @Test
    void pauseAction_waitsForOperatorResume() throws Exception {
        devices.failing("center");
        SequenceRun run = run(planWith(NodeSpec.Recovery.of(RecoveryAction.PAUSE, 1)));

        awaitCondition("recovery pause", () -> run.getState() == SequenceExecutionState.PAUSED);
        assertEquals(1, devices.count("center"));
        devices.succeeding("center");
        run.resume();

        SequenceProgress done = run.awaitCompletion(TIMEOUT);
        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(2, devices.count("center"));
    }

    @Test
    void hfrTrigger_abortsInFlightExposureAndRetriesAfterFocus() throws Exception {
        telemetry.hfr = 5.0;
        devices.delayed("expose", 300).onCall("autofocus", () -> telemetry.hfr = 2.0);
        SequenceNode root = root();
        SequenceNode m31 = target("M31", 0.71);
        SequenceNode guard = node("Refocus on bad stars",
                new NodeSpec.Recovery(RecoveryAction.AUTOFOCUS, 1, TriggerType.HFR_DEGRADED, 3.0, null, null));
        SequenceNode lights = exposure("Lights", 1);
        Sequence seq = sequence("Triggered", root).withChild(root.getId(), m31)
                .withChild(m31.getId(), guard).withChild(guard.getId(), lights);

        SequenceRun run = run(seq);
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(1, run.failureCount(lights.getId()));
        assertEquals(1, devices.count("autofocus"));
        assertEquals(2, devices.count("expose"));
        assertEquals(1, done.getCompletedExposures());
    }

    @Test
    void weatherTrigger_interruptsTimedWait() throws Exception {
        SequenceNode root = root();
        SequenceNode guard = node("Weather guard",
                new NodeSpec.Recovery(RecoveryAction.CONTINUE, 0, TriggerType.WEATHER_UNSAFE, null, null, null));
        SequenceNode wait = node("Long wait", new NodeSpec.Delay(600.0));
        SequenceNode after = exposure("After", 1);
        Sequence seq = sequence("Guarded wait", root).withChild(root.getId(), guard)
                .withChild(guard.getId(), wait).withChild(root.getId(), after);

        SequenceRun run = run(seq);
        awaitStatus(run, wait.getId(), NodeStatus.RUNNING);
        telemetry.weatherSafe = false;
        SequenceProgress done = run.awaitCompletion(TIMEOUT);

        assertEquals(SequenceExecutionState.COMPLETED, done.getState());
        assertEquals(NodeStatus.FAILURE, run.statusOf(wait.getId()));
        assertEquals(1, run.failureCount(wait.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(guard.getId()));
        assertEquals(NodeStatus.SUCCESS, run.statusOf(after.getId()));
    }
}
