package com.nightshade.engine.progress;

import com.nightshade.engine.runtime.NodeStatus;
import com.nightshade.sequence.model.SequenceNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;

/**
 * Records run metrics: node transitions by type and status, completed exposures, integration
 * seconds and, once per run, the run duration tagged with the terminal state. One instance per run.
 */
public final class MetricsProgressListener implements ProgressListener {

    public static final String NODE_TRANSITIONS = "nightshade.node.transitions";
    public static final String EXPOSURES_COMPLETED = "nightshade.exposures.completed";
    public static final String INTEGRATION_SECONDS = "nightshade.integration.seconds";
    public static final String RUN_DURATION = "nightshade.run.duration";

    private final MeterRegistry registry;
    private long lastExposures;
    private double lastIntegrationSecs;
    private boolean durationRecorded;

    public MetricsProgressListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onNodeStatusChanged(SequenceNode node, NodeStatus from, NodeStatus to) {
        registry.counter(NODE_TRANSITIONS,
                "nodeType", node.getType().toValue(),
                "status", to.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    @Override
    public void onProgress(SequenceProgress progress) {
        long exposures = progress.getCompletedExposures();
        if (exposures > lastExposures) {
            registry.counter(EXPOSURES_COMPLETED).increment(exposures - lastExposures);
            lastExposures = exposures;
        }
        double secs = progress.getCompletedIntegrationSecs();
        if (secs > lastIntegrationSecs) {
            registry.counter(INTEGRATION_SECONDS).increment(secs - lastIntegrationSecs);
            lastIntegrationSecs = secs;
        }
        if (progress.isTerminal() && !durationRecorded) {
            durationRecorded = true;
            Timer.builder(RUN_DURATION)
                    .tag("state", progress.getState().name().toLowerCase(Locale.ROOT))
                    .register(registry)
                    .record(Duration.ofMillis(Math.round(progress.getElapsedSecs() * 1000)));
        }
    }
}
