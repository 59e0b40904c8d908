package com.nightshade.preflight;

import com.nightshade.config.SequencerConfig;
import com.nightshade.device.DeviceCapabilityRegistry;
import com.nightshade.device.DeviceSnapshot;
import com.nightshade.estimate.IntegrationTimeEstimator;
import com.nightshade.estimate.SequenceEstimate;
import com.nightshade.preflight.check.EquipmentCheck;
import com.nightshade.preflight.check.ExposureCheck;
import com.nightshade.preflight.check.SettingsCheck;
import com.nightshade.preflight.check.StructureCheck;
import com.nightshade.preflight.check.TargetCheck;
import com.nightshade.preflight.check.TimingCheck;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.tree.StructureAnalyzer;
import com.nightshade.sequence.tree.StructureReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the configured checks over a sequence and a device snapshot. Side-effect free apart from the
 * optional registry query, so it can be re-invoked on demand.
 * <p>
 * A check that throws does not abort validation; its failure is reported as a warning in that check's category.
 */
public final class PreflightValidator {

    private static final Logger log = LoggerFactory.getLogger(PreflightValidator.class);

    private final List<ValidationCheck> checks;
    private final SequencerConfig config;
    private final Clock clock;
    private final IntegrationTimeEstimator estimator;

    public PreflightValidator(List<ValidationCheck> checks, SequencerConfig config, Clock clock,
                              IntegrationTimeEstimator estimator) {
        this.checks = List.copyOf(checks);
        this.config = config != null ? config : SequencerConfig.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.estimator = estimator != null ? estimator : new IntegrationTimeEstimator();
    }

    /** Validator with the built-in categories in display order. */
    public static PreflightValidator standard(SequencerConfig config, Clock clock) {
        return new PreflightValidator(defaultChecks(), config, clock, new IntegrationTimeEstimator());
    }

    public static List<ValidationCheck> defaultChecks() {
        return List.of(new StructureCheck(), new TargetCheck(), new ExposureCheck(),
                new EquipmentCheck(), new SettingsCheck(), new TimingCheck());
    }

    /** Returns a validator that also runs {@code extra} after the existing checks. */
    public PreflightValidator withCheck(ValidationCheck extra) {
        List<ValidationCheck> next = new ArrayList<>(checks);
        next.add(extra);
        return new PreflightValidator(next, config, clock, estimator);
    }

    /** Captures a device snapshot from the registry (tolerating failure) and validates against it. */
    public ValidationResult validate(Sequence sequence, DeviceCapabilityRegistry registry) {
        return validate(sequence, DeviceSnapshot.capture(registry));
    }

    public ValidationResult validate(Sequence sequence, DeviceSnapshot devices) {
        Instant now = clock.instant();
        StructureReport structure = StructureAnalyzer.analyze(sequence);
        // the root plus independent targets, as a run would walk them
        SequenceEstimate estimate = estimator.estimateRoots(sequence,
                StructureAnalyzer.executionRoots(sequence, structure), now);
        ValidationContext context = new ValidationContext(sequence, devices, now, structure, estimate, config);

        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationCheck check : checks) {
            try {
                issues.addAll(check.check(context));
            } catch (RuntimeException e) {
                log.error("Preflight check failed | category={} | sequenceId={} | error={}",
                        check.category(), sequence.getId(), e.getMessage(), e);
                issues.add(ValidationIssue.warning(check.category(), "Check Could Not Run",
                        "The " + check.category() + " check failed: " + e.getMessage(), null,
                        "Re-check; report the problem if it persists."));
            }
        }
        ValidationResult result = new ValidationResult(issues, now);
        if (log.isInfoEnabled()) {
            log.info("Preflight validated | sequenceId={} | nodes={} | {}", sequence.getId(),
                    sequence.getNodes().size(), result.summary());
        }
        return result;
    }
}
