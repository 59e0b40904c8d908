package com.nightshade.preflight;

import com.nightshade.config.SequencerConfig;
import com.nightshade.device.DeviceCapabilityRegistry;
import com.nightshade.device.DeviceSnapshot;
import com.nightshade.device.DeviceType;
import com.nightshade.sequence.model.Binning;
import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreflightValidatorTest {

    private static final Instant NOW = Instant.parse("2026-10-17T20:00:00Z");

    private final PreflightValidator validator =
            PreflightValidator.standard(SequencerConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    /** Root set containing one target with one exposure node. */
    private static Sequence singleTarget(NodeSpec.TargetHeader target, NodeSpec.Exposure exposure) {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode header = SequenceNode.create(target.targetName(), target);
        return Sequence.empty("M31 LRGB", NOW).withRoot(root)
                .withChild(root.getId(), header)
                .withChild(header.getId(), SequenceNode.create("Lights", exposure));
    }

    private static Sequence exposureOnly(NodeSpec.Exposure exposure) {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        return Sequence.empty("Darks", NOW).withRoot(root)
                .withChild(root.getId(), SequenceNode.create("Frames", exposure));
    }

    @Test
    void validate_wellFormedPlanIsClean() {
        ValidationResult result = validator.validate(
                singleTarget(NodeSpec.TargetHeader.at("M31", 0.71, 41.27), NodeSpec.Exposure.of(60, 10)),
                DeviceSnapshot.allConnected());

        assertTrue(result.isClean(), result.getIssues().toString());
        assertTrue(result.isValid());
        assertEquals(NOW, result.getValidatedAt());
    }

    @Test
    void validate_emptySequenceBlocks() {
        ValidationResult result = validator.validate(Sequence.empty("Nothing", NOW), DeviceSnapshot.allConnected());

        assertTrue(result.hasErrors());
        assertFalse(result.isValid());
        assertEquals("Empty Sequence", result.issuesIn(ValidationCategory.STRUCTURE).get(0).title());
    }

    @Test
    void validate_raOutOfRangeYieldsExactlyOneTargetsError() {
        ValidationResult bad = validator.validate(
                singleTarget(NodeSpec.TargetHeader.at("Bad", 25, 10), NodeSpec.Exposure.of(60, 1)),
                DeviceSnapshot.allConnected());
        ValidationResult good = validator.validate(
                singleTarget(NodeSpec.TargetHeader.at("Good", 12, 10), NodeSpec.Exposure.of(60, 1)),
                DeviceSnapshot.allConnected());

        List<ValidationIssue> targetErrors = bad.issuesIn(ValidationCategory.TARGETS).stream()
                .filter(i -> i.severity() == ValidationSeverity.ERROR).toList();
        assertEquals(1, targetErrors.size());
        assertEquals("Invalid RA", targetErrors.get(0).title());
        assertTrue(good.issuesIn(ValidationCategory.TARGETS).isEmpty());
    }

    @Test
    void validate_declinationBoundsAreInclusive() {
        ValidationResult pole = validator.validate(
                singleTarget(NodeSpec.TargetHeader.at("Polaris", 2.5, 90), NodeSpec.Exposure.of(60, 1)),
                DeviceSnapshot.allConnected());
        ValidationResult beyond = validator.validate(
                singleTarget(NodeSpec.TargetHeader.at("Nowhere", 2.5, -90.5), NodeSpec.Exposure.of(60, 1)),
                DeviceSnapshot.allConnected());

        assertTrue(pole.isValid());
        assertEquals("Invalid Dec", beyond.withSeverity(ValidationSeverity.ERROR).get(0).title());
    }

    @Test
    void validate_exposureOnlyPlanWithNoDevicesFlagsCameraOnly() {
        ValidationResult result = validator.validate(exposureOnly(NodeSpec.Exposure.of(30, 5)),
                DeviceSnapshot.of(Set.of(), false));

        List<ValidationIssue> equipment = result.issuesIn(ValidationCategory.EQUIPMENT);
        assertEquals(1, equipment.size());
        assertEquals(ValidationSeverity.ERROR, equipment.get(0).severity());
        assertEquals("No Camera Connected", equipment.get(0).title());
    }

    @Test
    void validate_missingDevicesFollowSeverityLadder() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        Sequence sequence = Sequence.empty("Gear", NOW).withRoot(root)
                .withChild(root.getId(), SequenceNode.create("Slew", new NodeSpec.Slew(null, 1.0, 2.0)))
                .withChild(root.getId(), SequenceNode.create("Dither", new NodeSpec.Dither(null, null, null)))
                .withChild(root.getId(), SequenceNode.create("Rotate", new NodeSpec.Rotator(45.0, null)))
                .withChild(root.getId(), SequenceNode.create("Lights", NodeSpec.Exposure.of(60, 1)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.of(EnumSet.of(DeviceType.CAMERA), false));

        List<ValidationIssue> equipment = result.issuesIn(ValidationCategory.EQUIPMENT);
        assertEquals(List.of("No Mount Connected", "No Guider Connected", "No Rotator Connected"),
                equipment.stream().map(ValidationIssue::title).toList());
        assertEquals(List.of(ValidationSeverity.WARNING, ValidationSeverity.WARNING, ValidationSeverity.INFO),
                equipment.stream().map(ValidationIssue::severity).toList());
    }

    @Test
    void validate_unreachableRegistryDegradesToSingleWarning() {
        DeviceCapabilityRegistry unreachable = new DeviceCapabilityRegistry() {
            @Override
            public Set<DeviceType> getConnectedDevices() {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public boolean isGuiderConnected() {
                return false;
            }
        };

        ValidationResult result = validator.validate(exposureOnly(NodeSpec.Exposure.of(30, 5)), unreachable);

        List<ValidationIssue> equipment = result.issuesIn(ValidationCategory.EQUIPMENT);
        assertEquals(1, equipment.size());
        assertEquals("Equipment Status Unknown", equipment.get(0).title());
        assertEquals(ValidationSeverity.WARNING, equipment.get(0).severity());
        assertTrue(result.isValid());
    }

    @Test
    void validate_structuralDefectsAreReported() {
        SequenceNode root = new SequenceNode("root", "Root", true, List.of("loop", "ghost"), null, 0,
                new NodeSpec.InstructionSet());
        SequenceNode loop = new SequenceNode("loop", "Loop", true, List.of("body"), "root", 0, NodeSpec.Loop.count(2));
        SequenceNode body = new SequenceNode("body", "Body", true, List.of("loop"), "loop", 0, new NodeSpec.InstructionSet());
        SequenceNode stray = new SequenceNode("stray", "Stray", true, null, null, 0, NodeSpec.Exposure.of(60, 1));
        Sequence sequence = Sequence.empty("Broken", NOW)
                .withNode(root).withNode(loop).withNode(body).withNode(stray).withRootNodeId("root");

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        List<String> titles = result.issuesIn(ValidationCategory.STRUCTURE).stream().map(ValidationIssue::title).toList();
        assertEquals(List.of("Missing Child Node", "Cycle Detected", "Orphaned Nodes", "Shared Node"), titles);
        assertFalse(result.isValid());
    }

    @Test
    void validate_noRootBlocks() {
        Sequence sequence = Sequence.empty("Loose", NOW).withNode(SequenceNode.create("Lights", NodeSpec.Exposure.of(60, 1)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        assertEquals("No Root Node", result.withSeverity(ValidationSeverity.ERROR).get(0).title());
    }

    @Test
    void validate_exposureParameterChecks() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        Sequence sequence = Sequence.empty("Params", NOW).withRoot(root)
                .withChild(root.getId(), SequenceNode.create("Zero", NodeSpec.Exposure.of(0, 1)))
                .withChild(root.getId(), SequenceNode.create("None", NodeSpec.Exposure.of(60, 0)))
                .withChild(root.getId(), SequenceNode.create("Long", NodeSpec.Exposure.of(2400, 1)))
                .withChild(root.getId(), SequenceNode.create("Binned",
                        new NodeSpec.Exposure(60.0, 1, null, null, null, null, Binning.FOUR, null)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        List<String> titles = result.issuesIn(ValidationCategory.EXPOSURES).stream().map(ValidationIssue::title).toList();
        assertTrue(titles.contains("Invalid Exposure Time"));
        assertTrue(titles.contains("Invalid Frame Count"));
        assertTrue(titles.contains("Very Long Exposure"));
        assertTrue(titles.contains("High Binning"));
        assertEquals(2, result.getErrorCount());
    }

    @Test
    void validate_veryLongSequenceWarns() {
        ValidationResult result = validator.validate(exposureOnly(NodeSpec.Exposure.of(600, 60)),
                DeviceSnapshot.allConnected());

        assertTrue(result.issuesIn(ValidationCategory.EXPOSURES).stream()
                .anyMatch(i -> i.title().equals("Very Long Sequence") && i.severity() == ValidationSeverity.WARNING));
    }

    @Test
    void validate_veryLongSequenceCountsIndependentTargets() {
        SequenceNode m42 = SequenceNode.create("M42", NodeSpec.TargetHeader.at("M42", 5.59, -5.39));
        Sequence sequence = singleTarget(NodeSpec.TargetHeader.at("M31", 0.71, 41.27), NodeSpec.Exposure.of(60, 10))
                .withNode(m42)
                .withChild(m42.getId(), SequenceNode.create("Orion lights", NodeSpec.Exposure.of(300, 120)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        assertTrue(result.issuesIn(ValidationCategory.EXPOSURES).stream()
                .anyMatch(i -> i.title().equals("Very Long Sequence")), result.getIssues().toString());
    }

    @Test
    void validate_altitudeLoopWithoutLimitWarns() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode loop = SequenceNode.create("Until low",
                new NodeSpec.Loop(LoopConditionType.UNTIL_ALTITUDE, null, null, null));
        SequenceNode bounded = SequenceNode.create("Until 25",
                new NodeSpec.Loop(LoopConditionType.UNTIL_ALTITUDE, null, null, 25.0));
        Sequence sequence = Sequence.empty("Altitude", NOW).withRoot(root)
                .withChild(root.getId(), loop)
                .withChild(loop.getId(), SequenceNode.create("Lights", NodeSpec.Exposure.of(60, 1)))
                .withChild(root.getId(), bounded)
                .withChild(bounded.getId(), SequenceNode.create("More lights", NodeSpec.Exposure.of(60, 1)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        List<ValidationIssue> timing = result.issuesIn(ValidationCategory.TIMING);
        assertEquals(1, timing.size(), timing.toString());
        assertEquals("Loop Altitude Not Set", timing.get(0).title());
        assertEquals(loop.getId(), timing.get(0).nodeId());
        assertEquals(ValidationSeverity.WARNING, timing.get(0).severity());
    }

    @Test
    void validate_staleTimestampsWarn() {
        SequenceNode root = SequenceNode.create("Root", new NodeSpec.InstructionSet());
        SequenceNode loop = SequenceNode.create("Until dawn", NodeSpec.Loop.until(NOW.minusSeconds(3600)));
        Sequence sequence = Sequence.empty("Stale", NOW).withRoot(root)
                .withChild(root.getId(), SequenceNode.create("Wait", new NodeSpec.WaitTime(NOW.minusSeconds(60), null)))
                .withChild(root.getId(), SequenceNode.create("Future", new NodeSpec.WaitTime(NOW.plusSeconds(60), null)))
                .withChild(root.getId(), loop)
                .withChild(loop.getId(), SequenceNode.create("Lights", NodeSpec.Exposure.of(60, 1)));

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        List<String> titles = result.issuesIn(ValidationCategory.TIMING).stream().map(ValidationIssue::title).toList();
        assertEquals(List.of("Wait Time Passed", "Loop End Time Passed"), titles);
        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
    }

    @Test
    void validate_defaultNameIsInfoOnly() {
        Sequence sequence = exposureOnly(NodeSpec.Exposure.of(60, 1)).withName(Sequence.DEFAULT_NAME);

        ValidationResult result = validator.validate(sequence, DeviceSnapshot.allConnected());

        assertEquals(1, result.issuesIn(ValidationCategory.SETTINGS).size());
        assertEquals(ValidationSeverity.INFO, result.issuesIn(ValidationCategory.SETTINGS).get(0).severity());
    }

    @Test
    void validate_isRepeatable() {
        Sequence sequence = singleTarget(NodeSpec.TargetHeader.at("Bad", 30, 95), NodeSpec.Exposure.of(-1, 0));

        ValidationResult first = validator.validate(sequence, DeviceSnapshot.of(Set.of(), false));
        ValidationResult second = validator.validate(sequence, DeviceSnapshot.of(Set.of(), false));

        assertEquals(first.getIssues(), second.getIssues());
    }

    @Test
    void validate_failingCustomCheckBecomesWarning() {
        ValidationCheck broken = new ValidationCheck() {
            @Override
            public String category() {
                return "Weather";
            }

            @Override
            public List<ValidationIssue> check(ValidationContext context) {
                throw new IllegalStateException("forecast service down");
            }
        };

        ValidationResult result = validator.withCheck(broken).validate(
                singleTarget(NodeSpec.TargetHeader.at("M31", 0.71, 41.27), NodeSpec.Exposure.of(60, 10)),
                DeviceSnapshot.allConnected());

        assertEquals(1, result.issuesIn("Weather").size());
        assertEquals(ValidationSeverity.WARNING, result.issuesIn("Weather").get(0).severity());
    }
}
