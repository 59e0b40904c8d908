package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * Per-variant payload of a {@link SequenceNode}: one record per {@link NodeType}. Absent fields take
 * the documented defaults in each compact constructor, so older documents keep loading as records grow.
 * A type name this release does not know deserializes to {@link Unknown}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = NodeSpec.Unknown.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = NodeSpec.TargetHeader.class, name = "TargetHeader"),
        @JsonSubTypes.Type(value = NodeSpec.Loop.class, name = "Loop"),
        @JsonSubTypes.Type(value = NodeSpec.Parallel.class, name = "Parallel"),
        @JsonSubTypes.Type(value = NodeSpec.Conditional.class, name = "Conditional"),
        @JsonSubTypes.Type(value = NodeSpec.Recovery.class, name = "Recovery"),
        @JsonSubTypes.Type(value = NodeSpec.InstructionSet.class, name = "InstructionSet"),
        @JsonSubTypes.Type(value = NodeSpec.Slew.class, name = "Slew"),
        @JsonSubTypes.Type(value = NodeSpec.Center.class, name = "Center"),
        @JsonSubTypes.Type(value = NodeSpec.Exposure.class, name = "Exposure"),
        @JsonSubTypes.Type(value = NodeSpec.Autofocus.class, name = "Autofocus"),
        @JsonSubTypes.Type(value = NodeSpec.Dither.class, name = "Dither"),
        @JsonSubTypes.Type(value = NodeSpec.StartGuiding.class, name = "StartGuiding"),
        @JsonSubTypes.Type(value = NodeSpec.StopGuiding.class, name = "StopGuiding"),
        @JsonSubTypes.Type(value = NodeSpec.FilterChange.class, name = "FilterChange"),
        @JsonSubTypes.Type(value = NodeSpec.CoolCamera.class, name = "CoolCamera"),
        @JsonSubTypes.Type(value = NodeSpec.WarmCamera.class, name = "WarmCamera"),
        @JsonSubTypes.Type(value = NodeSpec.Rotator.class, name = "Rotator"),
        @JsonSubTypes.Type(value = NodeSpec.Park.class, name = "Park"),
        @JsonSubTypes.Type(value = NodeSpec.Unpark.class, name = "Unpark"),
        @JsonSubTypes.Type(value = NodeSpec.WaitTime.class, name = "WaitTime"),
        @JsonSubTypes.Type(value = NodeSpec.Delay.class, name = "Delay"),
        @JsonSubTypes.Type(value = NodeSpec.Notification.class, name = "Notification"),
        @JsonSubTypes.Type(value = NodeSpec.Script.class, name = "Script"),
        @JsonSubTypes.Type(value = NodeSpec.MeridianFlip.class, name = "MeridianFlip"),
        @JsonSubTypes.Type(value = NodeSpec.OpenDome.class, name = "OpenDome"),
        @JsonSubTypes.Type(value = NodeSpec.CloseDome.class, name = "CloseDome"),
        @JsonSubTypes.Type(value = NodeSpec.ParkDome.class, name = "ParkDome"),
        @JsonSubTypes.Type(value = NodeSpec.PolarAlignment.class, name = "PolarAlignment"),
        @JsonSubTypes.Type(value = NodeSpec.Unknown.class, name = "Unknown")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface NodeSpec {

    /** Variant tag of this payload. Not serialized; the {@code type} discriminator carries it. */
    NodeType nodeType();

    // ---- container / logic ----

    /** One imaging target; altitude and time windows gate whether its children run. */
    record TargetHeader(String targetName, Double raHours, Double decDegrees, Double rotation,
                        Integer priority, Double minAltitude, Double maxAltitude,
                        Instant startAfter, Instant endBefore, MosaicPanel mosaicPanel) implements NodeSpec {
        public TargetHeader {
            targetName = targetName != null ? targetName : "";
            raHours = raHours != null ? raHours : 0.0;
            decDegrees = decDegrees != null ? decDegrees : 0.0;
            priority = priority != null ? priority : 0;
        }

        public static TargetHeader at(String targetName, double raHours, double decDegrees) {
            return new TargetHeader(targetName, raHours, decDegrees, null, null, null, null, null, null, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.TARGET_HEADER;
        }
    }

    /** Panel position inside a mosaic; label is one-based. */
    record MosaicPanel(String mosaicName, int panelIndex, int totalPanels, int row, int column) {
        public String label() {
            return "Panel " + (panelIndex + 1) + "/" + totalPanels;
        }
    }

    record Loop(LoopConditionType conditionType, Integer repeatCount, Instant repeatUntil,
                Double repeatUntilAltitude) implements NodeSpec {
        public Loop {
            conditionType = conditionType != null ? conditionType : LoopConditionType.COUNT;
            repeatCount = repeatCount != null ? repeatCount : 1;
        }

        public static Loop count(int repeatCount) {
            return new Loop(LoopConditionType.COUNT, repeatCount, null, null);
        }

        public static Loop until(Instant repeatUntil) {
            return new Loop(LoopConditionType.UNTIL_TIME, null, repeatUntil, null);
        }

        public static Loop of(LoopConditionType conditionType) {
            return new Loop(conditionType, null, null, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.LOOP;
        }
    }

    /** {@code requiredSuccesses} null means every enabled child must succeed. */
    record Parallel(Integer requiredSuccesses) implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.PARALLEL;
        }
    }

    record Conditional(ConditionalType conditionType, Double thresholdValue, Instant thresholdTime) implements NodeSpec {
        public Conditional {
            conditionType = conditionType != null ? conditionType : ConditionalType.ALWAYS;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.CONDITIONAL;
        }
    }

    /**
     * Failure policy around a subtree. {@code branchNodeId} names the alternate subtree for
     * {@link RecoveryAction#CUSTOM_BRANCH}; {@code retryDelaySecs} overrides the configured initial backoff.
     */
    record Recovery(RecoveryAction recoveryAction, Integer maxRetries, TriggerType triggerType,
                    Double triggerThreshold, String branchNodeId, Double retryDelaySecs) implements NodeSpec {
        public Recovery {
            recoveryAction = recoveryAction != null ? recoveryAction : RecoveryAction.RETRY;
            maxRetries = maxRetries != null ? Math.max(0, maxRetries) : 3;
        }

        public static Recovery of(RecoveryAction action, int maxRetries) {
            return new Recovery(action, maxRetries, null, null, null, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.RECOVERY;
        }
    }

    record InstructionSet() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.INSTRUCTION_SET;
        }
    }

    // ---- instructions ----

    record Slew(Boolean useTargetCoords, Double customRa, Double customDec) implements NodeSpec {
        public Slew {
            useTargetCoords = useTargetCoords != null ? useTargetCoords : Boolean.TRUE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.SLEW;
        }
    }

    record Center(Double accuracyArcsec, Integer maxAttempts, Boolean useTargetCoords) implements NodeSpec {
        public Center {
            accuracyArcsec = accuracyArcsec != null ? accuracyArcsec : 5.0;
            maxAttempts = maxAttempts != null ? maxAttempts : 5;
            useTargetCoords = useTargetCoords != null ? useTargetCoords : Boolean.TRUE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.CENTER;
        }
    }

    /** {@code ditherEvery} of 0 disables dithering between frames. */
    record Exposure(Double durationSecs, Integer count, FrameType frameType, String filter,
                    Integer gain, Integer offset, Binning binning, Integer ditherEvery) implements NodeSpec {
        public Exposure {
            durationSecs = durationSecs != null ? durationSecs : 60.0;
            count = count != null ? count : 10;
            frameType = frameType != null ? frameType : FrameType.LIGHT;
            binning = binning != null ? binning : Binning.ONE;
            ditherEvery = ditherEvery != null ? ditherEvery : 0;
        }

        public static Exposure of(double durationSecs, int count) {
            return new Exposure(durationSecs, count, null, null, null, null, null, null);
        }

        public static Exposure of(double durationSecs, int count, String filter) {
            return new Exposure(durationSecs, count, null, filter, null, null, null, null);
        }

        public double totalDurationSecs() {
            return durationSecs * count;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.EXPOSURE;
        }
    }

    record Autofocus(AutofocusMethod method, Integer stepSize, Integer stepsOut,
                     Integer exposuresPerPoint, Double exposureDuration) implements NodeSpec {
        public Autofocus {
            method = method != null ? method : AutofocusMethod.V_CURVE;
            stepSize = stepSize != null ? stepSize : 100;
            stepsOut = stepsOut != null ? stepsOut : 7;
            exposuresPerPoint = exposuresPerPoint != null ? exposuresPerPoint : 1;
            exposureDuration = exposureDuration != null ? exposureDuration : 3.0;
        }

        public static Autofocus defaults() {
            return new Autofocus(null, null, null, null, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.AUTOFOCUS;
        }
    }

    record Dither(Double pixels, Double settlePixels, Double settleTime) implements NodeSpec {
        public Dither {
            pixels = pixels != null ? pixels : 5.0;
            settlePixels = settlePixels != null ? settlePixels : 1.5;
            settleTime = settleTime != null ? settleTime : 30.0;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.DITHER;
        }
    }

    record StartGuiding(Double settlePixels, Double settleTime, Double settleTimeout,
                        Boolean autoSelectStar) implements NodeSpec {
        public StartGuiding {
            settlePixels = settlePixels != null ? settlePixels : 1.5;
            settleTime = settleTime != null ? settleTime : 10.0;
            settleTimeout = settleTimeout != null ? settleTimeout : 60.0;
            autoSelectStar = autoSelectStar != null ? autoSelectStar : Boolean.TRUE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.START_GUIDING;
        }
    }

    record StopGuiding() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.STOP_GUIDING;
        }
    }

    record FilterChange(String filterName, Integer filterPosition) implements NodeSpec {
        public FilterChange {
            filterName = filterName != null ? filterName : "";
        }

        @Override
        public NodeType nodeType() {
            return NodeType.FILTER_CHANGE;
        }
    }

    record CoolCamera(Double targetTemp, Double durationMins) implements NodeSpec {
        public CoolCamera {
            targetTemp = targetTemp != null ? targetTemp : -10.0;
            durationMins = durationMins != null ? durationMins : 10.0;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.COOL_CAMERA;
        }
    }

    record WarmCamera(Double ratePerMin) implements NodeSpec {
        public WarmCamera {
            ratePerMin = ratePerMin != null ? ratePerMin : 2.0;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.WARM_CAMERA;
        }
    }

    record Rotator(Double targetAngle, Boolean relative) implements NodeSpec {
        public Rotator {
            targetAngle = targetAngle != null ? targetAngle : 0.0;
            relative = relative != null ? relative : Boolean.FALSE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.ROTATOR;
        }
    }

    record Park() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.PARK;
        }
    }

    record Unpark() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.UNPARK;
        }
    }

    /** Waits for an absolute instant, or for the given twilight when {@code waitUntil} is null. */
    record WaitTime(Instant waitUntil, TwilightType waitForTwilight) implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.WAIT_TIME;
        }
    }

    record Delay(Double seconds) implements NodeSpec {
        public Delay {
            seconds = seconds != null ? seconds : 5.0;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.DELAY;
        }
    }

    record Notification(String title, String message, NotificationLevel level) implements NodeSpec {
        public Notification {
            title = title != null ? title : "";
            message = message != null ? message : "";
            level = level != null ? level : NotificationLevel.INFO;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.NOTIFICATION;
        }
    }

    record Script(String scriptPath, List<String> arguments, Integer timeoutSecs) implements NodeSpec {
        public Script {
            scriptPath = scriptPath != null ? scriptPath : "";
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }

        @Override
        public NodeType nodeType() {
            return NodeType.SCRIPT;
        }
    }

    record MeridianFlip(Double minutesPastMeridian, Boolean pauseGuiding, Boolean autoCenter,
                        Double settleTime) implements NodeSpec {
        public MeridianFlip {
            minutesPastMeridian = minutesPastMeridian != null ? minutesPastMeridian : 5.0;
            pauseGuiding = pauseGuiding != null ? pauseGuiding : Boolean.TRUE;
            autoCenter = autoCenter != null ? autoCenter : Boolean.TRUE;
            settleTime = settleTime != null ? settleTime : 10.0;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.MERIDIAN_FLIP;
        }
    }

    record OpenDome(Boolean shutterOnly) implements NodeSpec {
        public OpenDome {
            shutterOnly = shutterOnly != null ? shutterOnly : Boolean.FALSE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.OPEN_DOME;
        }
    }

    record CloseDome(Boolean shutterOnly) implements NodeSpec {
        public CloseDome {
            shutterOnly = shutterOnly != null ? shutterOnly : Boolean.FALSE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.CLOSE_DOME;
        }
    }

    record ParkDome() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.PARK_DOME;
        }
    }

    record PolarAlignment(Double exposureDuration, Integer binning, Double startAltitude, Double rotationStep,
                          Integer gain, Integer offset, Boolean startFromCurrent, Boolean north,
                          Boolean manualSlew) implements NodeSpec {
        public PolarAlignment {
            exposureDuration = exposureDuration != null ? exposureDuration : 2.0;
            binning = binning != null ? binning : 2;
            startAltitude = startAltitude != null ? startAltitude : 45.0;
            rotationStep = rotationStep != null ? rotationStep : 20.0;
            startFromCurrent = startFromCurrent != null ? startFromCurrent : Boolean.TRUE;
            north = north != null ? north : Boolean.TRUE;
            manualSlew = manualSlew != null ? manualSlew : Boolean.FALSE;
        }

        @Override
        public NodeType nodeType() {
            return NodeType.POLAR_ALIGNMENT;
        }
    }

    /** Payload of a node type this release cannot interpret. */
    record Unknown() implements NodeSpec {
        @Override
        public NodeType nodeType() {
            return NodeType.UNKNOWN;
        }
    }
}
