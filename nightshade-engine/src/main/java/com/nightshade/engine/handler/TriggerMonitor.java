package com.nightshade.engine.handler;

import com.nightshade.device.Telemetry;
import com.nightshade.sequence.model.NodeSpec;
import com.nightshade.sequence.model.TriggerType;

import java.util.Locale;

/**
 * Proactive activation condition of a recovery node, polled while its descendants wait on
 * device operations. Missing telemetry never fires a trigger.
 */
public final class TriggerMonitor {

    static final double DEFAULT_HFR_LIMIT = 4.0;
    static final double DEFAULT_GUIDING_RMS_LIMIT = 2.0;
    static final double DEFAULT_ALTITUDE_LIMIT = 20.0;
    static final double DEFAULT_MERIDIAN_MINUTES = 0.0;
    static final double DEFAULT_TEMPERATURE_SHIFT = 2.0;

    private final String recoveryNodeId;
    private final TriggerType type;
    private final double threshold;

    public TriggerMonitor(String recoveryNodeId, TriggerType type, Double threshold) {
        this.recoveryNodeId = recoveryNodeId;
        this.type = type;
        this.threshold = threshold != null ? threshold : defaultThreshold(type);
    }

    /** Monitor for the recovery's trigger, or null when it has none. */
    public static TriggerMonitor of(String recoveryNodeId, NodeSpec.Recovery recovery) {
        if (recovery.triggerType() == null) return null;
        return new TriggerMonitor(recoveryNodeId, recovery.triggerType(), recovery.triggerThreshold());
    }

    private static double defaultThreshold(TriggerType type) {
        return switch (type) {
            case HFR_DEGRADED -> DEFAULT_HFR_LIMIT;
            case GUIDING_FAILED -> DEFAULT_GUIDING_RMS_LIMIT;
            case ALTITUDE_LIMIT -> DEFAULT_ALTITUDE_LIMIT;
            case MERIDIAN_FLIP -> DEFAULT_MERIDIAN_MINUTES;
            case TEMPERATURE_SHIFT -> DEFAULT_TEMPERATURE_SHIFT;
            case WEATHER_UNSAFE, FILTER_CHANGE -> 0.0;
        };
    }

    public String getRecoveryNodeId() {
        return recoveryNodeId;
    }

    public TriggerType getType() {
        return type;
    }

    /** Human-readable reason when the trigger condition holds, else null. */
    public String check(ExecutionContext ctx) {
        Telemetry telemetry = ctx.telemetry();
        NodeSpec.TargetHeader target = ctx.currentTarget();
        return switch (type) {
            case HFR_DEGRADED -> above("HFR", telemetry.latestHfr());
            case GUIDING_FAILED -> above("guiding RMS", telemetry.guidingRmsArcsec());
            case TEMPERATURE_SHIFT -> {
                Double shift = telemetry.temperatureShiftSinceFocus();
                yield above("temperature shift", shift != null ? Math.abs(shift) : null);
            }
            case ALTITUDE_LIMIT -> {
                Double altitude = ctx.currentTargetAltitude();
                yield altitude != null && altitude < threshold
                        ? format("altitude %.1f° below limit %.1f°", altitude, threshold) : null;
            }
            case MERIDIAN_FLIP -> {
                Double past = target != null ? telemetry.minutesPastMeridian(target.raHours()) : null;
                yield past != null && past >= threshold
                        ? format("target %.1f min past meridian", past) : null;
            }
            case WEATHER_UNSAFE -> !telemetry.isWeatherSafe() || !telemetry.isSafetyMonitorSafe()
                    ? "weather or safety monitor reports unsafe" : null;
            // Filter changes are explicit instructions; there is no reading to poll.
            case FILTER_CHANGE -> null;
        };
    }

    private String above(String label, Double value) {
        return value != null && value > threshold
                ? format("%s %.2f above limit %.2f", label, value, threshold) : null;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
