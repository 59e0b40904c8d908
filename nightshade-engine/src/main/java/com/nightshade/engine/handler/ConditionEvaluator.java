package com.nightshade.engine.handler;

import com.nightshade.device.Telemetry;
import com.nightshade.sequence.model.LoopConditionType;
import com.nightshade.sequence.model.NodeSpec;

import java.time.Instant;

/**
 * Live evaluation of conditional and loop conditions against telemetry and the run clock.
 * <p>
 * A missing reading passes quality gates (HFR, guiding RMS, moon separation) so a silent sensor
 * does not skip work, but fails the altitude gate, which protects the mount. An altitude loop
 * without a limit or a reading does not iterate.
 */
public final class ConditionEvaluator {

    static final double DEFAULT_MIN_ALTITUDE = 30.0;
    static final double DEFAULT_MAX_GUIDING_RMS = 1.0;
    static final double DEFAULT_MAX_HFR = 3.0;
    static final double DEFAULT_MIN_MOON_SEPARATION = 30.0;

    private ConditionEvaluator() {
    }

    public static boolean isSatisfied(NodeSpec.Conditional condition, ExecutionContext ctx) {
        Telemetry telemetry = ctx.telemetry();
        NodeSpec.TargetHeader target = ctx.currentTarget();
        Double threshold = condition.thresholdValue();
        return switch (condition.conditionType()) {
            case ALWAYS -> true;
            case ALTITUDE_ABOVE -> {
                Double altitude = ctx.currentTargetAltitude();
                yield altitude != null && altitude > orDefault(threshold, DEFAULT_MIN_ALTITUDE);
            }
            case TIME_AFTER -> {
                Instant after = condition.thresholdTime();
                yield after == null || ctx.clock().instant().isAfter(after);
            }
            case GUIDING_RMS_BELOW -> {
                Double rms = telemetry.guidingRmsArcsec();
                yield rms == null || rms < orDefault(threshold, DEFAULT_MAX_GUIDING_RMS);
            }
            case HFR_BELOW -> {
                Double hfr = telemetry.latestHfr();
                yield hfr == null || hfr < orDefault(threshold, DEFAULT_MAX_HFR);
            }
            case WEATHER_SAFE -> telemetry.isWeatherSafe();
            case MOON_SEPARATION_ABOVE -> {
                if (target == null) yield true;
                Double separation = telemetry.moonSeparationDegrees(target.raHours(), target.decDegrees());
                yield separation == null || separation > orDefault(threshold, DEFAULT_MIN_MOON_SEPARATION);
            }
            case SAFETY_MONITOR_SAFE -> telemetry.isSafetyMonitorSafe();
        };
    }

    /** Whether a loop should start iteration {@code completed + 1}. */
    public static boolean shouldContinue(NodeSpec.Loop loop, int completed, ExecutionContext ctx) {
        LoopConditionType type = loop.conditionType();
        return switch (type) {
            case COUNT -> completed < loop.repeatCount();
            case UNTIL_TIME -> loop.repeatUntil() != null
                    ? ctx.clock().instant().isBefore(loop.repeatUntil())
                    : completed == 0;
            case UNTIL_ALTITUDE -> {
                // no limit or no altitude reading: nothing can ever end the loop
                Double limit = loop.repeatUntilAltitude();
                if (limit == null) yield false;
                Double altitude = ctx.currentTargetAltitude();
                yield altitude != null && altitude > limit;
            }
            case FOREVER -> true;
            case WHILE_DARK -> ctx.telemetry().isDark();
        };
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
