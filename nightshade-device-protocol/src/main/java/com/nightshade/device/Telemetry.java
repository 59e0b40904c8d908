package com.nightshade.device;

/**
 * Live sky, guiding and safety state read by the engine at condition, loop-boundary and trigger checks.
 * Numeric readings return null when unavailable; callers decide how an absent reading is treated.
 */
public interface Telemetry {

    /** Current altitude in degrees of the given coordinates, or null when unknown. */
    Double altitudeOf(double raHours, double decDegrees);

    boolean isDark();

    /** Total guiding RMS in arcseconds, or null when the guider is not reporting. */
    Double guidingRmsArcsec();

    /** Half-flux radius of the most recent analysed frame, or null. */
    Double latestHfr();

    boolean isWeatherSafe();

    boolean isSafetyMonitorSafe();

    /** Angular distance in degrees from the moon to the given coordinates, or null. */
    Double moonSeparationDegrees(double raHours, double decDegrees);

    /** Minutes the given right ascension is past the local meridian (negative before), or null. */
    Double minutesPastMeridian(double raHours);

    /** Absolute focuser temperature change in Celsius since the last autofocus, or null. */
    Double temperatureShiftSinceFocus();

    /** Altitude of the sun in degrees, or null when the observer location is unknown. */
    default Double sunAltitudeDegrees() {
        return null;
    }
}
