package com.nightshade.engine.sky;

import java.time.Instant;

/**
 * Low-precision positional astronomy: good to a few arcminutes, which is ample for altitude
 * limits, darkness and meridian decisions. Right ascension in hours, everything else in degrees,
 * longitude positive east.
 */
public final class SkyCalculator {

    /** Julian date of the J2000.0 epoch (2000-01-01T12:00:00Z). */
    public static final double J2000 = 2451545.0;

    /** Sun altitude below which the sky counts as astronomically dark. */
    public static final double ASTRONOMICAL_DARK_SUN_ALTITUDE = -18.0;

    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private SkyCalculator() {
    }

    public static double julianDate(Instant instant) {
        return instant.toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_JD;
    }

    /** Greenwich mean sidereal time in hours, [0, 24). */
    public static double greenwichSiderealHours(Instant instant) {
        double d = julianDate(instant) - J2000;
        return normalizeHours(18.697374558 + 24.06570982441908 * d);
    }

    /** Local mean sidereal time in hours, [0, 24). */
    public static double localSiderealHours(Instant instant, double longitudeDegrees) {
        return normalizeHours(greenwichSiderealHours(instant) + longitudeDegrees / 15.0);
    }

    /** Hour angle in hours, [-12, 12): negative east of the meridian, positive once past it. */
    public static double hourAngleHours(double raHours, Instant instant, double longitudeDegrees) {
        double ha = normalizeHours(localSiderealHours(instant, longitudeDegrees) - raHours);
        return ha >= 12.0 ? ha - 24.0 : ha;
    }

    public static double altitudeDegrees(double raHours, double decDegrees, double latitudeDegrees,
                                         double longitudeDegrees, Instant instant) {
        double ha = Math.toRadians(hourAngleHours(raHours, instant, longitudeDegrees) * 15.0);
        double dec = Math.toRadians(decDegrees);
        double lat = Math.toRadians(latitudeDegrees);
        double sinAlt = Math.sin(dec) * Math.sin(lat) + Math.cos(dec) * Math.cos(lat) * Math.cos(ha);
        return Math.toDegrees(Math.asin(clamp(sinAlt)));
    }

    /** Apparent sun position as {@code [raHours, decDegrees]}. */
    public static double[] sunPosition(Instant instant) {
        double n = julianDate(instant) - J2000;
        double meanLongitude = Math.toRadians(normalizeDegrees(280.460 + 0.9856474 * n));
        double meanAnomaly = Math.toRadians(normalizeDegrees(357.528 + 0.9856003 * n));
        double eclipticLongitude = meanLongitude
                + Math.toRadians(1.915) * Math.sin(meanAnomaly)
                + Math.toRadians(0.020) * Math.sin(2 * meanAnomaly);
        double obliquity = Math.toRadians(23.439 - 0.0000004 * n);
        double ra = Math.atan2(Math.cos(obliquity) * Math.sin(eclipticLongitude), Math.cos(eclipticLongitude));
        double dec = Math.asin(Math.sin(obliquity) * Math.sin(eclipticLongitude));
        return new double[] {normalizeHours(Math.toDegrees(ra) / 15.0), Math.toDegrees(dec)};
    }

    public static double sunAltitudeDegrees(double latitudeDegrees, double longitudeDegrees, Instant instant) {
        double[] sun = sunPosition(instant);
        return altitudeDegrees(sun[0], sun[1], latitudeDegrees, longitudeDegrees, instant);
    }

    /** Great-circle distance between two equatorial positions, in degrees. */
    public static double angularSeparationDegrees(double ra1Hours, double dec1Degrees,
                                                  double ra2Hours, double dec2Degrees) {
        double dec1 = Math.toRadians(dec1Degrees);
        double dec2 = Math.toRadians(dec2Degrees);
        double deltaRa = Math.toRadians((ra1Hours - ra2Hours) * 15.0);
        double cos = Math.sin(dec1) * Math.sin(dec2) + Math.cos(dec1) * Math.cos(dec2) * Math.cos(deltaRa);
        return Math.toDegrees(Math.acos(clamp(cos)));
    }

    static double normalizeHours(double hours) {
        double h = hours % 24.0;
        return h < 0 ? h + 24.0 : h;
    }

    static double normalizeDegrees(double degrees) {
        double d = degrees % 360.0;
        return d < 0 ? d + 360.0 : d;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }
}
