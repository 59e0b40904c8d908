package com.nightshade.engine.sky;

import com.nightshade.device.Telemetry;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Telemetry for a known observing site. Target altitude, sun altitude, darkness and meridian
 * position are computed from the site coordinates and the clock; guiding, focus, weather, safety
 * and moon readings come from the wrapped feed.
 */
public final class LocationTelemetry implements Telemetry {

    private final double latitudeDegrees;
    private final double longitudeDegrees;
    private final Clock clock;
    private final Telemetry feed;

    public LocationTelemetry(double latitudeDegrees, double longitudeDegrees, Clock clock, Telemetry feed) {
        if (latitudeDegrees < -90 || latitudeDegrees > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + latitudeDegrees);
        }
        this.latitudeDegrees = latitudeDegrees;
        this.longitudeDegrees = longitudeDegrees;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.feed = Objects.requireNonNull(feed, "feed");
    }

    public double getLatitudeDegrees() {
        return latitudeDegrees;
    }

    public double getLongitudeDegrees() {
        return longitudeDegrees;
    }

    private Instant now() {
        return clock.instant();
    }

    @Override
    public Double altitudeOf(double raHours, double decDegrees) {
        return SkyCalculator.altitudeDegrees(raHours, decDegrees, latitudeDegrees, longitudeDegrees, now());
    }

    @Override
    public boolean isDark() {
        return sunAltitudeDegrees() < SkyCalculator.ASTRONOMICAL_DARK_SUN_ALTITUDE;
    }

    @Override
    public Double sunAltitudeDegrees() {
        return SkyCalculator.sunAltitudeDegrees(latitudeDegrees, longitudeDegrees, now());
    }

    @Override
    public Double minutesPastMeridian(double raHours) {
        return SkyCalculator.hourAngleHours(raHours, now(), longitudeDegrees) * 60.0;
    }

    @Override
    public Double guidingRmsArcsec() {
        return feed.guidingRmsArcsec();
    }

    @Override
    public Double latestHfr() {
        return feed.latestHfr();
    }

    @Override
    public boolean isWeatherSafe() {
        return feed.isWeatherSafe();
    }

    @Override
    public boolean isSafetyMonitorSafe() {
        return feed.isSafetyMonitorSafe();
    }

    @Override
    public Double moonSeparationDegrees(double raHours, double decDegrees) {
        return feed.moonSeparationDegrees(raHours, decDegrees);
    }

    @Override
    public Double temperatureShiftSinceFocus() {
        return feed.temperatureShiftSinceFocus();
    }
}
