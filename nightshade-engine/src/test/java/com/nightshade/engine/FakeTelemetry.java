package com.nightshade.engine;

import com.nightshade.device.Telemetry;

/** Settable telemetry; every target reports the same altitude. */
public final class FakeTelemetry implements Telemetry {

    public volatile Double altitude = 60.0;
    public volatile boolean dark = true;
    public volatile Double guidingRms = 0.6;
    public volatile Double hfr = 2.0;
    public volatile boolean weatherSafe = true;
    public volatile boolean safetySafe = true;
    public volatile Double moonSeparation = 90.0;
    public volatile Double minutesPastMeridian = -60.0;
    public volatile Double temperatureShift = 0.0;
    public volatile Double sunAltitude;

    @Override
    public Double altitudeOf(double raHours, double decDegrees) {
        return altitude;
    }

    @Override
    public boolean isDark() {
        return dark;
    }

    @Override
    public Double guidingRmsArcsec() {
        return guidingRms;
    }

    @Override
    public Double latestHfr() {
        return hfr;
    }

    @Override
    public boolean isWeatherSafe() {
        return weatherSafe;
    }

    @Override
    public boolean isSafetyMonitorSafe() {
        return safetySafe;
    }

    @Override
    public Double moonSeparationDegrees(double raHours, double decDegrees) {
        return moonSeparation;
    }

    @Override
    public Double minutesPastMeridian(double raHours) {
        return minutesPastMeridian;
    }

    @Override
    public Double temperatureShiftSinceFocus() {
        return temperatureShift;
    }

    @Override
    public Double sunAltitudeDegrees() {
        return sunAltitude;
    }
}
