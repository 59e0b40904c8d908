package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Live condition a Conditional node evaluates immediately before entering its children. */
public enum ConditionalType {
    ALWAYS("always"),
    ALTITUDE_ABOVE("altitudeAbove"),
    TIME_AFTER("timeAfter"),
    GUIDING_RMS_BELOW("guidingRmsBelow"),
    HFR_BELOW("hfrBelow"),
    WEATHER_SAFE("weatherSafe"),
    MOON_SEPARATION_ABOVE("moonSeparationAbove"),
    SAFETY_MONITOR_SAFE("safetyMonitorSafe");

    private final String value;

    ConditionalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #ALWAYS}. */
    @JsonCreator
    public static ConditionalType fromValue(String value) {
        if (value == null || value.isBlank()) return ALWAYS;
        for (ConditionalType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return ALWAYS;
    }
}
