package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Condition that activates a Recovery node proactively while its subtree is running. */
public enum TriggerType {
    HFR_DEGRADED("hfrDegraded"),
    MERIDIAN_FLIP("meridianFlip"),
    GUIDING_FAILED("guidingFailed"),
    ALTITUDE_LIMIT("altitudeLimit"),
    WEATHER_UNSAFE("weatherUnsafe"),
    TEMPERATURE_SHIFT("temperatureShift"),
    FILTER_CHANGE("filterChange");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Null for unknown or blank values, which disables the trigger. */
    @JsonCreator
    public static TriggerType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (TriggerType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return null;
    }
}
