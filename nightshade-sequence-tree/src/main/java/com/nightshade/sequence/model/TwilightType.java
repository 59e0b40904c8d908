package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Sun-altitude boundary a WaitTime node can wait for. */
public enum TwilightType {
    CIVIL("civil", -6.0),
    NAUTICAL("nautical", -12.0),
    ASTRONOMICAL("astronomical", -18.0);

    private final String value;
    private final double sunAltitude;

    TwilightType(String value, double sunAltitude) {
        this.value = value;
        this.sunAltitude = sunAltitude;
    }

    /** Sun altitude in degrees below which this twilight has ended. */
    public double getSunAltitude() {
        return sunAltitude;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #ASTRONOMICAL}. */
    @JsonCreator
    public static TwilightType fromValue(String value) {
        if (value == null || value.isBlank()) return ASTRONOMICAL;
        for (TwilightType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return ASTRONOMICAL;
    }
}
