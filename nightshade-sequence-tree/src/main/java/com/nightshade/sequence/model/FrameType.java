package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Calibration or science frame kind. */
public enum FrameType {
    LIGHT("light"),
    DARK("dark"),
    FLAT("flat"),
    BIAS("bias");

    private final String value;

    FrameType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #LIGHT}. */
    @JsonCreator
    public static FrameType fromValue(String value) {
        if (value == null || value.isBlank()) return LIGHT;
        for (FrameType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return LIGHT;
    }
}
