package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Curve model fitted to the focus sweep. */
public enum AutofocusMethod {
    V_CURVE("vCurve"),
    HYPERBOLIC("hyperbolic"),
    PARABOLIC("parabolic");

    private final String value;

    AutofocusMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #V_CURVE}. */
    @JsonCreator
    public static AutofocusMethod fromValue(String value) {
        if (value == null || value.isBlank()) return V_CURVE;
        for (AutofocusMethod v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return V_CURVE;
    }
}
