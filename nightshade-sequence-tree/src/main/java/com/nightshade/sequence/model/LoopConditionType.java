package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a loop decides whether to run another iteration. */
public enum LoopConditionType {
    COUNT("count"),
    UNTIL_TIME("untilTime"),
    UNTIL_ALTITUDE("untilAltitude"),
    FOREVER("forever"),
    WHILE_DARK("whileDark");

    private final String value;

    LoopConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #COUNT}. */
    @JsonCreator
    public static LoopConditionType fromValue(String value) {
        if (value == null || value.isBlank()) return COUNT;
        for (LoopConditionType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return COUNT;
    }
}
