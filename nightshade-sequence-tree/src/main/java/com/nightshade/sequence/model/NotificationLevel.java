package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Severity attached to a Notification node. */
public enum NotificationLevel {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    SUCCESS("success");

    private final String value;

    NotificationLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #INFO}. */
    @JsonCreator
    public static NotificationLevel fromValue(String value) {
        if (value == null || value.isBlank()) return INFO;
        for (NotificationLevel v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return INFO;
    }
}
