package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a Recovery node does when its subtree fails. */
public enum RecoveryAction {
    CONTINUE("continue"),
    PAUSE("pause"),
    AUTOFOCUS("autofocus"),
    NEXT_TARGET("nextTarget"),
    RETRY("retry"),
    PARK_AND_ABORT("parkAndAbort"),
    CUSTOM_BRANCH("customBranch");

    private final String value;

    RecoveryAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values fall back to {@link #RETRY}. */
    @JsonCreator
    public static RecoveryAction fromValue(String value) {
        if (value == null || value.isBlank()) return RETRY;
        for (RecoveryAction v : values()) {
            if (v.value.equalsIgnoreCase(value.trim()) || v.name().equalsIgnoreCase(value.trim())) return v;
        }
        return RETRY;
    }
}
