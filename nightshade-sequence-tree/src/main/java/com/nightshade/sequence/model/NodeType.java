package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Variant tag of a sequence node. The set is closed: device requirements, the estimator and the
 * engine handler registry all switch over it exhaustively, so a new constant does not compile
 * (or the engine does not start) until every consumer handles it.
 * JSON uses the display wire name (e.g. {@code "TargetHeader"}); unknown values map to {@link #UNKNOWN}.
 */
public enum NodeType {
    // container / logic
    TARGET_HEADER("TargetHeader", true),
    LOOP("Loop", true),
    PARALLEL("Parallel", true),
    CONDITIONAL("Conditional", true),
    RECOVERY("Recovery", true),
    INSTRUCTION_SET("InstructionSet", true),
    // instructions
    SLEW("Slew", false),
    CENTER("Center", false),
    EXPOSURE("Exposure", false),
    AUTOFOCUS("Autofocus", false),
    DITHER("Dither", false),
    START_GUIDING("StartGuiding", false),
    STOP_GUIDING("StopGuiding", false),
    FILTER_CHANGE("FilterChange", false),
    COOL_CAMERA("CoolCamera", false),
    WARM_CAMERA("WarmCamera", false),
    ROTATOR("Rotator", false),
    PARK("Park", false),
    UNPARK("Unpark", false),
    WAIT_TIME("WaitTime", false),
    DELAY("Delay", false),
    NOTIFICATION("Notification", false),
    SCRIPT("Script", false),
    MERIDIAN_FLIP("MeridianFlip", false),
    OPEN_DOME("OpenDome", false),
    CLOSE_DOME("CloseDome", false),
    PARK_DOME("ParkDome", false),
    POLAR_ALIGNMENT("PolarAlignment", false),
    /** Written by a newer release; loads, never runs. */
    UNKNOWN("Unknown", false);

    private final String wireName;
    private final boolean container;

    NodeType(String wireName, boolean container) {
        this.wireName = wireName;
        this.container = container;
    }

    @JsonValue
    public String toValue() {
        return wireName;
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim();
        for (NodeType t : values()) {
            if (t != UNKNOWN && (t.wireName.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))) {
                return t;
            }
        }
        return UNKNOWN;
    }

    /** True for control-flow nodes that own children and issue no hardware command. */
    public boolean isContainer() {
        return container;
    }
}
