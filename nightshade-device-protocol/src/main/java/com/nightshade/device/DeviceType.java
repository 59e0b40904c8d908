package com.nightshade.device;

/**
 * Device capabilities a sequence node may require. Closed set; ordering is the lock-acquisition
 * order used by the engine when an instruction needs more than one capability.
 */
public enum DeviceType {
    CAMERA("camera", "Camera"),
    MOUNT("mount", "Mount"),
    FOCUSER("focuser", "Focuser"),
    FILTER_WHEEL("filterWheel", "Filter Wheel"),
    GUIDER("guider", "Guider"),
    ROTATOR("rotator", "Rotator"),
    DOME("dome", "Dome");

    private final String value;
    private final String displayName;

    DeviceType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Parses a wire value (case-insensitive); null for unknown values. */
    public static DeviceType fromValue(String value) {
        if (value == null) return null;
        for (DeviceType t : values()) {
            if (t.value.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        return null;
    }
}
