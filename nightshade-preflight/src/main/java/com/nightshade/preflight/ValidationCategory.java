package com.nightshade.preflight;

/**
 * Category names used by the built-in checks.
 */
public final class ValidationCategory {

    public static final String STRUCTURE = "Structure";
    public static final String TARGETS = "Targets";
    public static final String EXPOSURES = "Exposures";
    public static final String EQUIPMENT = "Equipment";
    public static final String SETTINGS = "Settings";
    public static final String TIMING = "Timing";

    private ValidationCategory() {
    }
}
