package com.nightshade.device;

/**
 * Sub-progress callback for long-running device operations (autofocus sweeps, cooling ramps).
 */
@FunctionalInterface
public interface OperationProgress {

    OperationProgress NONE = (fraction, detail) -> { };

    /**
     * @param fraction completion in [0, 1]
     * @param detail   short human-readable status, e.g. "Point 4/15"
     */
    void report(double fraction, String detail);
}
