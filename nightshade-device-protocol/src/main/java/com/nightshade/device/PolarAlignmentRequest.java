package com.nightshade.device;

public record PolarAlignmentRequest(double exposureDurationSecs, int binning, double startAltitude,
                                    double rotationStep, Integer gain, Integer offset,
                                    boolean startFromCurrent, boolean northernHemisphere, boolean manualSlew) {
}
