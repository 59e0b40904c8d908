package com.nightshade.device;

/**
 * Autofocus run parameters. {@code method} is the wire name of the curve-fitting method.
 */
public record FocusRequest(String method, int stepSize, int stepsOut,
                           int exposuresPerPoint, double exposureDurationSecs, String filter) {
}
