package com.nightshade.device;

/**
 * Outcome of a captured frame. {@code hfr} and {@code starCount} are null when the frame was not analysed.
 */
public record FrameResult(String filePath, Double hfr, Integer starCount) {
}
