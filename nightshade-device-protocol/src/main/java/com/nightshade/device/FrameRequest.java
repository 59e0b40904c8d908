package com.nightshade.device;

/**
 * One camera frame to capture.
 *
 * @param durationSecs exposure time in seconds
 * @param frameType    wire name of the frame type (light, dark, flat, bias)
 * @param filter       filter expected to be in the light path, or null for whatever is loaded
 * @param gain         camera gain, or null for the driver default
 * @param offset       camera offset, or null for the driver default
 * @param binning      symmetric binning factor (1..4)
 */
public record FrameRequest(double durationSecs, String frameType, String filter,
                           Integer gain, Integer offset, int binning) {
}
