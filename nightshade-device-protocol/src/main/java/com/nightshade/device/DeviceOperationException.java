package com.nightshade.device;

/**
 * Raised by device implementations (or completed exceptionally into their futures) when a
 * hardware operation fails.
 */
public class DeviceOperationException extends RuntimeException {

    private final DeviceType device;

    public DeviceOperationException(DeviceType device, String message) {
        super(message);
        this.device = device;
    }

    public DeviceOperationException(DeviceType device, String message, Throwable cause) {
        super(message, cause);
        this.device = device;
    }

    /** Device that failed, or null when the failure is not tied to one capability. */
    public DeviceType getDevice() {
        return device;
    }
}
