package com.nightshade.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable point-in-time view of device connectivity, handed explicitly to the validator and engine.
 * An unavailable snapshot records that the registry query failed; consumers degrade instead of failing.
 */
public final class DeviceSnapshot {

    private static final Logger log = LoggerFactory.getLogger(DeviceSnapshot.class);

    private final Set<DeviceType> connectedDevices;
    private final boolean guiderConnected;
    private final boolean available;
    private final String failureReason;

    private DeviceSnapshot(Set<DeviceType> connectedDevices, boolean guiderConnected,
                           boolean available, String failureReason) {
        EnumSet<DeviceType> copy = EnumSet.noneOf(DeviceType.class);
        if (connectedDevices != null) copy.addAll(connectedDevices);
        this.connectedDevices = Collections.unmodifiableSet(copy);
        this.guiderConnected = guiderConnected;
        this.available = available;
        this.failureReason = failureReason;
    }

    public static DeviceSnapshot of(Set<DeviceType> connectedDevices, boolean guiderConnected) {
        return new DeviceSnapshot(connectedDevices, guiderConnected, true, null);
    }

    /** Snapshot with every capability connected, including the guider. */
    public static DeviceSnapshot allConnected() {
        return of(EnumSet.allOf(DeviceType.class), true);
    }

    public static DeviceSnapshot unavailable(String reason) {
        return new DeviceSnapshot(Set.of(), false, false, reason != null ? reason : "Device status unavailable");
    }

    /**
     * Queries the registry once. Any runtime failure of the query yields an unavailable snapshot.
     */
    public static DeviceSnapshot capture(DeviceCapabilityRegistry registry) {
        if (registry == null) {
            return unavailable("No device registry configured");
        }
        try {
            Set<DeviceType> connected = registry.getConnectedDevices();
            boolean guider = registry.isGuiderConnected();
            return of(connected, guider);
        } catch (RuntimeException e) {
            log.warn("Device snapshot capture failed | reason={}", e.getMessage(), e);
            return unavailable(e.getMessage());
        }
    }

    public Set<DeviceType> getConnectedDevices() {
        return connectedDevices;
    }

    public boolean isGuiderConnected() {
        return guiderConnected;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /** Guider connectivity comes from the dedicated flag; other capabilities from the connected set. */
    public boolean isConnected(DeviceType type) {
        if (type == DeviceType.GUIDER) {
            return guiderConnected;
        }
        return connectedDevices.contains(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeviceSnapshot that = (DeviceSnapshot) o;
        return guiderConnected == that.guiderConnected && available == that.available
                && connectedDevices.equals(that.connectedDevices)
                && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connectedDevices, guiderConnected, available, failureReason);
    }

    @Override
    public String toString() {
        return available
                ? "DeviceSnapshot{connected=" + connectedDevices + ", guider=" + guiderConnected + "}"
                : "DeviceSnapshot{unavailable: " + failureReason + "}";
    }
}
