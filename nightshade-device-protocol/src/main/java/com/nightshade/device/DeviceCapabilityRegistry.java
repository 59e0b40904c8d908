package com.nightshade.device;

import java.util.Set;

/**
 * Live view of which devices the control backend currently has connected.
 * Implementations may throw when the backend is unreachable; callers capture a
 * {@link DeviceSnapshot} rather than querying repeatedly.
 */
public interface DeviceCapabilityRegistry {

    Set<DeviceType> getConnectedDevices();

    /** Guiding runs through a separate service, so its connectivity is reported separately. */
    boolean isGuiderConnected();
}
