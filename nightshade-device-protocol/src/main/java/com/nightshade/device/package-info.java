/**
 * Device-facing contracts shared by the validator and the execution engine.
 * <ul>
 *   <li>{@link com.nightshade.device.DeviceType} – closed set of capabilities a node can require</li>
 *   <li>{@link com.nightshade.device.DeviceCapabilityRegistry} / {@link com.nightshade.device.DeviceSnapshot} – connectivity query and its immutable captured value</li>
 *   <li>{@link com.nightshade.device.DeviceOperations} – future-returning hardware abstraction</li>
 *   <li>{@link com.nightshade.device.Telemetry} – live sky, guiding and safety readings</li>
 * </ul>
 */
package com.nightshade.device;
