package com.nightshade.sequence.requirements;

import com.nightshade.device.DeviceType;
import com.nightshade.sequence.model.NodeType;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static table of the device capabilities each node type requires. Built once from an exhaustive
 * switch, so adding a {@link NodeType} without a row is a compile error.
 */
public final class DeviceRequirements {

    private static final Map<NodeType, Set<DeviceType>> TABLE = new EnumMap<>(NodeType.class);

    static {
        for (NodeType type : NodeType.values()) {
            TABLE.put(type, Collections.unmodifiableSet(lookup(type)));
        }
    }

    private DeviceRequirements() {
    }

    private static Set<DeviceType> lookup(NodeType type) {
        return switch (type) {
            case TARGET_HEADER, SLEW, PARK, UNPARK, MERIDIAN_FLIP -> EnumSet.of(DeviceType.MOUNT);
            case CENTER, POLAR_ALIGNMENT -> EnumSet.of(DeviceType.MOUNT, DeviceType.CAMERA);
            case EXPOSURE, COOL_CAMERA, WARM_CAMERA -> EnumSet.of(DeviceType.CAMERA);
            case AUTOFOCUS -> EnumSet.of(DeviceType.CAMERA, DeviceType.FOCUSER);
            case DITHER, START_GUIDING, STOP_GUIDING -> EnumSet.of(DeviceType.GUIDER);
            case FILTER_CHANGE -> EnumSet.of(DeviceType.FILTER_WHEEL);
            case ROTATOR -> EnumSet.of(DeviceType.ROTATOR);
            case OPEN_DOME, CLOSE_DOME, PARK_DOME -> EnumSet.of(DeviceType.DOME);
            case LOOP, PARALLEL, CONDITIONAL, RECOVERY, INSTRUCTION_SET,
                    WAIT_TIME, DELAY, NOTIFICATION, SCRIPT, UNKNOWN -> EnumSet.noneOf(DeviceType.class);
        };
    }

    /** Required capabilities of a node type; never null, unmodifiable. */
    public static Set<DeviceType> of(NodeType type) {
        return TABLE.get(type != null ? type : NodeType.UNKNOWN);
    }

    public static Set<DeviceType> of(SequenceNode node) {
        return of(node.getType());
    }

    /** Union of requirements over every enabled node in the mapping. */
    public static Set<DeviceType> union(Sequence sequence) {
        EnumSet<DeviceType> required = EnumSet.noneOf(DeviceType.class);
        for (SequenceNode node : sequence.getNodes().values()) {
            if (node.isEnabled()) {
                required.addAll(of(node.getType()));
            }
        }
        return required;
    }
}
