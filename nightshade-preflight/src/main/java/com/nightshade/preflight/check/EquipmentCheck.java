package com.nightshade.preflight.check;

import com.nightshade.device.DeviceSnapshot;
import com.nightshade.device.DeviceType;
import com.nightshade.preflight.ValidationCategory;
import com.nightshade.preflight.ValidationCheck;
import com.nightshade.preflight.ValidationContext;
import com.nightshade.preflight.ValidationIssue;
import com.nightshade.preflight.ValidationSeverity;
import com.nightshade.sequence.requirements.DeviceRequirements;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Diffs the devices the plan requires against the connectivity snapshot.
 */
public final class EquipmentCheck implements ValidationCheck {

    @Override
    public String category() {
        return ValidationCategory.EQUIPMENT;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        DeviceSnapshot devices = context.devices();
        if (devices == null || !devices.isAvailable()) {
            return List.of(ValidationIssue.warning(category(), "Equipment Status Unknown",
                    "Could not check equipment status. Ensure you are connected to the backend.", null,
                    "Reconnect to the control backend and re-check."));
        }
        Set<DeviceType> required = DeviceRequirements.union(context.sequence());
        List<ValidationIssue> issues = new ArrayList<>();
        for (DeviceType device : DeviceType.values()) {
            if (required.contains(device) && !devices.isConnected(device)) {
                issues.add(missing(device));
            }
        }
        return issues;
    }

    private ValidationIssue missing(DeviceType device) {
        ValidationSeverity severity = switch (device) {
            case CAMERA -> ValidationSeverity.ERROR;
            case MOUNT, FOCUSER, FILTER_WHEEL, GUIDER -> ValidationSeverity.WARNING;
            case ROTATOR, DOME -> ValidationSeverity.INFO;
        };
        String description = switch (device) {
            case CAMERA -> "This sequence requires a camera to capture images.";
            case MOUNT -> "This sequence includes slewing or tracking operations that require a mount.";
            case FOCUSER -> "This sequence includes autofocus operations that require a focuser.";
            case FILTER_WHEEL -> "This sequence includes filter changes that require a filter wheel.";
            case GUIDER -> "This sequence includes guiding or dithering operations that require a guider.";
            case ROTATOR -> "This sequence includes rotator operations.";
            case DOME -> "This sequence includes dome operations.";
        };
        String resolution = device == DeviceType.GUIDER
                ? "Connect the guiding service."
                : "Connect a " + device.getDisplayName().toLowerCase() + " in the equipment settings.";
        return new ValidationIssue(severity, category(), "No " + device.getDisplayName() + " Connected",
                description, null, resolution);
    }
}
