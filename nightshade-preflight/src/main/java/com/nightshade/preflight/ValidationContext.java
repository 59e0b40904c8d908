package com.nightshade.preflight;

import com.nightshade.config.SequencerConfig;
import com.nightshade.device.DeviceSnapshot;
import com.nightshade.estimate.SequenceEstimate;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.tree.StructureReport;

import java.time.Instant;

/**
 * Inputs shared by every check in one validation pass. Derived values (structure, estimate) are
 * computed once by the validator.
 */
public record ValidationContext(Sequence sequence,
                                DeviceSnapshot devices,
                                Instant validatedAt,
                                StructureReport structure,
                                SequenceEstimate estimate,
                                SequencerConfig config) {
}
