package org.oran.slicing.model;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable view of a slice at one point in time.
 */
public record SliceInfo(
        SliceId id,
        SliceType type,
        SliceState state,
        SliceRequirements requirements,
        AllocatedResources allocated,
        Instant creationTime,
        Set<Long> associatedUes
) {

    public double allocatedBandwidthMbps() {
        return allocated.getBandwidthMbps();
    }

    public long computeUnits() {
        return allocated.getComputeUnits();
    }

    public SlicePriority priority() {
        return requirements.priority();
    }
}
