package org.oran.slicing.model;

import java.util.*;

/**
 * Table of resource profiles keyed by slice type.
 *
 * Derived resources scale linearly with bandwidth:
 * <pre>
 * computeUnits = floor(computeBase * bandwidth / referenceBandwidth)
 * memoryMb     = floor(memoryBase  * bandwidth / referenceBandwidth)
 * storageGb    = storage
 * </pre>
 */
public class ResourceProfileTable {

    private final Map<SliceType, ResourceProfile> profiles;
    private final double referenceBandwidthMbps;

    public ResourceProfileTable(Map<SliceType, ResourceProfile> profiles, double referenceBandwidthMbps) {
        if (referenceBandwidthMbps <= 0) {
            throw new IllegalArgumentException(
                "Reference bandwidth must be positive: " + referenceBandwidthMbps);
        }
        this.profiles = new EnumMap<>(SliceType.class);
        this.profiles.putAll(profiles);
        this.referenceBandwidthMbps = referenceBandwidthMbps;
    }

    public ResourceProfile profileFor(SliceType type) {
        return profiles.getOrDefault(type, ResourceProfile.FALLBACK);
    }

    public double getReferenceBandwidthMbps() {
        return referenceBandwidthMbps;
    }

    public Map<SliceType, ResourceProfile> getProfiles() {
        return Collections.unmodifiableMap(profiles);
    }

    /**
     * Compute the full resource allocation for a slice of {@code type} at {@code bandwidthMbps}.
     */
    public AllocatedResources derive(SliceType type, double bandwidthMbps) {
        ResourceProfile profile = profileFor(type);
        return new AllocatedResources(
            bandwidthMbps,
            (long) Math.floor(profile.computeBaseUnits() * bandwidthMbps / referenceBandwidthMbps),
            (long) Math.floor(profile.memoryBaseMb() * bandwidthMbps / referenceBandwidthMbps),
            profile.storageGb());
    }

    @Override
    public String toString() {
        return String.format("ResourceProfileTable[%d profiles, reference=%.1fMbps]",
            profiles.size(), referenceBandwidthMbps);
    }
}
