package org.oran.slicing.model;

/**
 * Per-type base constants for the derived resources of a slice.
 *
 * @param computeBaseUnits compute units at the reference bandwidth
 * @param memoryBaseMb memory at the reference bandwidth
 * @param storageGb storage, independent of bandwidth
 */
public record ResourceProfile(long computeBaseUnits, long memoryBaseMb, long storageGb) {

    /** Used for slice types without a configured profile. */
    public static final ResourceProfile FALLBACK = new ResourceProfile(10, 100, 10);

    public ResourceProfile {
        if (computeBaseUnits < 0 || memoryBaseMb < 0 || storageGb < 0) {
            throw new IllegalArgumentException(String.format(
                "Profile values cannot be negative: compute=%d, memory=%d, storage=%d",
                computeBaseUnits, memoryBaseMb, storageGb));
        }
    }
}
