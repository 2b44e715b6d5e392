package org.oran.slicing.model;

/**
 * Resources currently delivered to a slice.
 *
 * Values are derived from the slice's requirements by a {@link ResourceProfileTable};
 * afterwards only admission, preemption and remediation touch them.
 */
public class AllocatedResources {

    private double bandwidthMbps;
    private long computeUnits;
    private long memoryMb;
    private long storageGb;

    public AllocatedResources(double bandwidthMbps, long computeUnits, long memoryMb, long storageGb) {
        this.bandwidthMbps = bandwidthMbps;
        this.computeUnits = computeUnits;
        this.memoryMb = memoryMb;
        this.storageGb = storageGb;
    }

    public static AllocatedResources none() {
        return new AllocatedResources(0, 0, 0, 0);
    }

    public AllocatedResources copy() {
        return new AllocatedResources(bandwidthMbps, computeUnits, memoryMb, storageGb);
    }

    public double getBandwidthMbps() { return bandwidthMbps; }
    public long getComputeUnits() { return computeUnits; }
    public long getMemoryMb() { return memoryMb; }
    public long getStorageGb() { return storageGb; }

    void setBandwidthMbps(double bandwidthMbps) {
        if (bandwidthMbps < 0) {
            throw new IllegalArgumentException("Allocated bandwidth cannot be negative: " + bandwidthMbps);
        }
        this.bandwidthMbps = bandwidthMbps;
    }

    void setComputeUnits(long computeUnits) {
        this.computeUnits = computeUnits;
    }

    void replaceWith(AllocatedResources other) {
        this.bandwidthMbps = other.bandwidthMbps;
        this.computeUnits = other.computeUnits;
        this.memoryMb = other.memoryMb;
        this.storageGb = other.storageGb;
    }

    @Override
    public String toString() {
        return String.format("Allocated[bw=%.2fMbps, compute=%d, mem=%dMB, storage=%dGB]",
            bandwidthMbps, computeUnits, memoryMb, storageGb);
    }
}
