package org.oran.slicing.mechanism;

/**
 * Runtime policy knobs shared by admission, monitoring and remediation.
 *
 * Only the engine changes these, under its write lock.
 */
public class SlicingPolicy {

    public static final int DEFAULT_MAX_SLICES = 16;
    public static final double DEFAULT_LATENCY_BANDWIDTH_BOOST = 0.2;
    public static final double DEFAULT_RELIABILITY_COMPUTE_BOOST = 1.5;
    public static final double DEFAULT_QOS_THRESHOLD = 0.95;

    private int maxSlices = DEFAULT_MAX_SLICES;
    private boolean dynamicAllocation = true;
    private double latencyBandwidthBoost = DEFAULT_LATENCY_BANDWIDTH_BOOST;
    private double reliabilityComputeBoost = DEFAULT_RELIABILITY_COMPUTE_BOOST;
    private double qosThreshold = DEFAULT_QOS_THRESHOLD;

    public int getMaxSlices() { return maxSlices; }
    public boolean isDynamicAllocation() { return dynamicAllocation; }
    public double getLatencyBandwidthBoost() { return latencyBandwidthBoost; }
    public double getReliabilityComputeBoost() { return reliabilityComputeBoost; }
    public double getQosThreshold() { return qosThreshold; }

    public SlicingPolicy setMaxSlices(int maxSlices) {
        if (maxSlices < 1) {
            throw new IllegalArgumentException("Maximum slices must be at least 1: " + maxSlices);
        }
        this.maxSlices = maxSlices;
        return this;
    }

    public SlicingPolicy setDynamicAllocation(boolean enabled) {
        this.dynamicAllocation = enabled;
        return this;
    }

    /**
     * Fraction of the current allocation added on a latency violation (0.2 = +20%).
     */
    public SlicingPolicy setLatencyBandwidthBoost(double boost) {
        if (boost < 0) {
            throw new IllegalArgumentException("Bandwidth boost cannot be negative: " + boost);
        }
        this.latencyBandwidthBoost = boost;
        return this;
    }

    /**
     * Multiplier applied to compute units on a reliability violation.
     */
    public SlicingPolicy setReliabilityComputeBoost(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Compute multiplier must be >= 1: " + multiplier);
        }
        this.reliabilityComputeBoost = multiplier;
        return this;
    }

    /**
     * SLA compliance ratio below which a slice is reported as non-compliant.
     */
    public SlicingPolicy setQosThreshold(double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("QoS threshold must be within [0, 1]: " + threshold);
        }
        this.qosThreshold = threshold;
        return this;
    }

    @Override
    public String toString() {
        return String.format("SlicingPolicy[maxSlices=%d, dynamic=%s, latencyBoost=%.2f, computeBoost=%.2f, qos=%.2f]",
            maxSlices, dynamicAllocation, latencyBandwidthBoost, reliabilityComputeBoost, qosThreshold);
    }
}
