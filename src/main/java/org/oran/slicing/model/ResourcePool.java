package org.oran.slicing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared bandwidth pool with reserve/release primitives.
 *
 * The pool keeps a ledger of allocated bandwidth. Available bandwidth is derived:
 * {@code available = max(0, total - allocated)}, so it never goes negative and never
 * exceeds the total, even after the total was shrunk below what is allocated.
 */
public class ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    /** Tolerance for floating point comparisons on Mbps values. */
    public static final double EPSILON = 1e-9;

    private double totalBandwidthMbps;
    private double allocatedBandwidthMbps;

    public ResourcePool(double totalBandwidthMbps) {
        if (totalBandwidthMbps < 0) {
            throw new IllegalArgumentException("Total bandwidth cannot be negative: " + totalBandwidthMbps);
        }
        this.totalBandwidthMbps = totalBandwidthMbps;
        this.allocatedBandwidthMbps = 0.0;
    }

    // ========================================================================
    // Capacity Queries
    // ========================================================================

    public double getTotalBandwidth() {
        return totalBandwidthMbps;
    }

    public double getAllocatedBandwidth() {
        return allocatedBandwidthMbps;
    }

    public double getAvailableBandwidth() {
        return Math.max(0.0, totalBandwidthMbps - allocatedBandwidthMbps);
    }

    /**
     * Allocated bandwidth beyond the total, non-zero only after the pool was shrunk.
     */
    public double getOvercommit() {
        return Math.max(0.0, allocatedBandwidthMbps - totalBandwidthMbps);
    }

    /**
     * Get utilization ratio (0.0 to 1.0).
     */
    public double getUtilization() {
        if (totalBandwidthMbps == 0) return 0.0;
        return Math.min(1.0, allocatedBandwidthMbps / totalBandwidthMbps);
    }

    public boolean hasSufficient(double amount) {
        return amount <= getAvailableBandwidth() + EPSILON;
    }

    // ========================================================================
    // Allocation Operations
    // ========================================================================

    /**
     * Reserve bandwidth if enough is available.
     *
     * @return true if reserved, false with no state change otherwise
     */
    public boolean reserve(double amount) {
        requireNonNegative(amount);
        if (!hasSufficient(amount)) {
            return false;
        }
        allocatedBandwidthMbps += amount;
        return true;
    }

    /**
     * Release bandwidth back to the pool. Releasing more than is allocated points at
     * an accounting bug in the caller; the ledger is clamped at zero and a warning logged.
     */
    public void release(double amount) {
        requireNonNegative(amount);
        double remaining = allocatedBandwidthMbps - amount;
        if (remaining < -EPSILON) {
            log.warn("Invariant violation: releasing {} Mbps but only {} Mbps allocated, clamping",
                amount, allocatedBandwidthMbps);
        }
        allocatedBandwidthMbps = Math.max(0.0, remaining);
    }

    /**
     * Change the total capacity. Existing allocations are left untouched.
     *
     * @return bandwidth allocated beyond the new total, 0 if everything still fits
     */
    public double resize(double newTotal) {
        requireNonNegative(newTotal);
        this.totalBandwidthMbps = newTotal;
        double shortfall = getOvercommit();
        if (shortfall > EPSILON) {
            log.warn("Total bandwidth {} Mbps is below allocated {} Mbps, shortfall {} Mbps",
                newTotal, allocatedBandwidthMbps, shortfall);
        }
        return shortfall;
    }

    /**
     * Force the ledger to a known value. Only used to repair a detected mismatch.
     */
    public void reconcile(double allocated) {
        this.allocatedBandwidthMbps = Math.max(0.0, allocated);
    }

    private static void requireNonNegative(double amount) {
        if (amount < 0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Bandwidth amount must be non-negative: " + amount);
        }
    }

    @Override
    public String toString() {
        return String.format("ResourcePool[%.2f/%.2f Mbps available (%.1f%% utilized)]",
            getAvailableBandwidth(), totalBandwidthMbps, getUtilization() * 100);
    }
}
