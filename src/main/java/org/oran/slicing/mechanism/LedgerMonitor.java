package org.oran.slicing.mechanism;

import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Verifies the bandwidth ledger after every committed mutation.
 *
 * Invariants checked:
 * 1. Conservation: pool allocated == sum of ACTIVE slice allocations
 * 2. Bounds: 0 <= available <= total
 * 3. Non-negativity: no slice holds negative bandwidth
 * 4. Floors: no ACTIVE slice sits below its type's minimum bandwidth, or below its
 *    contracted bandwidth where that is lower
 *
 * In strict mode a breach throws {@link IllegalStateException}. Otherwise it is logged
 * and the pool ledger is reconciled to the sum of active allocations.
 */
public class LedgerMonitor {

    private static final Logger log = LoggerFactory.getLogger(LedgerMonitor.class);

    /** Relative tolerance for conservation, absorbs floating point drift. */
    private static final double TOLERANCE = 1e-6;

    /**
     * Result of a ledger check.
     */
    public static class LedgerCheckResult {
        private final List<String> violations;

        public LedgerCheckResult(List<String> violations) {
            this.violations = new ArrayList<>(violations);
        }

        public static LedgerCheckResult pass() {
            return new LedgerCheckResult(Collections.emptyList());
        }

        public boolean isSafe() { return violations.isEmpty(); }
        public List<String> getViolations() { return Collections.unmodifiableList(violations); }

        @Override
        public String toString() {
            return isSafe()
                ? "LedgerCheckResult[PASS]"
                : "LedgerCheckResult[FAIL: " + String.join("; ", violations) + "]";
        }
    }

    private final SliceRegistry registry;
    private final SliceCatalog catalog;
    private final ResourcePool pool;
    private boolean strictMode;
    private long checks;
    private long repairs;

    public LedgerMonitor(SliceRegistry registry, SliceCatalog catalog, ResourcePool pool) {
        this.registry = Objects.requireNonNull(registry);
        this.catalog = Objects.requireNonNull(catalog);
        this.pool = Objects.requireNonNull(pool);
        this.strictMode = false;
    }

    /**
     * In strict mode, breaches throw. In lenient mode, they are logged and repaired.
     */
    public LedgerMonitor setStrictMode(boolean strict) {
        this.strictMode = strict;
        return this;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    // ========================================================================
    // Checks
    // ========================================================================

    public LedgerCheckResult verify() {
        List<String> violations = new ArrayList<>();

        double activeSum = registry.activeBandwidth();
        double ledger = pool.getAllocatedBandwidth();
        double tolerance = TOLERANCE * Math.max(1.0, pool.getTotalBandwidth());
        if (Math.abs(ledger - activeSum) > tolerance) {
            violations.add(String.format(
                "Conservation violated: pool ledger %.6f Mbps != active allocations %.6f Mbps",
                ledger, activeSum));
        }

        double available = pool.getAvailableBandwidth();
        if (available < 0 || available > pool.getTotalBandwidth() + tolerance) {
            violations.add(String.format("Available bandwidth %.6f outside [0, %.6f]",
                available, pool.getTotalBandwidth()));
        }

        for (NetworkSlice slice : registry.all()) {
            if (slice.getAllocatedBandwidth() < 0) {
                violations.add(String.format("%s holds negative bandwidth %.6f",
                    slice.getId(), slice.getAllocatedBandwidth()));
            }
            if (slice.isActive() && catalog.contains(slice.getType())) {
                // a slice admitted before a catalog reload may sit below the new floor
                double floor = Math.min(catalog.lookup(slice.getType()).minBandwidthMbps(),
                    slice.getRequirements().bandwidthMbps());
                if (slice.getAllocatedBandwidth() < floor - tolerance) {
                    violations.add(String.format("%s below %s floor: %.6f < %.6f Mbps",
                        slice.getId(), slice.getType(), slice.getAllocatedBandwidth(), floor));
                }
            }
        }

        checks++;
        return violations.isEmpty() ? LedgerCheckResult.pass() : new LedgerCheckResult(violations);
    }

    /**
     * Verify and react to any breach according to the mode.
     *
     * @throws IllegalStateException in strict mode when an invariant is broken
     */
    public LedgerCheckResult enforce(String operation) {
        LedgerCheckResult result = verify();
        if (result.isSafe()) {
            return result;
        }
        if (strictMode) {
            throw new IllegalStateException("Ledger invariant broken after " + operation + ": "
                + String.join("; ", result.getViolations()));
        }
        for (String violation : result.getViolations()) {
            log.warn("Invariant violation after {}: {}", operation, violation);
        }
        pool.reconcile(registry.activeBandwidth());
        repairs++;
        return result;
    }

    public long getChecks() { return checks; }
    public long getRepairs() { return repairs; }
}
