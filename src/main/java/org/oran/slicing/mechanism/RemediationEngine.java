package org.oran.slicing.mechanism;

import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Adjusts live allocations in response to QoS violations.
 *
 * - Latency violation: grow bandwidth by the configured fraction of the current
 *   allocation if dynamic allocation is on and the pool has room. Otherwise the
 *   step is skipped until the next violation.
 * - Reliability violation: multiply compute units (redundancy, error correction).
 *   Consumes no pool bandwidth.
 *
 * Only the delivered allocation changes, never the slice's requirements.
 */
public class RemediationEngine {

    private static final Logger log = LoggerFactory.getLogger(RemediationEngine.class);

    private final SliceRegistry registry;
    private final ResourcePool pool;
    private final SlicingPolicy policy;
    private final EventBus eventBus;

    private long applied;
    private long skipped;

    public RemediationEngine(SliceRegistry registry, ResourcePool pool, SlicingPolicy policy, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry);
        this.pool = Objects.requireNonNull(pool);
        this.policy = Objects.requireNonNull(policy);
        this.eventBus = Objects.requireNonNull(eventBus);
    }

    /**
     * Start reacting to violation events on the bus.
     */
    public void attach() {
        eventBus.subscribe(Event.LatencyViolationEvent.class, e -> onLatencyViolation(e.sliceId()));
        eventBus.subscribe(Event.ReliabilityViolationEvent.class, e -> onReliabilityViolation(e.sliceId()));
    }

    /**
     * @return true if the slice received more bandwidth
     */
    public boolean onLatencyViolation(SliceId id) {
        Optional<NetworkSlice> target = activeSlice(id);
        if (target.isEmpty()) {
            return false;
        }
        if (!policy.isDynamicAllocation()) {
            log.debug("Dynamic allocation disabled, not remediating latency of {}", id);
            skipped++;
            return false;
        }

        NetworkSlice slice = target.get();
        double current = slice.getAllocatedBandwidth();
        double extra = current * policy.getLatencyBandwidthBoost();
        if (!pool.reserve(extra)) {
            log.info("Skipping latency remediation for {}: needs {} Mbps, {} Mbps available",
                id, extra, pool.getAvailableBandwidth());
            skipped++;
            return false;
        }

        slice.setAllocatedBandwidth(current + extra);
        applied++;
        log.info("Increased bandwidth of {} from {} to {} Mbps to address latency",
            id, current, slice.getAllocatedBandwidth());
        eventBus.publish(new Event.ResourceAllocationEvent(
            eventBus.clock().instant(), id, slice.getAllocatedBandwidth()));
        eventBus.publish(new Event.SliceModifiedEvent(
            eventBus.clock().instant(), id, "latency remediation"));
        return true;
    }

    /**
     * @return true if compute units were increased
     */
    public boolean onReliabilityViolation(SliceId id) {
        Optional<NetworkSlice> target = activeSlice(id);
        if (target.isEmpty()) {
            return false;
        }

        NetworkSlice slice = target.get();
        long before = slice.getComputeUnits();
        long after = (long) Math.floor(before * policy.getReliabilityComputeBoost());
        slice.setComputeUnits(after);
        applied++;
        log.info("Increased compute units of {} from {} to {} to address reliability", id, before, after);
        eventBus.publish(new Event.SliceModifiedEvent(
            eventBus.clock().instant(), id, "reliability remediation"));
        return true;
    }

    private Optional<NetworkSlice> activeSlice(SliceId id) {
        Optional<NetworkSlice> slice = registry.find(id).filter(NetworkSlice::isActive);
        if (slice.isEmpty()) {
            log.debug("No active slice {} to remediate", id);
        }
        return slice;
    }

    public long getApplied() { return applied; }
    public long getSkipped() { return skipped; }
}
