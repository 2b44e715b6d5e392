package org.oran.slicing.mechanism;

import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Gatekeeper for slice creation, modification and deletion.
 *
 * Every request is all-or-nothing: a failed create or modify leaves the pool and every
 * existing slice exactly as they were. When the pool cannot cover a request and dynamic
 * allocation is enabled, the {@link Preemptor} reclaims bandwidth from less important
 * slices.
 *
 * Lifecycle per slice: {none} -> ACTIVE <-> SUSPENDED -> DELETING -> {gone}
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    /**
     * Result of trying to secure bandwidth.
     *
     * @param granted whether the bandwidth was reserved
     * @param shortfallMbps how much was missing when not granted
     * @param donors slices that gave up bandwidth, not yet announced
     */
    public record AllocationOutcome(boolean granted, double shortfallMbps, List<SliceId> donors) {
        static AllocationOutcome grantedDirectly() {
            return new AllocationOutcome(true, 0.0, List.of());
        }

        static AllocationOutcome refused(double shortfallMbps) {
            return new AllocationOutcome(false, shortfallMbps, List.of());
        }
    }

    private final SliceRegistry registry;
    private final SliceCatalog catalog;
    private final ResourcePool pool;
    private final ResourceProfileTable profiles;
    private final Preemptor preemptor;
    private final SlicingPolicy policy;
    private final EventBus eventBus;

    private long slicesCreated;
    private long slicesDeleted;
    private long admissionsRejected;

    public AdmissionController(SliceRegistry registry, SliceCatalog catalog, ResourcePool pool,
                               ResourceProfileTable profiles, Preemptor preemptor,
                               SlicingPolicy policy, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry);
        this.catalog = Objects.requireNonNull(catalog);
        this.pool = Objects.requireNonNull(pool);
        this.profiles = Objects.requireNonNull(profiles);
        this.preemptor = Objects.requireNonNull(preemptor);
        this.policy = Objects.requireNonNull(policy);
        this.eventBus = Objects.requireNonNull(eventBus);
    }

    // ========================================================================
    // Create / Modify / Delete
    // ========================================================================

    /**
     * Admit a new slice.
     *
     * @return the id of the new ACTIVE slice
     * @throws SlicingException CATALOG_FULL, UNKNOWN_SLICE_TYPE or INSUFFICIENT_RESOURCES
     */
    public SliceId create(SliceType type, SliceRequirements requirements) {
        Objects.requireNonNull(requirements, "Requirements cannot be null");
        if (registry.size() >= policy.getMaxSlices()) {
            admissionsRejected++;
            throw new SlicingException(SlicingException.Type.CATALOG_FULL,
                "Maximum number of slices reached: " + policy.getMaxSlices());
        }
        SliceTypeTemplate template = catalog.lookup(type);
        SliceRequirements resolved = requirements.resolveAgainst(template);

        AllocationOutcome outcome = allocateFor(resolved.bandwidthMbps(), resolved.priority());
        if (!outcome.granted()) {
            admissionsRejected++;
            log.warn("Rejected {} slice: {} Mbps requested, {} Mbps short",
                type, resolved.bandwidthMbps(), outcome.shortfallMbps());
            throw new SlicingException(SlicingException.Type.INSUFFICIENT_RESOURCES,
                String.format("Cannot allocate %.2f Mbps for %s slice, short by %.2f Mbps",
                    resolved.bandwidthMbps(), type, outcome.shortfallMbps()),
                null, outcome.shortfallMbps());
        }

        AllocatedResources resources = profiles.derive(type, resolved.bandwidthMbps());
        NetworkSlice slice = registry.register(type, resolved, resources);
        slicesCreated++;

        log.info("Created {} of type {} with {} Mbps at {}",
            slice.getId(), type, resources.getBandwidthMbps(), resolved.priority());
        preemptor.announce(outcome.donors());
        publish(new Event.ResourceAllocationEvent(now(), slice.getId(), resources.getBandwidthMbps()));
        publish(new Event.SliceCreatedEvent(now(), slice.getId(), type));
        return slice.getId();
    }

    /**
     * Replace the requirements of an ACTIVE slice. Unset fields keep their current values.
     *
     * @return false if the extra bandwidth could not be secured; the slice is then unchanged
     * @throws SlicingException SLICE_NOT_FOUND, or INVALID_STATE if the slice is not ACTIVE
     */
    public boolean modify(SliceId id, SliceRequirements newRequirements) {
        Objects.requireNonNull(newRequirements, "Requirements cannot be null");
        NetworkSlice slice = registry.require(id);
        requireState(slice, SliceState.ACTIVE, "modify");

        SliceTypeTemplate template = catalog.lookup(slice.getType());
        SliceRequirements resolved = newRequirements.overlay(slice.getRequirements(), template);
        double delta = resolved.bandwidthMbps() - slice.getAllocatedBandwidth();

        List<SliceId> donors = List.of();
        if (delta > ResourcePool.EPSILON) {
            AllocationOutcome outcome = allocateFor(delta, slice.getPriority());
            if (!outcome.granted()) {
                log.warn("Cannot modify {}: needs {} Mbps more, {} Mbps short",
                    id, delta, outcome.shortfallMbps());
                return false;
            }
            donors = outcome.donors();
        } else if (delta < -ResourcePool.EPSILON) {
            pool.release(-delta);
        }

        slice.setRequirements(resolved);
        slice.applyAllocation(profiles.derive(slice.getType(), resolved.bandwidthMbps()));

        log.info("Modified {}: bandwidth now {} Mbps", id, resolved.bandwidthMbps());
        preemptor.announce(donors);
        if (delta > ResourcePool.EPSILON) {
            publish(new Event.ResourceAllocationEvent(now(), id, slice.getAllocatedBandwidth()));
        }
        publish(new Event.SliceModifiedEvent(now(), id, "requirements changed"));
        return true;
    }

    /**
     * Release a slice's bandwidth and remove it with its metrics.
     *
     * @throws SlicingException SLICE_NOT_FOUND, including on a repeated delete
     */
    public void delete(SliceId id) {
        NetworkSlice slice = registry.require(id);
        boolean holdsBandwidth = slice.isActive();
        slice.setState(SliceState.DELETING);
        double freed = holdsBandwidth ? slice.getAllocatedBandwidth() : 0.0;
        if (holdsBandwidth) {
            pool.release(freed);
        }
        registry.remove(id);
        slicesDeleted++;

        log.info("Deleted {}, freed {} Mbps", id, freed);
        publish(new Event.SliceDeletedEvent(now(), id));
    }

    // ========================================================================
    // Suspend / Resume
    // ========================================================================

    /**
     * Return an ACTIVE slice's bandwidth to the pool while keeping its contract.
     */
    public void suspend(SliceId id) {
        NetworkSlice slice = registry.require(id);
        requireState(slice, SliceState.ACTIVE, "suspend");
        double freed = slice.getAllocatedBandwidth();
        pool.release(freed);
        slice.applyAllocation(AllocatedResources.none());
        slice.setState(SliceState.SUSPENDED);

        log.info("Suspended {}, freed {} Mbps", id, freed);
        publish(new Event.SliceModifiedEvent(now(), id, "suspended"));
    }

    /**
     * Re-admit a SUSPENDED slice at its contracted bandwidth.
     *
     * @return false if the bandwidth could not be secured; the slice stays SUSPENDED
     */
    public boolean resume(SliceId id) {
        NetworkSlice slice = registry.require(id);
        requireState(slice, SliceState.SUSPENDED, "resume");
        double bandwidth = slice.getRequirements().bandwidthMbps();

        AllocationOutcome outcome = allocateFor(bandwidth, slice.getPriority());
        if (!outcome.granted()) {
            log.warn("Cannot resume {}: {} Mbps short", id, outcome.shortfallMbps());
            return false;
        }
        slice.applyAllocation(profiles.derive(slice.getType(), bandwidth));
        slice.setState(SliceState.ACTIVE);

        log.info("Resumed {} with {} Mbps", id, bandwidth);
        preemptor.announce(outcome.donors());
        publish(new Event.ResourceAllocationEvent(now(), id, bandwidth));
        publish(new Event.SliceModifiedEvent(now(), id, "resumed"));
        return true;
    }

    // ========================================================================
    // Allocation
    // ========================================================================

    /**
     * Reserve {@code amount} Mbps, preempting less important slices when needed.
     *
     * Preemption aims for the full amount plus any overcommit left by a pool shrink,
     * and succeeds as long as it covers the part the pool cannot supply. Donors of a
     * granted outcome are announced by the caller after it has applied its change.
     */
    public AllocationOutcome allocateFor(double amount, SlicePriority priority) {
        if (pool.reserve(amount)) {
            return AllocationOutcome.grantedDirectly();
        }
        double deficit = amount - pool.getAvailableBandwidth() + pool.getOvercommit();
        if (!policy.isDynamicAllocation()) {
            return AllocationOutcome.refused(deficit);
        }

        double target = amount + pool.getOvercommit();
        ReclamationTransaction txn = preemptor.prepare(target, deficit, priority);
        if (txn.getState() != ReclamationTransaction.TransactionState.STARTED) {
            return AllocationOutcome.refused(deficit - txn.getReclaimedMbps());
        }

        double availableAfter = Math.max(0.0,
            pool.getTotalBandwidth() - (pool.getAllocatedBandwidth() - txn.getReclaimedMbps()));
        if (amount > availableAfter + ResourcePool.EPSILON) {
            preemptor.abort(txn);
            return AllocationOutcome.refused(amount - availableAfter);
        }

        List<SliceId> donors = preemptor.commit(txn);
        if (!pool.reserve(amount)) {
            throw new IllegalStateException(String.format(
                "Reservation of %.2f Mbps failed after reclaiming %.2f Mbps", amount, txn.getReclaimedMbps()));
        }
        return new AllocationOutcome(true, 0.0, donors);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void requireState(NetworkSlice slice, SliceState expected, String operation) {
        if (slice.getState() != expected) {
            throw new SlicingException(SlicingException.Type.INVALID_STATE,
                String.format("Cannot %s %s in state %s", operation, slice.getId(), slice.getState()),
                slice.getId());
        }
    }

    private void publish(Event event) {
        eventBus.publish(event);
    }

    private Instant now() {
        return eventBus.clock().instant();
    }

    public long getSlicesCreated() { return slicesCreated; }
    public long getSlicesDeleted() { return slicesDeleted; }
    public long getAdmissionsRejected() { return admissionsRejected; }
}
