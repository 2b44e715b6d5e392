package org.oran.slicing.mechanism;

import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reclaims bandwidth from less important slices for a more important request.
 *
 * Algorithm:
 * 1. Candidates are ACTIVE slices whose priority is strictly lower than the requester's
 * 2. Candidates are scanned least important first (highest level), ties by ascending id
 * 3. From each, take min(allocation - type floor, still needed); stop once satisfied
 * 4. If the total is below the minimum the caller can live with, every donor is
 *    rolled back and nothing is committed
 *
 * A successful scan returns an open transaction. Nothing reaches the pool until
 * {@link #commit(ReclamationTransaction)}; {@link #abort(ReclamationTransaction)}
 * undoes the donor reductions. Donor changes are announced with
 * {@link #announce(List)} once the request they served has been applied.
 */
public class Preemptor {

    private static final Logger log = LoggerFactory.getLogger(Preemptor.class);

    /** Least important first, then ascending id. */
    static final Comparator<NetworkSlice> RECLAIM_ORDER =
        Comparator.comparing(NetworkSlice::getPriority, Comparator.reverseOrder())
            .thenComparing(NetworkSlice::getId);

    private final SliceRegistry registry;
    private final SliceCatalog catalog;
    private final ResourcePool pool;
    private final EventBus eventBus;
    private long txnCounter;
    private long committedCount;
    private long failedCount;

    public Preemptor(SliceRegistry registry, SliceCatalog catalog, ResourcePool pool, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry);
        this.catalog = Objects.requireNonNull(catalog);
        this.pool = Objects.requireNonNull(pool);
        this.eventBus = Objects.requireNonNull(eventBus);
    }

    /**
     * Slices that may give bandwidth to a requester, in reclaim order.
     */
    public List<NetworkSlice> candidates(SlicePriority requester) {
        List<NetworkSlice> eligible = registry.matching(
            s -> s.isActive() && s.getPriority().isPreemptibleBy(requester));
        eligible.sort(RECLAIM_ORDER);
        return eligible;
    }

    /**
     * Bandwidth a slice can give up without going below its type floor.
     */
    public double reclaimable(NetworkSlice slice) {
        if (!catalog.contains(slice.getType())) {
            return 0.0;
        }
        double floor = catalog.lookup(slice.getType()).minBandwidthMbps();
        return Math.max(0.0, slice.getAllocatedBandwidth() - floor);
    }

    /**
     * Scan candidates and reduce donors until {@code requiredMbps} is covered.
     *
     * @return a STARTED transaction if enough was found, otherwise a ROLLED_BACK one
     *         whose reclaimed amount is what could have been found
     */
    public ReclamationTransaction prepare(double requiredMbps, SlicePriority requester) {
        return prepare(requiredMbps, requiredMbps, requester);
    }

    /**
     * Scan candidates aiming for {@code requiredMbps}, accepting any total of at least
     * {@code minimumMbps}.
     */
    public ReclamationTransaction prepare(double requiredMbps, double minimumMbps, SlicePriority requester) {
        ReclamationTransaction txn = new ReclamationTransaction(
            String.format("RECLAIM-%06d", ++txnCounter), requiredMbps);

        for (NetworkSlice candidate : candidates(requester)) {
            double excess = reclaimable(candidate);
            if (excess <= ResourcePool.EPSILON) {
                continue;
            }
            double take = Math.min(excess, txn.getStillNeeded());
            txn.reclaim(candidate, take);
            log.debug("[{}] took {} Mbps from {} ({})", txn.getTxnId(), take,
                candidate.getId(), candidate.getPriority());
            if (txn.getStillNeeded() <= ResourcePool.EPSILON) {
                break;
            }
        }

        if (txn.getReclaimedMbps() < minimumMbps - ResourcePool.EPSILON) {
            log.warn("Could only reclaim {} Mbps of at least {} Mbps for requester {}, rolling back",
                txn.getReclaimedMbps(), minimumMbps, requester);
            txn.rollback();
            failedCount++;
        }
        return txn;
    }

    /**
     * Hand the reclaimed bandwidth to the pool.
     *
     * @return the donors, for {@link #announce(List)} once the caller's request is applied
     */
    public List<SliceId> commit(ReclamationTransaction txn) {
        txn.markCommitted();
        pool.release(txn.getReclaimedMbps());
        committedCount++;
        log.info("Reclaimed {} Mbps from {} slices {}", txn.getReclaimedMbps(),
            txn.getDonors().size(), txn.getDonors());
        return txn.getDonors();
    }

    /**
     * Publish a modification event for every donor of a committed reclamation.
     */
    public void announce(List<SliceId> donors) {
        for (SliceId donor : donors) {
            eventBus.publish(new Event.SliceModifiedEvent(
                eventBus.clock().instant(), donor, "preempted"));
        }
    }

    /**
     * Undo a prepared transaction that the caller decided not to use.
     */
    public void abort(ReclamationTransaction txn) {
        if (txn.getState() == ReclamationTransaction.TransactionState.STARTED) {
            txn.rollback();
            failedCount++;
        }
    }

    public long getCommittedCount() {
        return committedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }
}
