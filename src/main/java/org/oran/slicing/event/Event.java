package org.oran.slicing.event;

import org.oran.slicing.model.SliceId;
import org.oran.slicing.model.SliceType;

import java.time.Instant;

/**
 * Base interface for all slicing engine events.
 * Events are published after the state change they describe has been committed.
 */
public sealed interface Event permits
        Event.SliceCreatedEvent,
        Event.SliceModifiedEvent,
        Event.SliceDeletedEvent,
        Event.ResourceAllocationEvent,
        Event.LatencyViolationEvent,
        Event.ReliabilityViolationEvent,
        Event.PoolResizedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Lifecycle Events
    // ========================================================================

    /**
     * A slice was admitted.
     */
    record SliceCreatedEvent(
            Instant timestamp,
            SliceId sliceId,
            SliceType sliceType
    ) implements Event {
        public String eventType() { return "SLICE_CREATED"; }
    }

    /**
     * A slice's requirements or allocation changed.
     */
    record SliceModifiedEvent(
            Instant timestamp,
            SliceId sliceId,
            String reason
    ) implements Event {
        public String eventType() { return "SLICE_MODIFIED"; }
    }

    /**
     * A slice was removed and its bandwidth returned to the pool.
     */
    record SliceDeletedEvent(
            Instant timestamp,
            SliceId sliceId
    ) implements Event {
        public String eventType() { return "SLICE_DELETED"; }
    }

    /**
     * Bandwidth was granted to a slice; amount is its allocation after the grant.
     */
    record ResourceAllocationEvent(
            Instant timestamp,
            SliceId sliceId,
            double amountMbps
    ) implements Event {
        public String eventType() { return "RESOURCE_ALLOCATION"; }
    }

    // ========================================================================
    // QoS Events
    // ========================================================================

    /**
     * Measured latency exceeded the slice's contract.
     */
    record LatencyViolationEvent(
            Instant timestamp,
            SliceId sliceId,
            double measuredMs,
            double requiredMs
    ) implements Event {
        public String eventType() { return "LATENCY_VIOLATION"; }
    }

    /**
     * Measured reliability fell below the slice's contract.
     */
    record ReliabilityViolationEvent(
            Instant timestamp,
            SliceId sliceId,
            double measured,
            double required
    ) implements Event {
        public String eventType() { return "RELIABILITY_VIOLATION"; }
    }

    // ========================================================================
    // Pool Events
    // ========================================================================

    /**
     * The pool total was changed; shortfall is allocated bandwidth beyond the new total.
     */
    record PoolResizedEvent(
            Instant timestamp,
            double totalMbps,
            double availableMbps,
            double shortfallMbps
    ) implements Event {
        public String eventType() { return "POOL_RESIZED"; }
    }
}
