package org.oran.slicing.model;

/**
 * Lifecycle state of a slice: ACTIVE, optionally SUSPENDED, then DELETING before removal.
 */
public enum SliceState {
    /** Holds its bandwidth and counts toward the pool ledger. */
    ACTIVE,
    /** Kept in the registry with no bandwidth. */
    SUSPENDED,
    /** Being removed; allocation already released. */
    DELETING
}
