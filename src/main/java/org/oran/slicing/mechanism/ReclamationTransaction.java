package org.oran.slicing.mechanism;

import org.oran.slicing.model.NetworkSlice;
import org.oran.slicing.model.SliceId;

import java.util.*;

/**
 * Bandwidth taken from donor slices during one preemption attempt.
 *
 * Each donor's allocation is snapshotted the first time it is touched, so the
 * attempt either commits as a whole or is rolled back to the exact pre-attempt values.
 *
 * Lifecycle:
 * 1. STARTED: donors are reduced one by one
 * 2. COMMITTED: the engine accepted the reclaimed bandwidth
 * 3. ROLLED_BACK: every donor restored from its snapshot
 */
public class ReclamationTransaction {

    public enum TransactionState {
        STARTED,
        COMMITTED,
        ROLLED_BACK
    }

    private final String txnId;
    private final double requiredMbps;
    private final Map<NetworkSlice, Double> previousBandwidth;
    private double reclaimedMbps;
    private TransactionState state;

    ReclamationTransaction(String txnId, double requiredMbps) {
        this.txnId = txnId;
        this.requiredMbps = requiredMbps;
        this.previousBandwidth = new LinkedHashMap<>();
        this.reclaimedMbps = 0.0;
        this.state = TransactionState.STARTED;
    }

    public String getTxnId() { return txnId; }
    public double getRequiredMbps() { return requiredMbps; }
    public double getReclaimedMbps() { return reclaimedMbps; }
    public TransactionState getState() { return state; }

    public double getStillNeeded() {
        return Math.max(0.0, requiredMbps - reclaimedMbps);
    }

    /**
     * Donor slice ids in the order they were reduced.
     */
    public List<SliceId> getDonors() {
        return previousBandwidth.keySet().stream().map(NetworkSlice::getId).toList();
    }

    /**
     * Take {@code amount} from a donor's live allocation.
     */
    void reclaim(NetworkSlice donor, double amount) {
        requireState(TransactionState.STARTED);
        previousBandwidth.putIfAbsent(donor, donor.getAllocatedBandwidth());
        donor.setAllocatedBandwidth(donor.getAllocatedBandwidth() - amount);
        reclaimedMbps += amount;
    }

    void markCommitted() {
        requireState(TransactionState.STARTED);
        state = TransactionState.COMMITTED;
    }

    /**
     * Restore every touched donor to its snapshot.
     */
    void rollback() {
        requireState(TransactionState.STARTED);
        for (Map.Entry<NetworkSlice, Double> entry : previousBandwidth.entrySet()) {
            entry.getKey().setAllocatedBandwidth(entry.getValue());
        }
        state = TransactionState.ROLLED_BACK;
    }

    private void requireState(TransactionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                "Transaction " + txnId + " is " + state + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return String.format("TXN[%s] %s reclaimed=%.2f/%.2f Mbps from %d donors",
            txnId, state, reclaimedMbps, requiredMbps, previousBandwidth.size());
    }
}
