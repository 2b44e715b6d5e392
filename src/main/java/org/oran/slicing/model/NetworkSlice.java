package org.oran.slicing.model;

import java.time.Instant;
import java.util.*;

/**
 * A live network slice.
 *
 * Instances are owned by {@link SliceRegistry}. Mutators are only called by the
 * admission, preemption and remediation mechanisms, which run under the engine's
 * write lock; everything else sees {@link SliceInfo} snapshots.
 */
public class NetworkSlice {

    private final SliceId id;
    private final SliceType type;
    private final Instant creationTime;
    private final AllocatedResources allocated;
    private final Set<Long> associatedUes;
    private SliceRequirements requirements;
    private SliceState state;

    public NetworkSlice(SliceId id, SliceType type, SliceRequirements requirements,
                        AllocatedResources allocated, Instant creationTime) {
        this.id = Objects.requireNonNull(id, "Slice ID cannot be null");
        this.type = Objects.requireNonNull(type, "Slice type cannot be null");
        this.requirements = Objects.requireNonNull(requirements, "Requirements cannot be null");
        this.allocated = Objects.requireNonNull(allocated, "Allocation cannot be null").copy();
        this.creationTime = Objects.requireNonNull(creationTime, "Creation time cannot be null");
        this.associatedUes = new LinkedHashSet<>();
        this.state = SliceState.ACTIVE;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public SliceId getId() { return id; }
    public SliceType getType() { return type; }
    public Instant getCreationTime() { return creationTime; }
    public SliceRequirements getRequirements() { return requirements; }
    public SliceState getState() { return state; }
    public SlicePriority getPriority() { return requirements.priority(); }

    public boolean isActive() {
        return state == SliceState.ACTIVE;
    }

    public double getAllocatedBandwidth() {
        return allocated.getBandwidthMbps();
    }

    public long getComputeUnits() {
        return allocated.getComputeUnits();
    }

    public AllocatedResources getAllocation() {
        return allocated.copy();
    }

    public Set<Long> getAssociatedUes() {
        return Collections.unmodifiableSet(associatedUes);
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    public void setState(SliceState state) {
        this.state = Objects.requireNonNull(state);
    }

    public void setRequirements(SliceRequirements requirements) {
        this.requirements = Objects.requireNonNull(requirements);
    }

    /**
     * Replace the whole allocation, e.g. after requirements changed.
     */
    public void applyAllocation(AllocatedResources resources) {
        allocated.replaceWith(resources);
    }

    public void setAllocatedBandwidth(double bandwidthMbps) {
        allocated.setBandwidthMbps(bandwidthMbps);
    }

    public void setComputeUnits(long computeUnits) {
        allocated.setComputeUnits(computeUnits);
    }

    boolean addUe(long ueId) {
        return associatedUes.add(ueId);
    }

    boolean removeUe(long ueId) {
        return associatedUes.remove(ueId);
    }

    public SliceInfo snapshot() {
        return new SliceInfo(id, type, state, requirements, allocated.copy(),
            creationTime, Set.copyOf(associatedUes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((NetworkSlice) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("NetworkSlice[%s, %s, %s, bw=%.2fMbps, %s]",
            id, type, state, allocated.getBandwidthMbps(), requirements.priority());
    }
}
