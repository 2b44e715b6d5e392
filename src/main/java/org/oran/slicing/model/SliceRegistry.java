package org.oran.slicing.model;

import java.time.Clock;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Registry of live slices and their metrics.
 *
 * The registry maintains:
 * - Slices by id, iterated in ascending id order
 * - The latest metrics per slice (exists exactly while the slice exists)
 * - The UE to slice association
 * - The id counter; ids start at 1 and are never reused
 *
 * Every lookup rejects a null id with a {@link NullPointerException}.
 */
public class SliceRegistry {

    private final Map<SliceId, NetworkSlice> slices;
    private final Map<SliceId, SliceMetrics> metrics;
    private final Map<Long, SliceId> ueIndex;
    private final Clock clock;
    private long nextId;

    public SliceRegistry() {
        this(Clock.systemUTC());
    }

    public SliceRegistry(Clock clock) {
        this.slices = new TreeMap<>();
        this.metrics = new HashMap<>();
        this.ueIndex = new HashMap<>();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.nextId = 1;
    }

    // ========================================================================
    // Registration
    // ========================================================================

    /**
     * Store a new ACTIVE slice under a fresh id with zeroed metrics.
     */
    public NetworkSlice register(SliceType type, SliceRequirements requirements,
                                 AllocatedResources allocation) {
        SliceId id = SliceId.of(nextId++);
        NetworkSlice slice = new NetworkSlice(id, type, requirements, allocation, clock.instant());
        slices.put(id, slice);
        metrics.put(id, SliceMetrics.ZERO);
        return slice;
    }

    /**
     * Remove a slice together with its metrics and UE associations.
     *
     * @return the removed slice, or empty if it did not exist
     */
    public Optional<NetworkSlice> remove(SliceId id) {
        NetworkSlice removed = slices.remove(checkId(id));
        if (removed == null) {
            return Optional.empty();
        }
        metrics.remove(id);
        for (Long ue : removed.getAssociatedUes()) {
            ueIndex.remove(ue);
        }
        return Optional.of(removed);
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    public Optional<NetworkSlice> find(SliceId id) {
        return Optional.ofNullable(slices.get(checkId(id)));
    }

    /**
     * @throws SlicingException of type SLICE_NOT_FOUND if absent
     */
    public NetworkSlice require(SliceId id) {
        NetworkSlice slice = slices.get(checkId(id));
        if (slice == null) {
            throw SlicingException.notFound(id);
        }
        return slice;
    }

    public boolean contains(SliceId id) {
        return slices.containsKey(checkId(id));
    }

    public int size() {
        return slices.size();
    }

    public Collection<NetworkSlice> all() {
        return Collections.unmodifiableCollection(slices.values());
    }

    public List<NetworkSlice> matching(Predicate<NetworkSlice> filter) {
        return slices.values().stream().filter(filter).collect(Collectors.toList());
    }

    public List<NetworkSlice> active() {
        return matching(NetworkSlice::isActive);
    }

    public List<SliceId> activeIds() {
        return active().stream().map(NetworkSlice::getId).toList();
    }

    /**
     * Sum of allocated bandwidth over ACTIVE slices.
     */
    public double activeBandwidth() {
        return active().stream().mapToDouble(NetworkSlice::getAllocatedBandwidth).sum();
    }

    // ========================================================================
    // Metrics
    // ========================================================================

    public Optional<SliceMetrics> metricsOf(SliceId id) {
        return Optional.ofNullable(metrics.get(checkId(id)));
    }

    /**
     * Overwrite the metrics of an existing slice.
     *
     * @return false if the slice does not exist
     */
    public boolean storeMetrics(SliceId id, SliceMetrics value) {
        if (!slices.containsKey(checkId(id))) {
            return false;
        }
        metrics.put(id, Objects.requireNonNull(value, "Metrics cannot be null"));
        return true;
    }

    public Map<SliceId, SliceMetrics> allMetrics() {
        return new TreeMap<>(metrics);
    }

    // ========================================================================
    // UE Association
    // ========================================================================

    /**
     * Associate a UE with a slice, detaching it from any previous slice.
     *
     * @return false if the UE was already associated with this slice
     */
    public boolean associateUe(SliceId id, long ueId) {
        NetworkSlice slice = require(id);
        SliceId previous = ueIndex.get(ueId);
        if (id.equals(previous)) {
            return false;
        }
        if (previous != null) {
            find(previous).ifPresent(s -> s.removeUe(ueId));
        }
        slice.addUe(ueId);
        ueIndex.put(ueId, id);
        return true;
    }

    public Optional<SliceId> sliceOfUe(long ueId) {
        return Optional.ofNullable(ueIndex.get(ueId));
    }

    private static SliceId checkId(SliceId id) {
        return Objects.requireNonNull(id, "Slice ID cannot be null");
    }

    @Override
    public String toString() {
        return String.format("SliceRegistry[%d slices, %d active, nextId=%d]",
            slices.size(), active().size(), nextId);
    }
}
