package org.oran.slicing.config;

import org.oran.slicing.event.EventBus;
import org.oran.slicing.mechanism.SlicingPolicy;
import org.oran.slicing.model.*;

import java.util.*;

/**
 * Engine configuration as read from YAML.
 *
 * Fields are public and mutable while a configuration is being assembled; the
 * {@code build*} methods turn it into the engine's runtime objects.
 */
public class SlicingConfig {

    public double totalBandwidthMbps = 1000.0;
    public int maxSlices = SlicingPolicy.DEFAULT_MAX_SLICES;
    public double referenceBandwidthMbps = 100.0;
    public boolean dynamicAllocation = true;
    public double qosThreshold = SlicingPolicy.DEFAULT_QOS_THRESHOLD;
    public boolean strictInvariants = false;
    public int eventHistoryLimit = EventBus.DEFAULT_HISTORY_LIMIT;
    public double latencyBandwidthBoost = SlicingPolicy.DEFAULT_LATENCY_BANDWIDTH_BOOST;
    public double reliabilityComputeBoost = SlicingPolicy.DEFAULT_RELIABILITY_COMPUTE_BOOST;
    public Map<SliceType, SliceTypeTemplate> templates = new EnumMap<>(SliceType.class);
    public Map<SliceType, ResourceProfile> profiles = new EnumMap<>(SliceType.class);

    /**
     * Deep copy, so overrides can be layered without touching the original.
     */
    public SlicingConfig copy() {
        SlicingConfig c = new SlicingConfig();
        c.totalBandwidthMbps = totalBandwidthMbps;
        c.maxSlices = maxSlices;
        c.referenceBandwidthMbps = referenceBandwidthMbps;
        c.dynamicAllocation = dynamicAllocation;
        c.qosThreshold = qosThreshold;
        c.strictInvariants = strictInvariants;
        c.eventHistoryLimit = eventHistoryLimit;
        c.latencyBandwidthBoost = latencyBandwidthBoost;
        c.reliabilityComputeBoost = reliabilityComputeBoost;
        c.templates = new EnumMap<>(SliceType.class);
        c.templates.putAll(templates);
        c.profiles = new EnumMap<>(SliceType.class);
        c.profiles.putAll(profiles);
        return c;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    public SliceCatalog buildCatalog() {
        return new SliceCatalog(templates.values());
    }

    public ResourceProfileTable buildProfiles() {
        return new ResourceProfileTable(profiles, referenceBandwidthMbps);
    }

    public SlicingPolicy buildPolicy() {
        return new SlicingPolicy()
            .setMaxSlices(maxSlices)
            .setDynamicAllocation(dynamicAllocation)
            .setQosThreshold(qosThreshold)
            .setLatencyBandwidthBoost(latencyBandwidthBoost)
            .setReliabilityComputeBoost(reliabilityComputeBoost);
    }

    @Override
    public String toString() {
        return String.format("SlicingConfig[total=%.1fMbps, maxSlices=%d, templates=%s, dynamic=%s]",
            totalBandwidthMbps, maxSlices, templates.keySet(), dynamicAllocation);
    }
}
