package org.oran.slicing.model;

/**
 * QoS contract requested for a slice.
 *
 * A non-positive number or a null priority means "unset". Stored slices always hold
 * fully resolved requirements; see {@link #resolveAgainst(SliceTypeTemplate)} and
 * {@link #overlay(SliceRequirements, SliceTypeTemplate)}.
 */
public record SliceRequirements(
        double bandwidthMbps,
        double latencyMs,
        double reliability,
        SlicePriority priority
) {

    public static SliceRequirements unset() {
        return new SliceRequirements(0, 0, 0, null);
    }

    public static SliceRequirements ofBandwidth(double bandwidthMbps) {
        return new SliceRequirements(bandwidthMbps, 0, 0, null);
    }

    public SliceRequirements withBandwidth(double bandwidth) {
        return new SliceRequirements(bandwidth, latencyMs, reliability, priority);
    }

    public SliceRequirements withLatency(double latency) {
        return new SliceRequirements(bandwidthMbps, latency, reliability, priority);
    }

    public SliceRequirements withReliability(double value) {
        return new SliceRequirements(bandwidthMbps, latencyMs, value, priority);
    }

    /**
     * A non-positive level leaves the priority unset.
     */
    public SliceRequirements withPriority(int level) {
        SlicePriority value = level > 0 ? SlicePriority.of(level) : null;
        return new SliceRequirements(bandwidthMbps, latencyMs, reliability, value);
    }

    // ========================================================================
    // Resolution
    // ========================================================================

    /**
     * Fill every unset field from the template. Bandwidth below the template
     * floor is raised to the floor.
     */
    public SliceRequirements resolveAgainst(SliceTypeTemplate template) {
        double bw = bandwidthMbps > 0 ? bandwidthMbps : template.minBandwidthMbps();
        return new SliceRequirements(
            Math.max(bw, template.minBandwidthMbps()),
            latencyMs > 0 ? latencyMs : template.maxLatencyMs(),
            reliability > 0 ? reliability : template.minReliability(),
            priority != null ? priority : template.defaultPriority());
    }

    /**
     * Fill every unset field from {@code current}, used when a live slice is modified.
     */
    public SliceRequirements overlay(SliceRequirements current, SliceTypeTemplate template) {
        double bw = bandwidthMbps > 0 ? bandwidthMbps : current.bandwidthMbps();
        return new SliceRequirements(
            Math.max(bw, template.minBandwidthMbps()),
            latencyMs > 0 ? latencyMs : current.latencyMs(),
            reliability > 0 ? reliability : current.reliability(),
            priority != null ? priority : current.priority());
    }
}
