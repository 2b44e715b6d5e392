package org.oran.slicing.model;

import java.util.Objects;

/**
 * Default QoS floors for one slice type.
 *
 * @param type the slice type this template describes
 * @param minBandwidthMbps bandwidth a slice keeps even under preemption
 * @param maxLatencyMs default latency contract
 * @param minReliability default reliability contract (0 to 1)
 * @param defaultPriority priority used when the caller does not give one
 */
public record SliceTypeTemplate(
        SliceType type,
        double minBandwidthMbps,
        double maxLatencyMs,
        double minReliability,
        SlicePriority defaultPriority
) {

    public SliceTypeTemplate {
        Objects.requireNonNull(type, "Template type cannot be null");
        Objects.requireNonNull(defaultPriority, "Template priority cannot be null");
        if (minBandwidthMbps < 0) {
            throw new IllegalArgumentException("Minimum bandwidth cannot be negative: " + minBandwidthMbps);
        }
        if (maxLatencyMs <= 0) {
            throw new IllegalArgumentException("Maximum latency must be positive: " + maxLatencyMs);
        }
        if (minReliability < 0 || minReliability > 1) {
            throw new IllegalArgumentException("Reliability must be within [0, 1]: " + minReliability);
        }
    }
}
