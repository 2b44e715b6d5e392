package org.oran.slicing.model;

/**
 * Measured service metrics for one slice, replaced wholesale on every update.
 *
 * @param throughput measured throughput in Mbps
 * @param latency measured latency in ms
 * @param packetLoss packet loss ratio (0 to 1)
 * @param reliability measured reliability (0 to 1)
 */
public record SliceMetrics(double throughput, double latency, double packetLoss, double reliability) {

    public static final SliceMetrics ZERO = new SliceMetrics(0, 0, 0, 0);

    public SliceMetrics {
        if (throughput < 0 || latency < 0 || packetLoss < 0 || reliability < 0) {
            throw new IllegalArgumentException(String.format(
                "Metrics cannot be negative: throughput=%.3f, latency=%.3f, loss=%.3f, reliability=%.5f",
                throughput, latency, packetLoss, reliability));
        }
    }
}
