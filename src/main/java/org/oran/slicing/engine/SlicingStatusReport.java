package org.oran.slicing.engine;

import org.oran.slicing.model.SliceId;
import org.oran.slicing.model.SliceInfo;

import java.util.List;

/**
 * Point-in-time summary of the pool and every live slice.
 */
public record SlicingStatusReport(
        double totalBandwidthMbps,
        double availableBandwidthMbps,
        double allocatedBandwidthMbps,
        List<SliceInfo> slices,
        double averageCompliance,
        List<SliceId> nonCompliantSlices
) {

    private static final String SEP = "=".repeat(60);

    public SlicingStatusReport {
        slices = List.copyOf(slices);
        nonCompliantSlices = List.copyOf(nonCompliantSlices);
    }

    /**
     * Multi-line rendering for logs and the command line runner.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(SEP).append('\n');
        sb.append("Network Slicing Status\n");
        sb.append(SEP).append('\n');
        sb.append(String.format("Total Bandwidth:     %.2f Mbps%n", totalBandwidthMbps));
        sb.append(String.format("Available Bandwidth: %.2f Mbps%n", availableBandwidthMbps));
        sb.append(String.format("Allocated Bandwidth: %.2f Mbps%n", allocatedBandwidthMbps));
        sb.append(String.format("Slices:              %d%n", slices.size()));
        for (SliceInfo slice : slices) {
            sb.append(String.format("  %-10s %-10s %-9s bw=%8.2f Mbps compute=%4d %s ues=%d%n",
                slice.id(), slice.type(), slice.state(), slice.allocatedBandwidthMbps(),
                slice.computeUnits(), slice.priority(), slice.associatedUes().size()));
        }
        sb.append(String.format("Average SLA compliance: %.1f%%%n", averageCompliance * 100));
        if (!nonCompliantSlices.isEmpty()) {
            sb.append("Below QoS threshold: ").append(nonCompliantSlices).append('\n');
        }
        sb.append(SEP);
        return sb.toString();
    }
}
