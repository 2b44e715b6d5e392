package org.oran.slicing.engine;

/**
 * Counters accumulated by one engine since it was created.
 */
public record SlicingStatistics(
        long slicesCreated,
        long slicesDeleted,
        long admissionsRejected,
        long preemptionsCommitted,
        long preemptionsFailed,
        long metricUpdates,
        long unknownMetricTargets,
        long violationsRaised,
        long remediationsApplied,
        long remediationsSkipped,
        long ledgerRepairs
) {

    @Override
    public String toString() {
        return String.format(
            "SlicingStatistics[created=%d, deleted=%d, rejected=%d, preemptions=%d/%d, "
                + "updates=%d, unknownTargets=%d, violations=%d, remediations=%d/%d, repairs=%d]",
            slicesCreated, slicesDeleted, admissionsRejected,
            preemptionsCommitted, preemptionsCommitted + preemptionsFailed,
            metricUpdates, unknownMetricTargets, violationsRaised,
            remediationsApplied, remediationsApplied + remediationsSkipped, ledgerRepairs);
    }
}
