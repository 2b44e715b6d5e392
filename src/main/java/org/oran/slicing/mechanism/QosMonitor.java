package org.oran.slicing.mechanism;

import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Ingests measured slice metrics and raises violation events.
 *
 * For every update of an ACTIVE slice:
 * - latency above the contracted latency raises a LatencyViolationEvent
 * - reliability below the contracted reliability raises a ReliabilityViolationEvent
 *
 * Both checks are independent. The monitor also keeps a per-slice SLA compliance
 * ratio: the share of updates that raised no violation.
 */
public class QosMonitor {

    private static final Logger log = LoggerFactory.getLogger(QosMonitor.class);

    public enum ViolationType {
        LATENCY,
        RELIABILITY
    }

    /**
     * Running SLA compliance of one slice.
     */
    public static class ComplianceRecord {
        private long updates;
        private long compliantUpdates;

        void record(boolean compliant) {
            updates++;
            if (compliant) compliantUpdates++;
        }

        public long getUpdates() { return updates; }
        public long getCompliantUpdates() { return compliantUpdates; }

        /**
         * Compliance ratio, 1.0 while no update has been seen.
         */
        public double getRatio() {
            return updates == 0 ? 1.0 : (double) compliantUpdates / updates;
        }
    }

    private final SliceRegistry registry;
    private final SlicingPolicy policy;
    private final EventBus eventBus;
    private final Map<SliceId, ComplianceRecord> compliance;

    private long updatesProcessed;
    private long unknownTargets;
    private long violationsRaised;

    public QosMonitor(SliceRegistry registry, SlicingPolicy policy, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry);
        this.policy = Objects.requireNonNull(policy);
        this.eventBus = Objects.requireNonNull(eventBus);
        this.compliance = new HashMap<>();
        eventBus.subscribe(Event.SliceDeletedEvent.class, e -> compliance.remove(e.sliceId()));
    }

    // ========================================================================
    // Metric Ingestion
    // ========================================================================

    /**
     * Store new metrics for a slice and check them against its contract.
     *
     * An unknown slice id is reported in the log and otherwise ignored.
     *
     * @return the violations raised by this update
     */
    public Set<ViolationType> updateMetrics(SliceId id, SliceMetrics metrics) {
        Objects.requireNonNull(metrics, "Metrics cannot be null");
        if (!registry.storeMetrics(id, metrics)) {
            unknownTargets++;
            log.warn("{}: no slice {} to store metrics for",
                SlicingException.Type.METRICS_TARGET_NOT_FOUND, id);
            return EnumSet.noneOf(ViolationType.class);
        }
        updatesProcessed++;

        NetworkSlice slice = registry.require(id);
        if (!slice.isActive()) {
            log.debug("Stored metrics for {} slice {}, skipping QoS checks", slice.getState(), id);
            return EnumSet.noneOf(ViolationType.class);
        }

        Set<ViolationType> violations = check(slice.getRequirements(), metrics);
        compliance.computeIfAbsent(id, k -> new ComplianceRecord()).record(violations.isEmpty());
        violationsRaised += violations.size();

        SliceRequirements required = slice.getRequirements();
        if (violations.contains(ViolationType.LATENCY)) {
            log.warn("Slice {} latency {} ms exceeds requirement {} ms",
                id, metrics.latency(), required.latencyMs());
            eventBus.publish(new Event.LatencyViolationEvent(
                eventBus.clock().instant(), id, metrics.latency(), required.latencyMs()));
        }
        if (violations.contains(ViolationType.RELIABILITY)) {
            log.warn("Slice {} reliability {} below requirement {}",
                id, metrics.reliability(), required.reliability());
            eventBus.publish(new Event.ReliabilityViolationEvent(
                eventBus.clock().instant(), id, metrics.reliability(), required.reliability()));
        }
        return violations;
    }

    /**
     * Compare metrics against a contract without storing anything.
     */
    public static Set<ViolationType> check(SliceRequirements requirements, SliceMetrics metrics) {
        Set<ViolationType> violations = EnumSet.noneOf(ViolationType.class);
        if (metrics.latency() > requirements.latencyMs()) {
            violations.add(ViolationType.LATENCY);
        }
        if (metrics.reliability() < requirements.reliability()) {
            violations.add(ViolationType.RELIABILITY);
        }
        return violations;
    }

    // ========================================================================
    // SLA Compliance
    // ========================================================================

    public double complianceOf(SliceId id) {
        ComplianceRecord record = compliance.get(id);
        return record == null ? 1.0 : record.getRatio();
    }

    /**
     * Average compliance over slices that received at least one update.
     */
    public double averageCompliance() {
        return compliance.values().stream()
            .filter(r -> r.getUpdates() > 0)
            .mapToDouble(ComplianceRecord::getRatio)
            .average()
            .orElse(1.0);
    }

    /**
     * Slices whose compliance ratio is below the configured QoS threshold, ascending id.
     */
    public List<SliceId> nonCompliantSlices() {
        return compliance.entrySet().stream()
            .filter(e -> e.getValue().getRatio() < policy.getQosThreshold())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    public long getUpdatesProcessed() { return updatesProcessed; }
    public long getUnknownTargets() { return unknownTargets; }
    public long getViolationsRaised() { return violationsRaised; }
}
