package org.oran.slicing.engine;

import org.oran.slicing.config.SlicingConfig;
import org.oran.slicing.config.SlicingConfigLoader;
import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.mechanism.*;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Network slicing engine: admission control, preemption, QoS monitoring and
 * remediation over one shared bandwidth pool.
 *
 * Each engine owns its pool, registry and catalog; several engines can live in one
 * process. All mutations run under a single write lock and are followed by a ledger
 * check. Queries take the read lock and return snapshots, so they see the state
 * before or after a mutation, never in between.
 *
 * Events are published synchronously on the mutating thread while the write lock is
 * held, in commit order.
 *
 * Usage:
 * <pre>
 * SlicingEngine engine = SlicingEngine.fromDefaults();
 * SliceId id = engine.createSlice(SliceType.URLLC, SliceRequirements.ofBandwidth(20));
 * engine.updateSliceMetrics(id, new SliceMetrics(18, 0.8, 0.0, 0.99999));
 * </pre>
 */
public class SlicingEngine {

    private static final Logger log = LoggerFactory.getLogger(SlicingEngine.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final ResourcePool pool;
    private final SliceRegistry registry;
    private final SliceCatalog catalog;
    private final SlicingPolicy policy;
    private final EventBus eventBus;
    private final Preemptor preemptor;
    private final AdmissionController admission;
    private final QosMonitor qosMonitor;
    private final RemediationEngine remediation;
    private final LedgerMonitor ledger;

    public SlicingEngine(SlicingConfig config) {
        this(config, Clock.systemUTC());
    }

    public SlicingEngine(SlicingConfig config, Clock clock) {
        Objects.requireNonNull(config, "Configuration cannot be null");
        this.pool = new ResourcePool(config.totalBandwidthMbps);
        this.registry = new SliceRegistry(clock);
        this.catalog = config.buildCatalog();
        this.policy = config.buildPolicy();
        this.eventBus = new EventBus(config.eventHistoryLimit, clock);
        this.preemptor = new Preemptor(registry, catalog, pool, eventBus);
        this.admission = new AdmissionController(registry, catalog, pool,
            config.buildProfiles(), preemptor, policy, eventBus);
        this.qosMonitor = new QosMonitor(registry, policy, eventBus);
        this.remediation = new RemediationEngine(registry, pool, policy, eventBus);
        this.remediation.attach();
        this.ledger = new LedgerMonitor(registry, catalog, pool).setStrictMode(config.strictInvariants);

        log.info("Slicing engine initialized: {} Mbps, {} templates, {}",
            config.totalBandwidthMbps, catalog.types().size(), policy);
    }

    /**
     * Engine built from the classpath defaults.
     */
    public static SlicingEngine fromDefaults() throws IOException {
        return new SlicingEngine(new SlicingConfigLoader().loadDefaults());
    }

    // ========================================================================
    // Slice Lifecycle
    // ========================================================================

    /**
     * @throws SlicingException CATALOG_FULL, UNKNOWN_SLICE_TYPE or INSUFFICIENT_RESOURCES
     */
    public SliceId createSlice(SliceType type, SliceRequirements requirements) {
        return write("create", () -> admission.create(type, requirements));
    }

    /**
     * @return false if the slice could not get the extra bandwidth; it is then unchanged
     * @throws SlicingException SLICE_NOT_FOUND or INVALID_STATE
     */
    public boolean modifySlice(SliceId id, SliceRequirements newRequirements) {
        return write("modify", () -> admission.modify(id, newRequirements));
    }

    /**
     * @throws SlicingException SLICE_NOT_FOUND, also on a second delete of the same id
     */
    public void deleteSlice(SliceId id) {
        write("delete", () -> {
            admission.delete(id);
            return null;
        });
    }

    public void suspendSlice(SliceId id) {
        write("suspend", () -> {
            admission.suspend(id);
            return null;
        });
    }

    public boolean resumeSlice(SliceId id) {
        return write("resume", () -> admission.resume(id));
    }

    public boolean associateUe(SliceId id, long ueId) {
        return write("associate", () -> registry.associateUe(id, ueId));
    }

    // ========================================================================
    // Metrics
    // ========================================================================

    /**
     * Store metrics, raise violations and run remediation for them.
     *
     * @return the violations detected; empty for an unknown slice
     */
    public Set<QosMonitor.ViolationType> updateSliceMetrics(SliceId id, SliceMetrics metrics) {
        return write("metrics", () -> qosMonitor.updateMetrics(id, metrics));
    }

    /**
     * @return the latest metrics, or {@link SliceMetrics#ZERO} for an unknown slice
     */
    public SliceMetrics getSliceMetrics(SliceId id) {
        return read(() -> registry.metricsOf(id).orElse(SliceMetrics.ZERO));
    }

    public Map<SliceId, SliceMetrics> getAllSliceMetrics() {
        return read(registry::allMetrics);
    }

    public double getSlaCompliance(SliceId id) {
        return read(() -> qosMonitor.complianceOf(id));
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Ids of ACTIVE slices in ascending order.
     */
    public List<SliceId> getActiveSlices() {
        return read(registry::activeIds);
    }

    public Optional<SliceInfo> getSliceInfo(SliceId id) {
        return read(() -> registry.find(id).map(NetworkSlice::snapshot));
    }

    public int getSliceCount() {
        return read(registry::size);
    }

    public double getAvailableBandwidth() {
        return read(pool::getAvailableBandwidth);
    }

    public double getTotalAllocatedBandwidth() {
        return read(pool::getAllocatedBandwidth);
    }

    public double getTotalBandwidth() {
        return read(pool::getTotalBandwidth);
    }

    public boolean isDynamicAllocationEnabled() {
        return read(policy::isDynamicAllocation);
    }

    // ========================================================================
    // Administration
    // ========================================================================

    /**
     * Change the pool size. Slices are never shrunk by this call; if they no longer fit,
     * available drops to 0 and the shortfall is returned.
     */
    public double setTotalBandwidth(double newTotal) {
        return write("resize", () -> {
            double shortfall = pool.resize(newTotal);
            eventBus.publish(new Event.PoolResizedEvent(eventBus.clock().instant(),
                newTotal, pool.getAvailableBandwidth(), shortfall));
            return shortfall;
        });
    }

    public void enableDynamicAllocation(boolean enabled) {
        write("policy", () -> {
            policy.setDynamicAllocation(enabled);
            log.info("Dynamic allocation {}", enabled ? "enabled" : "disabled");
            return null;
        });
    }

    public void setMaxSlices(int maxSlices) {
        write("policy", () -> {
            policy.setMaxSlices(maxSlices);
            return null;
        });
    }

    /**
     * Replace the slice-type templates. Live slices keep their resolved requirements.
     */
    public void reloadCatalog(Collection<SliceTypeTemplate> templates) {
        write("reload", () -> {
            catalog.reload(templates);
            log.info("Reloaded slice catalog: {}", catalog);
            return null;
        });
    }

    /**
     * Event bus for subscribing to slice events.
     */
    public EventBus events() {
        return eventBus;
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public SlicingStatusReport statusReport() {
        return read(() -> new SlicingStatusReport(
            pool.getTotalBandwidth(),
            pool.getAvailableBandwidth(),
            pool.getAllocatedBandwidth(),
            registry.all().stream().map(NetworkSlice::snapshot).toList(),
            qosMonitor.averageCompliance(),
            qosMonitor.nonCompliantSlices()));
    }

    public void logStatus() {
        log.info("\n{}", statusReport().format());
    }

    public SlicingStatistics statistics() {
        return read(() -> new SlicingStatistics(
            admission.getSlicesCreated(),
            admission.getSlicesDeleted(),
            admission.getAdmissionsRejected(),
            preemptor.getCommittedCount(),
            preemptor.getFailedCount(),
            qosMonitor.getUpdatesProcessed(),
            qosMonitor.getUnknownTargets(),
            qosMonitor.getViolationsRaised(),
            remediation.getApplied(),
            remediation.getSkipped(),
            ledger.getRepairs()));
    }

    // ========================================================================
    // Locking
    // ========================================================================

    private <T> T write(String operation, Supplier<T> action) {
        lock.writeLock().lock();
        try {
            T result = action.get();
            ledger.enforce(operation);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("SlicingEngine[%s, %s]", pool, registry);
    }
}
