package org.oran.slicing.mechanism;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oran.slicing.model.*;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMonitorTest {

    private SliceRegistry registry;
    private ResourcePool pool;
    private LedgerMonitor monitor;

    @BeforeEach
    void setUp() {
        SliceCatalog catalog = SliceCatalog.builder()
            .template(SliceType.EMBB, 50, 10, 0.99, 2)
            .build();
        registry = new SliceRegistry();
        pool = new ResourcePool(200);
        monitor = new LedgerMonitor(registry, catalog, pool);
    }

    private NetworkSlice admit(double bandwidth) {
        pool.reserve(bandwidth);
        return registry.register(SliceType.EMBB,
            new SliceRequirements(bandwidth, 10, 0.99, SlicePriority.of(2)),
            new AllocatedResources(bandwidth, 0, 0, 0));
    }

    @Test
    void shouldPassConsistentLedger() {
        admit(60);
        admit(70);

        LedgerMonitor.LedgerCheckResult result = monitor.verify();

        assertTrue(result.isSafe(), result.toString());
    }

    @Test
    void shouldIgnoreSuspendedSlicesForConservation() {
        NetworkSlice slice = admit(60);
        pool.release(60);
        slice.setState(SliceState.SUSPENDED);
        slice.applyAllocation(AllocatedResources.none());

        assertTrue(monitor.verify().isSafe());
    }

    @Test
    void shouldDetectConservationBreach() {
        admit(60);
        pool.reserve(15);

        LedgerMonitor.LedgerCheckResult result = monitor.verify();

        assertFalse(result.isSafe());
        assertTrue(result.getViolations().get(0).startsWith("Conservation violated"));
    }

    @Test
    void shouldDetectSliceBelowFloor() {
        NetworkSlice slice = admit(60);
        slice.setAllocatedBandwidth(40);
        pool.release(20);

        LedgerMonitor.LedgerCheckResult result = monitor.verify();

        assertEquals(1, result.getViolations().size());
        assertTrue(result.getViolations().get(0).contains("below eMBB floor"));
    }

    @Test
    void shouldRepairLedgerInLenientMode() {
        admit(60);
        pool.reserve(15);

        monitor.enforce("test");

        assertEquals(60, pool.getAllocatedBandwidth(), 1e-9);
        assertEquals(1, monitor.getRepairs());
        assertTrue(monitor.verify().isSafe());
    }

    @Test
    void shouldThrowInStrictMode() {
        admit(60);
        pool.reserve(15);
        monitor.setStrictMode(true);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> monitor.enforce("create"));
        assertTrue(e.getMessage().contains("after create"));
        assertEquals(75, pool.getAllocatedBandwidth(), 1e-9);
    }
}
