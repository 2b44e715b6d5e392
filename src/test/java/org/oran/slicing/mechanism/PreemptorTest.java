package org.oran.slicing.mechanism;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oran.slicing.event.Event;
import org.oran.slicing.event.EventBus;
import org.oran.slicing.model.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreemptorTest {

    private static final double DELTA = 1e-9;

    private SliceRegistry registry;
    private ResourcePool pool;
    private EventBus bus;
    private Preemptor preemptor;

    @BeforeEach
    void setUp() {
        SliceCatalog catalog = SliceCatalog.builder()
            .template(SliceType.URLLC, 10, 1, 0.99999, 1)
            .template(SliceType.EMBB, 50, 10, 0.99, 2)
            .template(SliceType.MMTC, 1, 100, 0.95, 3)
            .build();
        registry = new SliceRegistry();
        pool = new ResourcePool(100);
        bus = new EventBus();
        preemptor = new Preemptor(registry, catalog, pool, bus);
    }

    private NetworkSlice admit(SliceType type, double bandwidth, int priority) {
        assertTrue(pool.reserve(bandwidth));
        return registry.register(type,
            new SliceRequirements(bandwidth, 10, 0.99, SlicePriority.of(priority)),
            new AllocatedResources(bandwidth, 0, 0, 0));
    }

    @Test
    void shouldReclaimFromLeastImportantFirst() {
        NetworkSlice embb = admit(SliceType.EMBB, 70, 2);
        NetworkSlice mmtc = admit(SliceType.MMTC, 30, 3);

        ReclamationTransaction txn = preemptor.prepare(40, SlicePriority.of(1));

        assertEquals(ReclamationTransaction.TransactionState.STARTED, txn.getState());
        assertEquals(List.of(mmtc.getId(), embb.getId()), txn.getDonors());
        assertEquals(1, mmtc.getAllocatedBandwidth(), DELTA);
        assertEquals(59, embb.getAllocatedBandwidth(), DELTA);
    }

    @Test
    void shouldBreakPriorityTiesByAscendingId() {
        NetworkSlice first = admit(SliceType.MMTC, 20, 3);
        NetworkSlice second = admit(SliceType.MMTC, 20, 3);

        ReclamationTransaction txn = preemptor.prepare(10, SlicePriority.of(1));

        assertEquals(List.of(first.getId()), txn.getDonors());
        assertEquals(10, first.getAllocatedBandwidth(), DELTA);
        assertEquals(20, second.getAllocatedBandwidth(), DELTA);
    }

    @Test
    void shouldNeverTakeFromEqualOrMoreImportantSlices() {
        admit(SliceType.URLLC, 40, 1);
        admit(SliceType.EMBB, 60, 2);

        ReclamationTransaction txn = preemptor.prepare(5, SlicePriority.of(2));

        assertEquals(ReclamationTransaction.TransactionState.ROLLED_BACK, txn.getState());
        assertTrue(txn.getDonors().isEmpty());
        assertEquals(1, preemptor.getFailedCount());
    }

    @Test
    void shouldRollBackEveryDonorWhenShort() {
        NetworkSlice embb = admit(SliceType.EMBB, 60, 2);
        NetworkSlice mmtc = admit(SliceType.MMTC, 11, 3);

        ReclamationTransaction txn = preemptor.prepare(50, SlicePriority.of(1));

        assertEquals(ReclamationTransaction.TransactionState.ROLLED_BACK, txn.getState());
        assertEquals(20, txn.getReclaimedMbps(), DELTA);
        assertEquals(60, embb.getAllocatedBandwidth(), DELTA);
        assertEquals(11, mmtc.getAllocatedBandwidth(), DELTA);
        assertEquals(71, pool.getAllocatedBandwidth(), DELTA);
        assertTrue(bus.getHistory().isEmpty());
    }

    @Test
    void shouldSkipSuspendedSlices() {
        NetworkSlice mmtc = admit(SliceType.MMTC, 30, 3);
        mmtc.setState(SliceState.SUSPENDED);

        assertTrue(preemptor.candidates(SlicePriority.of(1)).isEmpty());
    }

    @Test
    void shouldReleaseToPoolOnCommitWithoutAnnouncing() {
        NetworkSlice embb = admit(SliceType.EMBB, 80, 2);

        ReclamationTransaction txn = preemptor.prepare(30, SlicePriority.of(1));
        List<SliceId> donors = preemptor.commit(txn);

        assertEquals(ReclamationTransaction.TransactionState.COMMITTED, txn.getState());
        assertEquals(List.of(embb.getId()), donors);
        assertEquals(50, embb.getAllocatedBandwidth(), DELTA);
        assertEquals(50, pool.getAvailableBandwidth(), DELTA);
        assertTrue(bus.getHistory().isEmpty());
        assertEquals(1, preemptor.getCommittedCount());
    }

    @Test
    void shouldAnnounceEachDonorAsPreempted() {
        NetworkSlice embb = admit(SliceType.EMBB, 70, 2);
        NetworkSlice mmtc = admit(SliceType.MMTC, 30, 3);

        preemptor.announce(preemptor.commit(preemptor.prepare(40, SlicePriority.of(1))));

        List<Event.SliceModifiedEvent> modified = bus.getHistory(Event.SliceModifiedEvent.class);
        assertEquals(2, modified.size());
        assertEquals(mmtc.getId(), modified.get(0).sliceId());
        assertEquals(embb.getId(), modified.get(1).sliceId());
        assertEquals("preempted", modified.get(0).reason());
    }

    @Test
    void shouldRestoreDonorsOnAbort() {
        NetworkSlice embb = admit(SliceType.EMBB, 80, 2);

        ReclamationTransaction txn = preemptor.prepare(30, SlicePriority.of(1));
        preemptor.abort(txn);

        assertEquals(ReclamationTransaction.TransactionState.ROLLED_BACK, txn.getState());
        assertEquals(80, embb.getAllocatedBandwidth(), DELTA);
        assertEquals(80, pool.getAllocatedBandwidth(), DELTA);
        assertThrows(IllegalStateException.class, () -> preemptor.commit(txn));
    }
}
