package org.oran.slicing.engine;

import org.junit.jupiter.api.Test;
import org.oran.slicing.config.SlicingConfig;
import org.oran.slicing.config.SlicingConfigLoader;
import org.oran.slicing.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SlicingEngineConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 200;

    @Test
    void shouldConserveBandwidthUnderConcurrentMutations() throws Exception {
        SlicingConfig config = new SlicingConfigLoader().loadDefaults();
        config.totalBandwidthMbps = 400;
        config.maxSlices = 64;
        config.strictInvariants = true;
        SlicingEngine engine = new SlicingEngine(config);
        SliceId anchor = engine.createSlice(SliceType.EMBB, SliceRequirements.ofBandwidth(150));

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger unexpected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int worker = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < ROUNDS; i++) {
                    SliceType type = (worker + i) % 3 == 0 ? SliceType.URLLC : SliceType.MMTC;
                    try {
                        SliceId id = engine.createSlice(type, SliceRequirements.ofBandwidth(10 + (i % 5) * 10));
                        engine.updateSliceMetrics(id, new SliceMetrics(10, 500, 0, 1.0));
                        engine.deleteSlice(id);
                    } catch (SlicingException e) {
                        if (e.getType() != SlicingException.Type.INSUFFICIENT_RESOURCES
                                && e.getType() != SlicingException.Type.CATALOG_FULL) {
                            unexpected.incrementAndGet();
                        }
                    }
                    double available = engine.getAvailableBandwidth();
                    if (available < 0 || available > engine.getTotalBandwidth()) {
                        unexpected.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(0, unexpected.get());
        assertEquals(List.of(anchor), engine.getActiveSlices());
        double anchorBandwidth = engine.getSliceInfo(anchor).orElseThrow().allocatedBandwidthMbps();
        assertTrue(anchorBandwidth >= 50 - 1e-9);
        assertEquals(anchorBandwidth, engine.getTotalAllocatedBandwidth(), 1e-6);
        assertEquals(400 - anchorBandwidth, engine.getAvailableBandwidth(), 1e-6);
        assertEquals(0, engine.statistics().ledgerRepairs());
    }
}
