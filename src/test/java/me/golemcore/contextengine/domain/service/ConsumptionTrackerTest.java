package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.port.outbound.StoreUnavailableException;
import me.golemcore.contextengine.testsupport.MutableClock;
import me.golemcore.contextengine.testsupport.WorkspaceStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsumptionTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private WorkspaceStoreFixture fixture;
    private ConsumptionTracker tracker;

    @BeforeEach
    void setUp() {
        fixture = WorkspaceStoreFixture.create(tempDir);
        tracker = new ConsumptionTracker(fixture.store(), new MutableClock(NOW));
    }

    @Test
    void shouldRecordDeliveryOnce() {
        assertTrue(tracker.record("S1", "G1", AgentRole.DEVELOPER, 1, "p1"));
        assertFalse(tracker.record("S1", "G1", AgentRole.DEVELOPER, 1, "p1"));

        List<ConsumptionRecord> rows = tracker.deliveries("S1");
        assertEquals(1, rows.size());
        assertEquals(NOW, rows.get(0).getConsumedAt());
    }

    @Test
    void shouldTreatNewIterationAsNewDelivery() {
        tracker.record("S1", "G1", AgentRole.DEVELOPER, 1, "p1");

        assertTrue(tracker.record("S1", "G1", AgentRole.DEVELOPER, 2, "p1"));
        assertTrue(tracker.record("S1", "G1", AgentRole.QA_EXPERT, 2, "p1"));

        assertEquals(3, tracker.deliveries("S1").size());
    }

    @Test
    void shouldCountOnlyNewRowsInBatch() {
        tracker.record("S1", null, AgentRole.DEVELOPER, 1, "p1");

        int inserted = tracker.recordAll("S1", null, AgentRole.DEVELOPER, 1, List.of("p1", "p2", "p3", "p2"));

        assertEquals(2, inserted);
        assertEquals(0, tracker.recordAll("S1", null, AgentRole.DEVELOPER, 1, List.of()));
    }

    @Test
    void shouldStoreSingleRowForConcurrentDuplicates() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return tracker.record("S1", "G1", AgentRole.TECH_LEAD, 3, "p9");
                }));
            }
            start.countDown();
            int inserted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    inserted++;
                }
            }
            assertEquals(1, inserted);
            assertEquals(1, tracker.deliveries("S1").size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldNotThrowWhenStoreFails() {
        ContextStorePort broken = mock(ContextStorePort.class);
        when(broken.insertConsumptionIfAbsent(any())).thenThrow(new StoreUnavailableException("down"));
        ConsumptionTracker degraded = new ConsumptionTracker(broken, new MutableClock(NOW));

        assertFalse(degraded.record("S1", "G1", AgentRole.DEVELOPER, 1, "p1"));
    }
}
