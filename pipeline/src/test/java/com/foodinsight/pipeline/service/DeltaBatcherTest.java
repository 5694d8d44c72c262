package com.foodinsight.pipeline.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import com.foodinsight.pipeline.model.EventType;
import com.foodinsight.pipeline.model.InventoryDelta;
import com.foodinsight.pipeline.model.InventoryEvent;

class DeltaBatcherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final DeltaBatcher batcher =
        new DeltaBatcher("vm-1", EventReconciler.disabled(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static InventoryEvent event(EventType type, String item, int trackId) {
        return new InventoryEvent(type, item, NOW, trackId, 0, 1);
    }

    @Test
    void drainReturnsEventsInOrderWithLatestCounts() {
        batcher.append(List.of(event(EventType.ADDED, "chips", 1)), Map.of("chips", 1));
        batcher.append(List.of(event(EventType.ADDED, "candy", 2)), Map.of("chips", 1, "candy", 1));

        InventoryDelta delta = batcher.drain();

        assertEquals("vm-1", delta.getMachineId());
        assertEquals(NOW, delta.getTimestamp());
        assertEquals(2, delta.getEvents().size());
        assertEquals(1, delta.getEvents().get(0).getTrackId());
        assertEquals(2, delta.getEvents().get(1).getTrackId());
        assertEquals(Map.of("chips", 1, "candy", 1), delta.getCounts());
    }

    @Test
    void drainClearsPendingEvents() {
        batcher.append(List.of(event(EventType.ADDED, "chips", 1)), Map.of("chips", 1));
        assertTrue(batcher.hasPending());

        batcher.drain();

        assertFalse(batcher.hasPending());
        InventoryDelta second = batcher.drain();
        assertTrue(second.isEmpty());
        assertEquals(Map.of("chips", 1), second.getCounts());
    }

    @Test
    void emptyDrainStillCarriesMachineAndCounts() {
        InventoryDelta delta = batcher.drain();

        assertTrue(delta.isEmpty());
        assertEquals("vm-1", delta.getMachineId());
        assertTrue(delta.getCounts().isEmpty());
    }

    @Test
    void clearDropsEventsAndCounts() {
        batcher.append(List.of(event(EventType.ADDED, "chips", 1)), Map.of("chips", 1));

        batcher.clear();

        assertEquals(0, batcher.pendingCount());
        assertTrue(batcher.drain().getCounts().isEmpty());
    }

    @Test
    void concurrentDrainsSeeWholeAppends() throws Exception {
        int batches = 2000;
        int batchSize = 10;
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean splitBatch = new AtomicBoolean();

        Thread producer = new Thread(() -> {
            started.countDown();
            for (int b = 0; b < batches; b++) {
                List<InventoryEvent> events = new ArrayList<>();
                for (int i = 0; i < batchSize; i++) {
                    events.add(event(EventType.ADDED, "chips", b * batchSize + i + 1));
                }
                batcher.append(events, Map.of("chips", (b + 1) * batchSize));
            }
        });
        producer.start();
        started.await();

        List<InventoryEvent> received = new ArrayList<>();
        while (producer.isAlive()) {
            InventoryDelta delta = batcher.drain();
            if (delta.getEvents().size() % batchSize != 0) {
                splitBatch.set(true);
            }
            received.addAll(delta.getEvents());
        }
        producer.join();
        received.addAll(batcher.drain().getEvents());

        assertFalse(splitBatch.get(), "a drain observed part of an append");
        assertEquals(batches * batchSize, received.size());
        for (int i = 0; i < received.size(); i++) {
            assertEquals(i + 1, received.get(i).getTrackId());
        }
        assertEquals(0, batcher.pendingCount());
    }

    @Test
    void reconcilerRunsOnDrain() {
        DeltaBatcher reconciling = new DeltaBatcher("vm-1",
            new EventReconciler(Duration.ofSeconds(2)), Clock.fixed(NOW, ZoneOffset.UTC));
        reconciling.append(List.of(
            new InventoryEvent(EventType.TAKEN, "chips", NOW, 1, 1, 0),
            new InventoryEvent(EventType.ADDED, "chips", NOW.plusMillis(500), 2, 0, 1)), Map.of("chips", 1));

        assertTrue(reconciling.drain().isEmpty());
    }
}
