package com.foodinsight.pipeline.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.InventoryDelta;
import com.foodinsight.pipeline.model.InventoryEvent;

/**
 * Accumulates inventory events between drains.
 *
 * <p>{@link #append} is called from the frame-processing thread and
 * {@link #drain} from the delta consumer. Both run under one lock held only for
 * the copy, so a drain sees either all or none of a concurrent append.
 */
@Slf4j
public class DeltaBatcher {

    private final String machineId;
    private final Clock clock;
    private final EventReconciler reconciler;
    private final ReentrantLock lock = new ReentrantLock();

    private List<InventoryEvent> pending = new ArrayList<>();
    private Map<String, Integer> counts = new TreeMap<>();

    public DeltaBatcher(String machineId) {
        this(machineId, EventReconciler.disabled(), Clock.systemUTC());
    }

    public DeltaBatcher(String machineId, EventReconciler reconciler, Clock clock) {
        this.machineId = machineId;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    /**
     * Queues events and records the counts they produced.
     */
    public void append(List<InventoryEvent> events, Map<String, Integer> countsSnapshot) {
        Map<String, Integer> snapshot = new TreeMap<>(countsSnapshot);
        lock.lock();
        try {
            pending.addAll(events);
            counts = snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands the pending events and the latest counts to the caller and clears the
     * pending list. Always returns a delta; no events means no change since the
     * previous drain.
     */
    public InventoryDelta drain() {
        List<InventoryEvent> drained;
        Map<String, Integer> snapshot;
        lock.lock();
        try {
            drained = pending;
            snapshot = counts;
            pending = new ArrayList<>();
        } finally {
            lock.unlock();
        }

        List<InventoryEvent> events = reconciler.reconcile(drained);
        if (!events.isEmpty()) {
            log.debug("Drained {} events for machine {}", events.size(), machineId);
        }
        return new InventoryDelta(machineId, Instant.now(clock), snapshot, events);
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        return pendingCount() > 0;
    }

    public void clear() {
        lock.lock();
        try {
            pending = new ArrayList<>();
            counts = new TreeMap<>();
        } finally {
            lock.unlock();
        }
    }
}
