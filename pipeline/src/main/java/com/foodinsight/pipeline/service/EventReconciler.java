package com.foodinsight.pipeline.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.InventoryEvent;

/**
 * Optional pass that cancels a TAKEN and an ADDED of the same item lying
 * within a short window of each other, in either order. A tracker that
 * re-assigns ids after occlusion produces such a pair; usually the new id is
 * added first and the old one is taken once its debounce runs out. Only pairs
 * inside one drained batch are seen.
 *
 * <p>Off by default: it trades missed real swaps for fewer phantom ones and
 * the window has to be tuned on real footage.
 */
@Slf4j
public class EventReconciler {

    private final Duration window;

    public EventReconciler(Duration window) {
        if (window.isNegative()) {
            throw new IllegalArgumentException("Reconcile window must not be negative: " + window);
        }
        this.window = window;
    }

    public static EventReconciler disabled() {
        return new EventReconciler(Duration.ZERO);
    }

    public boolean isEnabled() {
        return !window.isZero();
    }

    public List<InventoryEvent> reconcile(List<InventoryEvent> events) {
        if (!isEnabled() || events.size() < 2) {
            return events;
        }
        List<InventoryEvent> result = new ArrayList<>(events);
        boolean[] cancelled = new boolean[result.size()];
        for (int i = 0; i < result.size(); i++) {
            if (cancelled[i]) {
                continue;
            }
            InventoryEvent first = result.get(i);
            for (int j = i + 1; j < result.size(); j++) {
                InventoryEvent second = result.get(j);
                if (cancelled[j] || second.getType() == first.getType() || !second.getItem().equals(first.getItem())) {
                    continue;
                }
                if (Duration.between(first.getTimestamp(), second.getTimestamp()).abs().compareTo(window) <= 0) {
                    cancelled[i] = true;
                    cancelled[j] = true;
                    log.info("Cancelled {} re-identification: {} #{} / {} #{}", first.getItem(),
                        first.getType().getWireName(), first.getTrackId(),
                        second.getType().getWireName(), second.getTrackId());
                    break;
                }
            }
        }
        List<InventoryEvent> kept = new ArrayList<>();
        for (int i = 0; i < result.size(); i++) {
            if (!cancelled[i]) {
                kept.add(result.get(i));
            }
        }
        return kept;
    }
}
