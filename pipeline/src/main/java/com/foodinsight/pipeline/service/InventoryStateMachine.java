package com.foodinsight.pipeline.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.EventType;
import com.foodinsight.pipeline.model.InventoryEvent;
import com.foodinsight.pipeline.model.TrackedDetection;

/**
 * Turns per-frame tracked detections into discrete inventory events.
 *
 * <p>Additions are confirmed immediately: a new track id is evidence of a new
 * item. Removals are debounced: a track has to be absent for
 * {@code debounceThreshold} consecutive updates before a TAKEN event fires,
 * so brief occlusion does not register as a removal.
 *
 * <p>Not thread-safe; owned by the frame-processing thread.
 */
@Slf4j
public class InventoryStateMachine {

    public static final int DEFAULT_DEBOUNCE_THRESHOLD = 10;

    private final Clock clock;
    // insertion order gives removals a stable order within one update
    private final Map<Integer, TrackState> tracks = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new TreeMap<>();
    private int debounceThreshold;

    public InventoryStateMachine() {
        this(DEFAULT_DEBOUNCE_THRESHOLD, Clock.systemUTC());
    }

    public InventoryStateMachine(int debounceThreshold) {
        this(debounceThreshold, Clock.systemUTC());
    }

    public InventoryStateMachine(int debounceThreshold, Clock clock) {
        this.debounceThreshold = checkThreshold(debounceThreshold);
        this.clock = clock;
    }

    public List<InventoryEvent> update(List<TrackedDetection> detections) {
        List<InventoryEvent> events = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Instant now = clock.instant();

        for (TrackedDetection detection : detections) {
            int trackId = detection.getTrackId();
            if (!seen.add(trackId)) {
                log.debug("Ignoring repeated track_id={} within one update", trackId);
                continue;
            }
            TrackState state = tracks.get(trackId);
            if (state == null) {
                tracks.put(trackId, new TrackState(trackId, detection.getClassName()));
                events.add(adjust(EventType.ADDED, detection.getClassName(), trackId, now));
            } else {
                state.markSeen();
            }
        }

        Iterator<TrackState> it = tracks.values().iterator();
        while (it.hasNext()) {
            TrackState state = it.next();
            if (seen.contains(state.getTrackId())) {
                continue;
            }
            if (state.markMissing() >= debounceThreshold) {
                it.remove();
                events.add(adjust(EventType.TAKEN, state.getClassName(), state.getTrackId(), now));
            }
        }
        return events;
    }

    /**
     * Seeds counts from an external baseline. Known tracks are adopted as active
     * without emitting events, since the baseline already counts them.
     */
    public void restore(Map<String, Integer> baseline, Map<Integer, String> knownTracks) {
        tracks.clear();
        counts.clear();
        baseline.forEach((item, count) -> {
            if (count < 0) {
                throw new IllegalArgumentException("Negative baseline count for " + item + ": " + count);
            }
            counts.put(item, count);
        });
        knownTracks.forEach((trackId, className) -> tracks.put(trackId, new TrackState(trackId, className)));
        log.info("Inventory restored: counts={}, known tracks={}", counts, tracks.keySet());
    }

    public void reset() {
        tracks.clear();
        counts.clear();
        log.info("Inventory state reset");
    }

    public Map<String, Integer> currentCounts() {
        return Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    public int count(String item) {
        return counts.getOrDefault(item, 0);
    }

    public int activeTrackCount() {
        return tracks.size();
    }

    public Optional<TrackState> trackState(int trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    public int getDebounceThreshold() {
        return debounceThreshold;
    }

    /**
     * Takes effect on the next update; tracks already missing longer than the new
     * threshold are removed on that update.
     */
    public void setDebounceThreshold(int debounceThreshold) {
        this.debounceThreshold = checkThreshold(debounceThreshold);
    }

    private InventoryEvent adjust(EventType type, String item, int trackId, Instant now) {
        int before = counts.getOrDefault(item, 0);
        int after = type == EventType.ADDED ? before + 1 : Math.max(0, before - 1);
        counts.put(item, after);
        log.info("{}: {} (track_id={}, count: {} -> {})", type.getWireName(), item, trackId, before, after);
        return new InventoryEvent(type, item, now, trackId, before, after);
    }

    private static int checkThreshold(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Debounce threshold must be at least 1: " + threshold);
        }
        return threshold;
    }
}
