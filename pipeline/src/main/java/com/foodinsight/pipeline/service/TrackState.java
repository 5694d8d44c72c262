package com.foodinsight.pipeline.service;

import lombok.Getter;

/**
 * Per-track automaton state. A track is either {@link Phase#ACTIVE} or
 * {@link Phase#MISSING} with a positive {@code missingCount}; a removed track
 * has no state at all.
 */
@Getter
public final class TrackState {

    public enum Phase {
        ACTIVE,
        MISSING
    }

    private final int trackId;
    private final String className;
    private int missingCount;

    TrackState(int trackId, String className) {
        this.trackId = trackId;
        this.className = className;
    }

    public Phase getPhase() {
        return missingCount == 0 ? Phase.ACTIVE : Phase.MISSING;
    }

    void markSeen() {
        missingCount = 0;
    }

    int markMissing() {
        return ++missingCount;
    }

    @Override
    public String toString() {
        return getPhase() == Phase.ACTIVE
            ? "Active(" + className + ")"
            : "Missing(" + className + ", " + missingCount + ")";
    }
}
