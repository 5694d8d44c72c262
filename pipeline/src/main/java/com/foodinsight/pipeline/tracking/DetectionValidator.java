package com.foodinsight.pipeline.tracking;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.foodinsight.pipeline.model.TrackedDetection;

/**
 * Rejects tracker output the state machine cannot trust.
 */
public final class DetectionValidator {

    private DetectionValidator() {}

    /**
     * @throws TrackingException describing the first problem found
     */
    public static List<TrackedDetection> validate(List<TrackedDetection> detections) {
        if (detections == null) {
            throw new TrackingException("Tracker returned no detection list");
        }
        Set<Integer> ids = new HashSet<>();
        for (TrackedDetection d : detections) {
            if (d == null) {
                throw new TrackingException("Tracker returned a null detection");
            }
            if (d.getTrackId() <= 0) {
                throw new TrackingException("Non-positive track_id " + d.getTrackId());
            }
            if (!ids.add(d.getTrackId())) {
                throw new TrackingException("Duplicate track_id " + d.getTrackId() + " in one frame");
            }
            if (d.getClassName() == null || d.getClassName().isBlank()) {
                throw new TrackingException("Blank class name for track_id " + d.getTrackId());
            }
            if (Double.isNaN(d.getConfidence()) || d.getConfidence() < 0.0 || d.getConfidence() > 1.0) {
                throw new TrackingException("Confidence " + d.getConfidence() + " outside [0, 1] for track_id " + d.getTrackId());
            }
            if (d.getBbox() == null) {
                throw new TrackingException("Missing bbox for track_id " + d.getTrackId());
            }
        }
        return detections;
    }
}
