package com.foodinsight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * One object reported by the tracking capability for a single frame.
 * {@code trackId} is the tracker's identity token and is only meaningful while
 * the tracker keeps the object continuously tracked.
 */
@Value
public class TrackedDetection {

    @JsonProperty("track_id")
    int trackId;

    @JsonProperty("class_name")
    String className;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("bbox")
    BoundingBox bbox;

    public TrackedDetection withBbox(BoundingBox newBbox) {
        return new TrackedDetection(trackId, className, confidence, newBbox);
    }
}
