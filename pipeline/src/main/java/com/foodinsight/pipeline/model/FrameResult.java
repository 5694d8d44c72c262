package com.foodinsight.pipeline.model;

import java.util.List;

import lombok.Value;

/**
 * Outcome of processing one frame.
 */
@Value
public class FrameResult {

    long frameNumber;
    boolean skipped;
    boolean inferenceRun;
    boolean trackingFailed;
    List<TrackedDetection> detections;
    List<InventoryEvent> events;

    public static FrameResult skipped(long frameNumber, List<TrackedDetection> lastDetections) {
        return new FrameResult(frameNumber, true, false, false, lastDetections, List.of());
    }
}
