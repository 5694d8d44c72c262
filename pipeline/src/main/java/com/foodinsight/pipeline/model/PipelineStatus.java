package com.foodinsight.pipeline.model;

import java.time.Instant;
import java.util.Map;

import lombok.Value;

/**
 * Read-only view of the pipeline for monitoring collaborators.
 */
@Value
public class PipelineStatus {

    PipelineState state;
    double fps;
    long frameCount;
    long inferenceCount;
    long trackingFailures;
    Instant lastDetectionTime;
    boolean motionActive;
    double motionScore;
    Map<String, Integer> inventory;
}
