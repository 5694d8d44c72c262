package com.foodinsight.edge.tracking;

import java.util.List;

import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.TrackedDetection;
import com.foodinsight.pipeline.tracking.TrackingCapability;

/**
 * Development stand-in used when no tracking model is installed: reports nothing.
 */
@Slf4j
public class NoOpTrackingCapability implements TrackingCapability {

    public NoOpTrackingCapability() {
        log.warn("No tracking model configured. Running in mock mode for development.");
    }

    @Override
    public List<TrackedDetection> track(Mat image) {
        return List.of();
    }

    @Override
    public boolean isLoaded() {
        return false;
    }
}
