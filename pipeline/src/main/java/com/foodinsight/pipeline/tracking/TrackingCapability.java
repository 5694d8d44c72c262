package com.foodinsight.pipeline.tracking;

import java.util.List;

import org.bytedeco.opencv.opencv_core.Mat;

import com.foodinsight.pipeline.model.TrackedDetection;

/**
 * Object detection with persistent track ids. Implementations are expected to
 * keep a track id stable for as long as the object stays tracked, and to hand
 * out a fresh id once identity is lost.
 */
public interface TrackingCapability extends AutoCloseable {

    /**
     * @param image the cropped frame; coordinates in the result are relative to it
     * @throws TrackingException when inference fails
     */
    List<TrackedDetection> track(Mat image);

    /**
     * Whether a real model backs this capability.
     */
    default boolean isLoaded() {
        return true;
    }

    @Override
    default void close() {
    }
}
