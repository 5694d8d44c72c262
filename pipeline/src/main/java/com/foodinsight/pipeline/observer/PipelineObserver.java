package com.foodinsight.pipeline.observer;

import java.util.List;

import com.foodinsight.pipeline.model.InventoryEvent;
import com.foodinsight.pipeline.model.PipelineStatus;

/**
 * Receives what the pipeline wants to report without letting the reporting
 * affect frame processing.
 */
public interface PipelineObserver {

    void onTrackingFailure(long frameNumber, Exception cause);

    default void onEvents(List<InventoryEvent> events) {
    }

    default void onStatus(PipelineStatus status) {
    }
}
