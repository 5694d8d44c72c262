package com.foodinsight.pipeline.observer;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.InventoryEvent;
import com.foodinsight.pipeline.model.PipelineStatus;

@Slf4j
public class LoggingPipelineObserver implements PipelineObserver {

    private final long statusEveryNFrames;

    public LoggingPipelineObserver() {
        this(300);
    }

    public LoggingPipelineObserver(long statusEveryNFrames) {
        this.statusEveryNFrames = Math.max(1, statusEveryNFrames);
    }

    @Override
    public void onTrackingFailure(long frameNumber, Exception cause) {
        log.warn("Tracking failed on frame {}, reusing previous detections: {}", frameNumber, cause.getMessage());
        log.debug("Tracking failure detail", cause);
    }

    @Override
    public void onEvents(List<InventoryEvent> events) {
        log.debug("{} inventory events emitted", events.size());
    }

    @Override
    public void onStatus(PipelineStatus status) {
        if (status.getFrameCount() % statusEveryNFrames == 0) {
            log.info("Status: fps={}, frames={}, inferences={}, failures={}, motion={}, inventory={}",
                String.format("%.1f", status.getFps()), status.getFrameCount(), status.getInferenceCount(),
                status.getTrackingFailures(), status.isMotionActive(), status.getInventory());
        }
    }
}
