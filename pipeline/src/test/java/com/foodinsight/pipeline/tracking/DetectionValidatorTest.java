package com.foodinsight.pipeline.tracking;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.foodinsight.pipeline.model.BoundingBox;
import com.foodinsight.pipeline.model.TrackedDetection;

class DetectionValidatorTest {

    private static final BoundingBox BOX = new BoundingBox(0, 0, 10, 10);

    @Test
    void acceptsWellFormedOutput() {
        List<TrackedDetection> detections = List.of(
            new TrackedDetection(1, "chips", 0.9, BOX),
            new TrackedDetection(2, "candy", 0.0, BOX));

        assertSame(detections, DetectionValidator.validate(detections));
    }

    @Test
    void rejectsMalformedOutput() {
        assertThrows(TrackingException.class, () -> DetectionValidator.validate(null));
        assertThrows(TrackingException.class, () -> DetectionValidator.validate(Arrays.asList((TrackedDetection) null)));
        assertThrows(TrackingException.class,
            () -> DetectionValidator.validate(List.of(new TrackedDetection(0, "chips", 0.9, BOX))));
        assertThrows(TrackingException.class, () -> DetectionValidator.validate(List.of(
            new TrackedDetection(4, "chips", 0.9, BOX), new TrackedDetection(4, "candy", 0.9, BOX))));
        assertThrows(TrackingException.class,
            () -> DetectionValidator.validate(List.of(new TrackedDetection(1, " ", 0.9, BOX))));
        assertThrows(TrackingException.class,
            () -> DetectionValidator.validate(List.of(new TrackedDetection(1, "chips", 1.2, BOX))));
        assertThrows(TrackingException.class,
            () -> DetectionValidator.validate(List.of(new TrackedDetection(1, "chips", Double.NaN, BOX))));
        assertThrows(TrackingException.class,
            () -> DetectionValidator.validate(List.of(new TrackedDetection(1, "chips", 0.9, null))));
    }
}
