package com.foodinsight.pipeline.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MotionGateTest {

    private MotionGate gate;

    @BeforeEach
    void setUp() {
        gate = new MotionGate(0.02, 21, 0);
    }

    @AfterEach
    void tearDown() {
        gate.close();
    }

    static Mat blackFrame(int width, int height) {
        return new Mat(height, width, opencv_core.CV_8UC3, new Scalar(0, 0, 0, 0));
    }

    static Mat frameWithSquare(int x, int y, int size) {
        Mat frame = blackFrame(640, 480);
        opencv_imgproc.rectangle(frame, new Rect(x, y, size, size), new Scalar(255, 255, 255, 0),
            opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
        return frame;
    }

    @Test
    void firstFrameAlwaysRunsInference() {
        assertFalse(gate.hasBaseline());
        assertTrue(gate.shouldRunInference(blackFrame(640, 480)));
        assertTrue(gate.hasBaseline());
    }

    @Test
    void identicalFramesAreGatedOut() {
        Mat frame = blackFrame(640, 480);
        gate.shouldRunInference(frame);

        assertFalse(gate.shouldRunInference(frame));
        assertFalse(gate.shouldRunInference(frame.clone()));
        assertEquals(0.0, gate.lastMotionScore(), 1e-9);
    }

    @Test
    void changedRegionTriggersInference() {
        gate.shouldRunInference(blackFrame(640, 480));

        assertTrue(gate.shouldRunInference(frameWithSquare(100, 100, 100)));
        assertTrue(gate.lastMotionScore() > 0.02);
        assertTrue(gate.isActive());
    }

    @Test
    void smallChangeBelowThresholdIsIgnored() {
        gate.shouldRunInference(blackFrame(640, 480));

        assertFalse(gate.shouldRunInference(frameWithSquare(10, 10, 20)));
        assertTrue(gate.lastMotionScore() > 0.0);
    }

    @Test
    void cooldownKeepsInferenceRunningAfterMotionStops() {
        MotionGate withCooldown = new MotionGate(0.02, 21, 3);
        Mat black = blackFrame(640, 480);

        assertTrue(withCooldown.shouldRunInference(black));
        assertTrue(withCooldown.shouldRunInference(frameWithSquare(100, 100, 200)));
        // the square disappearing is motion too
        assertTrue(withCooldown.shouldRunInference(black));
        assertTrue(withCooldown.shouldRunInference(black));
        assertTrue(withCooldown.shouldRunInference(black));
        assertTrue(withCooldown.shouldRunInference(black));
        assertFalse(withCooldown.shouldRunInference(black));
        withCooldown.close();
    }

    @Test
    void resetDropsTheBaseline() {
        Mat frame = blackFrame(640, 480);
        gate.shouldRunInference(frame);
        assertFalse(gate.shouldRunInference(frame));

        gate.reset();

        assertFalse(gate.hasBaseline());
        assertTrue(gate.shouldRunInference(frame));
    }

    @Test
    void frameSizeChangeReprimesTheBaseline() {
        gate.shouldRunInference(blackFrame(640, 480));

        assertTrue(gate.shouldRunInference(blackFrame(320, 240)));
        assertFalse(gate.shouldRunInference(blackFrame(320, 240)));
    }

    @Test
    void acceptsGrayscaleFrames() {
        Mat gray = new Mat(240, 320, opencv_core.CV_8UC1, new Scalar(0));
        assertTrue(gate.shouldRunInference(gray));
        assertFalse(gate.shouldRunInference(gray));
    }

    @Test
    void thresholdMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> gate.setThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> gate.setThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new MotionGate(Double.NaN, 21, 0));
        assertEquals(0.02, gate.getThreshold(), 1e-9);

        gate.setThreshold(0.5);
        assertEquals(0.5, gate.getThreshold(), 1e-9);
    }

    @Test
    void rejectsEmptyFrames() {
        assertThrows(IllegalArgumentException.class, () -> gate.shouldRunInference(new Mat()));
    }
}
