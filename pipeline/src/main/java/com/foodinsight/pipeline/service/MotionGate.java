package com.foodinsight.pipeline.service;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides per frame whether the tracking capability should run, using the mean
 * absolute difference between consecutive grayscale, blurred frames.
 *
 * <p>Not thread-safe; owned by the frame-processing thread.
 */
@Slf4j
public class MotionGate implements AutoCloseable {

    public static final double DEFAULT_THRESHOLD = 0.008;
    public static final int DEFAULT_BLUR_SIZE = 21;

    enum GateState {
        NO_BASELINE,
        PRIMED
    }

    private final int blurSize;
    private final int cooldownFrames;

    private volatile double threshold;
    private GateState state = GateState.NO_BASELINE;
    private Mat baseline;
    private int cooldownRemaining;
    private double lastMotionScore;

    public MotionGate() {
        this(DEFAULT_THRESHOLD, DEFAULT_BLUR_SIZE, 0);
    }

    /**
     * @param threshold      motion score in [0, 1] a frame must exceed to trigger inference
     * @param blurSize       Gaussian kernel size, rounded up to the next odd number
     * @param cooldownFrames frames that keep returning true after motion stops
     */
    public MotionGate(double threshold, int blurSize, int cooldownFrames) {
        if (blurSize < 1) {
            throw new IllegalArgumentException("blurSize must be positive: " + blurSize);
        }
        if (cooldownFrames < 0) {
            throw new IllegalArgumentException("cooldownFrames must not be negative: " + cooldownFrames);
        }
        this.threshold = checkThreshold(threshold);
        this.blurSize = blurSize % 2 == 1 ? blurSize : blurSize + 1;
        this.cooldownFrames = cooldownFrames;
    }

    public boolean shouldRunInference(Mat frame) {
        if (frame == null || frame.empty()) {
            throw new IllegalArgumentException("frame must not be empty");
        }
        Mat gray = toBlurredGray(frame);

        if (state == GateState.NO_BASELINE) {
            replaceBaseline(gray);
            return true;
        }
        if (baseline.rows() != gray.rows() || baseline.cols() != gray.cols()) {
            log.info("Frame size changed from {}x{} to {}x{}, re-priming motion baseline",
                baseline.cols(), baseline.rows(), gray.cols(), gray.rows());
            replaceBaseline(gray);
            return true;
        }

        Mat diff = new Mat();
        opencv_core.absdiff(baseline, gray, diff);
        lastMotionScore = opencv_core.mean(diff).get(0) / 255.0;
        diff.release();

        replaceBaseline(gray);

        if (lastMotionScore > threshold) {
            cooldownRemaining = cooldownFrames;
            log.debug("Motion score {} above threshold {}", lastMotionScore, threshold);
            return true;
        }
        if (cooldownRemaining > 0) {
            cooldownRemaining--;
            return true;
        }
        return false;
    }

    /**
     * Drops the baseline so the next call runs inference unconditionally.
     */
    public void reset() {
        if (baseline != null) {
            baseline.release();
            baseline = null;
        }
        state = GateState.NO_BASELINE;
        cooldownRemaining = 0;
        lastMotionScore = 0.0;
    }

    public void setThreshold(double threshold) {
        this.threshold = checkThreshold(threshold);
    }

    public double getThreshold() {
        return threshold;
    }

    public double lastMotionScore() {
        return lastMotionScore;
    }

    public boolean hasBaseline() {
        return state == GateState.PRIMED;
    }

    public boolean isActive() {
        return cooldownRemaining > 0 || lastMotionScore > threshold;
    }

    @Override
    public void close() {
        reset();
    }

    private Mat toBlurredGray(Mat frame) {
        Mat gray = new Mat();
        int channels = frame.channels();
        if (channels == 1) {
            frame.copyTo(gray);
        } else if (channels == 3) {
            opencv_imgproc.cvtColor(frame, gray, opencv_imgproc.COLOR_BGR2GRAY);
        } else if (channels == 4) {
            opencv_imgproc.cvtColor(frame, gray, opencv_imgproc.COLOR_BGRA2GRAY);
        } else {
            gray.release();
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        opencv_imgproc.GaussianBlur(gray, gray, new Size(blurSize, blurSize), 0);
        return gray;
    }

    private void replaceBaseline(Mat gray) {
        if (baseline != null) {
            baseline.release();
        }
        baseline = gray;
        state = GateState.PRIMED;
    }

    private static double checkThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Motion threshold must be within [0, 1]: " + threshold);
        }
        return threshold;
    }
}
