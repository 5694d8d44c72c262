package com.foodinsight.pipeline.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.Region;
import com.foodinsight.pipeline.model.TrackedDetection;

/**
 * Keeps detection confined to the configured region of interest: crops frames
 * before inference, moves detections back into full-frame coordinates, and
 * blurs everything outside the region for display.
 */
@Slf4j
public class PrivacyRegionProjector {

    public static final int DEFAULT_BLUR_INTENSITY = 51;
    private static final int BORDER_THICKNESS = 2;

    @Getter
    private final int frameWidth;
    @Getter
    private final int frameHeight;
    @Getter
    private final int blurIntensity;

    private volatile Region region;

    public PrivacyRegionProjector(int frameWidth, int frameHeight, int blurIntensity) {
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new IllegalArgumentException("Frame size must be positive: " + frameWidth + "x" + frameHeight);
        }
        if (blurIntensity < 1) {
            throw new IllegalArgumentException("blurIntensity must be positive: " + blurIntensity);
        }
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.blurIntensity = blurIntensity % 2 == 1 ? blurIntensity : blurIntensity + 1;
    }

    /**
     * Replaces the region of interest.
     *
     * @throws InvalidRegionException if the region is malformed; the old region is kept
     */
    public void setRegion(Region newRegion) {
        if (newRegion == null) {
            clearRegion();
            return;
        }
        String problem = newRegion.validate(frameWidth, frameHeight);
        if (problem != null) {
            log.warn("Rejecting region {}: {}; keeping {}", newRegion, problem, region == null ? "full frame" : region);
            throw new InvalidRegionException(newRegion, problem);
        }
        region = newRegion;
        log.info("ROI set to: {}", newRegion);
    }

    public void clearRegion() {
        region = null;
        log.info("ROI cleared - using full frame");
    }

    public Optional<Region> getRegion() {
        return Optional.ofNullable(region);
    }

    public boolean hasRegion() {
        return region != null;
    }

    /**
     * Top-left corner of the configured region as {x, y}; (0, 0) for full frame.
     */
    public int[] regionOffset() {
        Region current = region;
        return current == null ? new int[] {0, 0} : new int[] {current.getX1(), current.getY1()};
    }

    /**
     * The configured region clamped to an actual frame, or empty for full frame.
     */
    public Optional<Region> effectiveRegion(int width, int height) {
        Region current = region;
        if (current == null) {
            return Optional.empty();
        }
        return Optional.of(current.clampTo(width, height));
    }

    public Optional<Region> effectiveRegion(Mat frame) {
        return effectiveRegion(frame.cols(), frame.rows());
    }

    /**
     * Returns a copy of the region's pixels, or the frame itself when no region is set.
     */
    public Mat crop(Mat frame) {
        return crop(frame, effectiveRegion(frame).orElse(null));
    }

    public Mat crop(Mat frame, Region cropRegion) {
        if (cropRegion == null) {
            return frame;
        }
        Mat view = new Mat(frame, toRect(cropRegion));
        Mat copy = view.clone();
        view.close();
        return copy;
    }

    /**
     * Shifts detections found on a cropped frame by the region's top-left offset.
     * The input list is left untouched.
     */
    public List<TrackedDetection> projectDetections(List<TrackedDetection> detections, Region cropRegion) {
        if (cropRegion == null || (cropRegion.getX1() == 0 && cropRegion.getY1() == 0)) {
            return detections;
        }
        List<TrackedDetection> projected = new ArrayList<>(detections.size());
        for (TrackedDetection detection : detections) {
            projected.add(detection.withBbox(detection.getBbox().translate(cropRegion.getX1(), cropRegion.getY1())));
        }
        return projected;
    }

    /**
     * Blurs the frame outside the region and outlines the region. Returns the
     * frame unchanged when no region is set; otherwise a new Mat owned by the caller.
     */
    public Mat renderForDisplay(Mat frame, Region displayRegion) {
        if (displayRegion == null) {
            return frame;
        }
        Rect rect = toRect(displayRegion);

        Mat result = new Mat();
        opencv_imgproc.GaussianBlur(frame, result, new Size(blurIntensity, blurIntensity), 0);

        Mat source = new Mat(frame, rect);
        Mat target = new Mat(result, rect);
        source.copyTo(target);
        source.close();
        target.close();

        opencv_imgproc.rectangle(result,
            new Point(displayRegion.getX1(), displayRegion.getY1()),
            new Point(displayRegion.getX2(), displayRegion.getY2()),
            new Scalar(0, 255, 0, 0),
            BORDER_THICKNESS, opencv_imgproc.LINE_8, 0);
        return result;
    }

    public Mat renderForDisplay(Mat frame) {
        return renderForDisplay(frame, effectiveRegion(frame).orElse(null));
    }

    private static Rect toRect(Region r) {
        return new Rect(r.getX1(), r.getY1(), r.getWidth(), r.getHeight());
    }
}
