package com.foodinsight.pipeline.service;

import java.util.List;

import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import com.foodinsight.pipeline.model.BoundingBox;
import com.foodinsight.pipeline.model.TrackedDetection;

/**
 * Draws detection boxes and labels onto a display frame, in place.
 */
public class DisplayComposer {

    private static final Scalar BOX_COLOR = new Scalar(0, 255, 0, 0);
    private static final Scalar TEXT_COLOR = new Scalar(0, 0, 0, 0);
    private static final double FONT_SCALE = 0.5;
    private static final int THICKNESS = 2;

    public void drawDetections(Mat displayFrame, List<TrackedDetection> detections) {
        for (TrackedDetection det : detections) {
            BoundingBox box = det.getBbox();
            int x1 = (int) box.getX1();
            int y1 = (int) box.getY1();
            int x2 = (int) box.getX2();
            int y2 = (int) box.getY2();

            opencv_imgproc.rectangle(displayFrame, new Point(x1, y1), new Point(x2, y2),
                BOX_COLOR, THICKNESS, opencv_imgproc.LINE_8, 0);

            String label = String.format("%s #%d (%.2f)", det.getClassName(), det.getTrackId(), det.getConfidence());
            int[] baseline = new int[1];
            Size labelSize = opencv_imgproc.getTextSize(label, opencv_imgproc.FONT_HERSHEY_SIMPLEX,
                FONT_SCALE, THICKNESS, baseline);
            opencv_imgproc.rectangle(displayFrame,
                new Point(x1, y1 - labelSize.height() - 10),
                new Point(x1 + labelSize.width(), y1),
                BOX_COLOR, opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
            opencv_imgproc.putText(displayFrame, label, new Point(x1, y1 - 5),
                opencv_imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE, TEXT_COLOR, THICKNESS, opencv_imgproc.LINE_8, false);
        }
    }
}
