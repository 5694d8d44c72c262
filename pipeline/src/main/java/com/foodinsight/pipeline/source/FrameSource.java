package com.foodinsight.pipeline.source;

import java.util.Optional;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Pull-based camera abstraction. The pipeline only consumes frames; opening and
 * releasing the device belongs to the implementation.
 */
public interface FrameSource extends AutoCloseable {

    /**
     * @return the next BGR frame, or empty when none is available right now
     */
    Optional<Mat> nextFrame();

    /**
     * False once the source is exhausted (end of file, device gone).
     */
    boolean isOpen();

    @Override
    void close();
}
