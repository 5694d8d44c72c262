package com.foodinsight.edge.source;

import java.io.File;
import java.util.Optional;

import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.source.FrameSource;

/**
 * Frames from a local camera index or a video file/stream URL, resized to the
 * configured frame size so region coordinates stay valid.
 */
@Slf4j
public class CameraFrameSource implements FrameSource {

    private static final long REOPEN_DELAY_MS = 5000;
    private static final int MAX_CONSECUTIVE_READ_FAILURES = 50;

    private final String url;
    private final int frameWidth;
    private final int frameHeight;
    private final VideoCapture camera;
    private int consecutiveFailures;
    private volatile boolean open;

    public CameraFrameSource(String url, int frameWidth, int frameHeight) throws Exception {
        this.url = url;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.camera = openCamera();
        this.open = true;
    }

    @Override
    public Optional<Mat> nextFrame() {
        if (!open) {
            return Optional.empty();
        }
        Mat mat = new Mat();
        if (!camera.read(mat) || mat.empty()) {
            mat.release();
            consecutiveFailures++;
            if (!isCameraIndex() || consecutiveFailures >= MAX_CONSECUTIVE_READ_FAILURES) {
                log.info("No more frames from {} after {} failed reads", url, consecutiveFailures);
                open = false;
            }
            return Optional.empty();
        }
        consecutiveFailures = 0;
        if (mat.cols() != frameWidth || mat.rows() != frameHeight) {
            opencv_imgproc.resize(mat, mat, new Size(frameWidth, frameHeight), 0, 0, opencv_imgproc.INTER_AREA);
        }
        return Optional.of(mat);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        camera.release();
        log.info("Camera {} released", url);
    }

    private boolean isCameraIndex() {
        return url.matches("\\d+");
    }

    private VideoCapture openCamera() throws Exception {
        VideoCapture capture;
        if (isCameraIndex()) {
            int cameraIndex = Integer.parseInt(url);
            log.info("Opening camera index: {}", cameraIndex);
            capture = new VideoCapture(cameraIndex);
        } else {
            String path = url.replace('\\', '/');
            if (!path.contains("://") && !new File(path).isFile()) {
                throw new Exception("Video file not found: " + new File(path).getAbsolutePath());
            }
            log.info("Opening video source: {}", path);
            capture = new VideoCapture(path);
        }

        if (!capture.isOpened()) {
            log.warn("Failed to open camera on first attempt, url={}", url);
            Thread.sleep(REOPEN_DELAY_MS);
            if (isCameraIndex()) {
                capture.open(Integer.parseInt(url));
            } else {
                capture.open(url.replace('\\', '/'));
            }
            if (!capture.isOpened()) {
                throw new Exception("Error opening camera with url=" + url + ". Check camera index/path.");
            }
            log.info("Camera opened after retry, url={}", url);
        } else {
            log.info("Camera opened on first attempt, url={}", url);
        }
        return capture;
    }
}
