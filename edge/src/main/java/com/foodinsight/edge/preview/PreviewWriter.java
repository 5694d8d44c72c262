package com.foodinsight.edge.preview;

import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodically writes the privacy-safe display frame to disk for local
 * monitoring. Writes go to a temporary file first so readers never see a
 * half-written image.
 */
@Slf4j
public class PreviewWriter implements AutoCloseable {

    private final Supplier<Optional<Mat>> displaySource;
    private final Path outputPath;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "preview-writer");
        t.setDaemon(true);
        return t;
    });

    public PreviewWriter(Supplier<Optional<Mat>> displaySource, Path outputPath, Duration interval) {
        this.displaySource = displaySource;
        this.outputPath = outputPath.toAbsolutePath().normalize();
        this.interval = interval;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::writeSafely, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Preview writer started: {} every {} ms", outputPath, interval.toMillis());
    }

    /**
     * @return true if a frame was written
     */
    public boolean writeOnce() throws Exception {
        Optional<Mat> display = displaySource.get();
        if (display.isEmpty()) {
            return false;
        }
        Mat mat = display.get();
        try {
            Path dir = outputPath.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            String fileName = outputPath.getFileName().toString();
            Path tmp = outputPath.resolveSibling(".tmp-" + fileName);
            if (!opencv_imgcodecs.imwrite(tmp.toString(), mat)) {
                log.error("Failed to write preview to {}", tmp);
                return false;
            }
            Files.move(tmp, outputPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } finally {
            mat.release();
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void writeSafely() {
        try {
            writeOnce();
        } catch (AccessDeniedException e) {
            log.error("Access denied when writing preview to: {}. Check directory permissions.", outputPath, e);
        } catch (Exception e) {
            log.error("Unexpected exception while writing preview to: {}", outputPath, e);
        }
    }
}
