package com.foodinsight.edge.preview;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PreviewWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesFrameAtomically() throws Exception {
        Path output = dir.resolve("preview").resolve("latest.jpg");
        PreviewWriter writer = new PreviewWriter(
            () -> Optional.of(new Mat(240, 320, opencv_core.CV_8UC3, new Scalar(0, 128, 0, 0))),
            output, Duration.ofSeconds(1));

        assertTrue(writer.writeOnce());

        assertTrue(Files.isRegularFile(output));
        assertFalse(Files.exists(output.resolveSibling(".tmp-latest.jpg")));
        Mat read = opencv_imgcodecs.imread(output.toString());
        assertEquals(320, read.cols());
        assertEquals(240, read.rows());
        read.release();
        writer.close();
    }

    @Test
    void nothingWrittenBeforeFirstFrame() throws Exception {
        Path output = dir.resolve("latest.jpg");
        PreviewWriter writer = new PreviewWriter(Optional::empty, output, Duration.ofSeconds(1));

        assertFalse(writer.writeOnce());
        assertFalse(Files.exists(output));
        writer.close();
    }
}
