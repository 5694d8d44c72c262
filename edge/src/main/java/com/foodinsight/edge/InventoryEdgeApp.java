package com.foodinsight.edge;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.edge.config.ConfigReloader;
import com.foodinsight.edge.preview.PreviewWriter;
import com.foodinsight.edge.publisher.KafkaDeltaPublisher;
import com.foodinsight.edge.publisher.PublisherSettings;
import com.foodinsight.edge.source.CameraFrameSource;
import com.foodinsight.edge.tracking.NoOpTrackingCapability;
import com.foodinsight.pipeline.InventoryPipeline;
import com.foodinsight.pipeline.config.ConfigLoader;
import com.foodinsight.pipeline.config.PipelineSettings;
import com.foodinsight.pipeline.observer.LoggingPipelineObserver;
import com.foodinsight.pipeline.source.FrameSource;

@Slf4j
public class InventoryEdgeApp {

    private static final long IDLE_SLEEP_MS = 100;

    private volatile boolean running = true;
    private final CountDownLatch loopFinished = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            new InventoryEdgeApp().run(ConfigLoader.loadDefault());
        } catch (Exception e) {
            log.error("Application error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    void run(Properties appProps) throws Exception {
        PipelineSettings settings = PipelineSettings.fromProperties(appProps);
        PublisherSettings publisherSettings = PublisherSettings.fromProperties(appProps);
        log.info("Starting FoodInsight Edge, machine id: {}", settings.machineId());

        InventoryPipeline pipeline = new InventoryPipeline(settings, new NoOpTrackingCapability(),
            new LoggingPipelineObserver(Long.parseLong(appProps.getProperty("status.log.every.n.frames", "300"))));
        Map<String, Integer> baseline = PipelineSettings.parseBaseline(appProps.getProperty("inventory.baseline", ""));
        if (!baseline.isEmpty()) {
            pipeline.restoreInventory(baseline, Map.of());
        }
        FrameSource source = new CameraFrameSource(appProps.getProperty("camera.url", "0").trim(),
            settings.frameWidth(), settings.frameHeight());

        Producer<String, String> producer = new KafkaProducer<>(PublisherSettings.producerProperties(appProps));
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(pipeline::drain, producer, publisherSettings);
        publisher.start();

        PreviewWriter preview = startPreview(appProps, pipeline);
        ConfigReloader reloader = startReloader(appProps, pipeline);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down FoodInsight Edge...");
            running = false;
            try {
                if (!loopFinished.await(10, TimeUnit.SECONDS)) {
                    log.warn("Frame loop did not stop within 10 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (reloader != null) {
                reloader.close();
            }
            if (preview != null) {
                preview.close();
            }
            publisher.close();
            pipeline.close();
            log.info("FoodInsight Edge stopped");
        }));

        try {
            runLoop(source, pipeline);
        } finally {
            source.close();
            loopFinished.countDown();
        }
    }

    private void runLoop(FrameSource source, InventoryPipeline pipeline) throws InterruptedException {
        while (running && source.isOpen()) {
            Optional<Mat> next = source.nextFrame();
            if (next.isEmpty()) {
                Thread.sleep(IDLE_SLEEP_MS);
                continue;
            }
            Mat frame = next.get();
            try {
                pipeline.processFrame(frame);
            } catch (RuntimeException e) {
                log.error("Error processing frame {}", pipeline.status().getFrameCount(), e);
            } finally {
                frame.release();
            }
        }
        log.info("Frame loop finished after {} frames", pipeline.status().getFrameCount());
    }

    private static PreviewWriter startPreview(Properties appProps, InventoryPipeline pipeline) {
        long intervalMs = Long.parseLong(appProps.getProperty("preview.interval.ms", "0").trim());
        if (intervalMs <= 0) {
            return null;
        }
        Path output = Paths.get(appProps.getProperty("preview.output.path", "preview/latest.jpg"));
        PreviewWriter preview = new PreviewWriter(pipeline::renderForDisplay, output, Duration.ofMillis(intervalMs));
        preview.start();
        return preview;
    }

    private static ConfigReloader startReloader(Properties appProps, InventoryPipeline pipeline) throws Exception {
        long intervalMs = Long.parseLong(appProps.getProperty("config.reload.interval.ms", "0").trim());
        Path configPath = ConfigLoader.resolveExternal(ConfigLoader.DEFAULT_FILE);
        if (intervalMs <= 0 || configPath == null) {
            return null;
        }
        ConfigReloader reloader = new ConfigReloader(configPath, pipeline);
        reloader.start(Duration.ofMillis(intervalMs));
        return reloader;
    }
}
