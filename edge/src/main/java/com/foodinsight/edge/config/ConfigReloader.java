package com.foodinsight.edge.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.InventoryPipeline;
import com.foodinsight.pipeline.config.PipelineSettings;

/**
 * Watches the external configuration file and hands changed settings to the
 * pipeline, which applies them between frames.
 */
@Slf4j
public class ConfigReloader implements AutoCloseable {

    private final Path configPath;
    private final InventoryPipeline pipeline;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "config-reloader");
        t.setDaemon(true);
        return t;
    });
    private FileTime lastModified;

    public ConfigReloader(Path configPath, InventoryPipeline pipeline) throws IOException {
        this.configPath = configPath;
        this.pipeline = pipeline;
        this.lastModified = Files.getLastModifiedTime(configPath);
    }

    public void start(Duration interval) {
        scheduler.scheduleWithFixedDelay(this::checkSafely, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Watching {} for configuration changes", configPath.toAbsolutePath());
    }

    /**
     * @return true if the file changed and the new settings were accepted
     */
    public synchronized boolean checkForChanges() throws IOException {
        FileTime modified = Files.getLastModifiedTime(configPath);
        if (modified.equals(lastModified)) {
            return false;
        }
        lastModified = modified;
        Properties props = new Properties();
        try (InputStream input = Files.newInputStream(configPath)) {
            props.load(input);
        }
        try {
            pipeline.applySettings(PipelineSettings.fromProperties(props));
            log.info("Configuration change in {} staged", configPath);
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring configuration change in {}: {}", configPath, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void checkSafely() {
        try {
            checkForChanges();
        } catch (IOException e) {
            log.warn("Failed to read configuration file {}", configPath, e);
        }
    }
}
