package com.foodinsight.pipeline.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import com.foodinsight.pipeline.model.Region;
import com.foodinsight.pipeline.service.InventoryStateMachine;
import com.foodinsight.pipeline.service.MotionGate;
import com.foodinsight.pipeline.service.PrivacyRegionProjector;

/**
 * Typed view of the pipeline properties. Unset keys fall back to the defaults
 * tuned for a desktop-class edge device.
 */
public record PipelineSettings(
    String machineId,
    int frameWidth,
    int frameHeight,
    Region region,
    int blurIntensity,
    double motionThreshold,
    int motionBlurSize,
    int motionCooldownFrames,
    int debounceThreshold,
    int processEveryNFrames,
    Set<String> allowedClasses,
    Duration trackingTimeout,
    Duration reconcileWindow) {

    public static final String DEFAULT_ALLOWED_CLASSES =
        "bottle,wine glass,cup,fork,knife,spoon,bowl,banana,apple,sandwich,orange,"
            + "broccoli,carrot,hot dog,pizza,donut,cake";

    public PipelineSettings {
        if (machineId == null || machineId.isBlank()) {
            throw new IllegalArgumentException("machine.id must be provided");
        }
        if (processEveryNFrames < 1) {
            throw new IllegalArgumentException("detection.process.every.n.frames must be at least 1: " + processEveryNFrames);
        }
        allowedClasses = Set.copyOf(allowedClasses);
    }

    public static PipelineSettings defaults() {
        return fromProperties(new Properties());
    }

    public static PipelineSettings fromProperties(Properties props) {
        return new PipelineSettings(
            props.getProperty("machine.id", "foodinsight-edge-001").trim(),
            Integer.parseInt(props.getProperty("camera.frame.width", "1280").trim()),
            Integer.parseInt(props.getProperty("camera.frame.height", "720").trim()),
            parseRegion(props.getProperty("privacy.roi", "")),
            Integer.parseInt(props.getProperty("privacy.blur.intensity",
                String.valueOf(PrivacyRegionProjector.DEFAULT_BLUR_INTENSITY)).trim()),
            Double.parseDouble(props.getProperty("motion.threshold",
                String.valueOf(MotionGate.DEFAULT_THRESHOLD)).trim()),
            Integer.parseInt(props.getProperty("motion.blur.size",
                String.valueOf(MotionGate.DEFAULT_BLUR_SIZE)).trim()),
            Integer.parseInt(props.getProperty("motion.cooldown.frames", "0").trim()),
            Integer.parseInt(props.getProperty("inventory.debounce.frames",
                String.valueOf(InventoryStateMachine.DEFAULT_DEBOUNCE_THRESHOLD)).trim()),
            Integer.parseInt(props.getProperty("detection.process.every.n.frames", "1").trim()),
            parseClasses(props.getProperty("detection.allowed.classes", DEFAULT_ALLOWED_CLASSES)),
            Duration.ofMillis(Long.parseLong(props.getProperty("tracking.timeout.ms", "0").trim())),
            Duration.ofMillis(Long.parseLong(props.getProperty("inventory.reconcile.window.ms", "0").trim())));
    }

    /**
     * Parses {@code x1,y1,x2,y2}; blank means full frame.
     */
    public static Region parseRegion(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("privacy.roi must be x1,y1,x2,y2 but was: " + value);
        }
        int[] coords = Arrays.stream(parts).map(String::trim).mapToInt(Integer::parseInt).toArray();
        return new Region(coords[0], coords[1], coords[2], coords[3]);
    }

    /**
     * Parses {@code item:count} pairs separated by commas, e.g. {@code chips:5,candy:2}.
     */
    public static Map<String, Integer> parseBaseline(String value) {
        Map<String, Integer> baseline = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return baseline;
        }
        for (String entry : value.split(",")) {
            int sep = entry.lastIndexOf(':');
            if (sep <= 0) {
                throw new IllegalArgumentException("inventory.baseline entries must be item:count but got: " + entry);
            }
            int count = Integer.parseInt(entry.substring(sep + 1).trim());
            if (count < 0) {
                throw new IllegalArgumentException("Negative baseline count in: " + entry);
            }
            baseline.put(entry.substring(0, sep).trim(), count);
        }
        return baseline;
    }

    private static Set<String> parseClasses(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Empty allow-list means every class is reported.
     */
    public boolean isAllowed(String className) {
        return allowedClasses.isEmpty() || allowedClasses.contains(className);
    }
}
