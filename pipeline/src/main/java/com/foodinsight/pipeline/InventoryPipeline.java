package com.foodinsight.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.config.PipelineSettings;
import com.foodinsight.pipeline.model.FrameResult;
import com.foodinsight.pipeline.model.InventoryDelta;
import com.foodinsight.pipeline.model.InventoryEvent;
import com.foodinsight.pipeline.model.PipelineState;
import com.foodinsight.pipeline.model.PipelineStatus;
import com.foodinsight.pipeline.model.Region;
import com.foodinsight.pipeline.model.TrackedDetection;
import com.foodinsight.pipeline.observer.PipelineObserver;
import com.foodinsight.pipeline.service.DeltaBatcher;
import com.foodinsight.pipeline.service.DisplayComposer;
import com.foodinsight.pipeline.service.EventReconciler;
import com.foodinsight.pipeline.service.InvalidRegionException;
import com.foodinsight.pipeline.service.InventoryStateMachine;
import com.foodinsight.pipeline.service.MotionGate;
import com.foodinsight.pipeline.service.PrivacyRegionProjector;
import com.foodinsight.pipeline.tracking.DetectionValidator;
import com.foodinsight.pipeline.tracking.TrackingCapability;
import com.foodinsight.pipeline.tracking.TrackingException;

/**
 * Per-device pipeline context: crop, motion gate, tracking, projection, state
 * update and batching for one frame at a time.
 *
 * <p>{@link #processFrame} must only be called from one thread. The setters,
 * {@link #status()}, {@link #renderForDisplay()} and {@link #drain()} may be
 * called from any thread; configuration changes are staged and applied at the
 * start of the next frame.
 */
@Slf4j
public class InventoryPipeline implements AutoCloseable {

    private static final int FPS_WINDOW = 30;

    private final Clock clock;
    private final TrackingCapability tracker;
    private final PipelineObserver observer;
    private final PrivacyRegionProjector projector;
    private final MotionGate motionGate;
    private final InventoryStateMachine stateMachine;
    private final DeltaBatcher batcher;
    private final DisplayComposer composer = new DisplayComposer();
    private volatile ExecutorService trackingExecutor;
    private final Queue<Runnable> stagedUpdates = new ConcurrentLinkedQueue<>();
    private final Deque<Long> frameDurations = new ArrayDeque<>();
    private final Object displayLock = new Object();

    private volatile PipelineSettings settings;
    private volatile PipelineState state = PipelineState.INITIALIZING;
    private volatile List<TrackedDetection> lastDetections = List.of();
    private volatile Map<String, Integer> latestCounts = Map.of();
    private volatile Instant lastDetectionTime;
    private volatile long frameCount;
    private volatile long inferenceCount;
    private volatile long trackingFailures;
    private volatile double fps;
    private int frameSkipCounter;
    private Mat latestFrame;

    public InventoryPipeline(PipelineSettings settings, TrackingCapability tracker, PipelineObserver observer) {
        this(settings, tracker, observer, Clock.systemUTC());
    }

    public InventoryPipeline(PipelineSettings settings, TrackingCapability tracker, PipelineObserver observer, Clock clock) {
        this.settings = settings;
        this.tracker = tracker;
        this.observer = observer;
        this.clock = clock;
        this.projector = new PrivacyRegionProjector(settings.frameWidth(), settings.frameHeight(), settings.blurIntensity());
        if (settings.region() != null) {
            projector.setRegion(settings.region());
        }
        this.motionGate = new MotionGate(settings.motionThreshold(), settings.motionBlurSize(), settings.motionCooldownFrames());
        this.stateMachine = new InventoryStateMachine(settings.debounceThreshold(), clock);
        this.batcher = new DeltaBatcher(settings.machineId(), new EventReconciler(settings.reconcileWindow()), clock);
        this.trackingExecutor = settings.trackingTimeout().isZero() ? null : newTrackingExecutor(settings.machineId());
        log.info("Pipeline created for machine {}: roi={}, motionThreshold={}, debounce={}, tracker loaded={}",
            settings.machineId(), projector.getRegion().map(Region::toString).orElse("full frame"),
            settings.motionThreshold(), settings.debounceThreshold(), tracker.isLoaded());
    }

    /**
     * Runs one frame end to end. The frame stays owned by the caller.
     */
    public FrameResult processFrame(Mat frame) {
        long start = System.nanoTime();
        applyStagedUpdates();
        state = PipelineState.RUNNING;
        long frameNumber = ++frameCount;
        keepForDisplay(frame);

        frameSkipCounter++;
        if (frameSkipCounter < settings.processEveryNFrames()) {
            recordTiming(start);
            observer.onStatus(status());
            return FrameResult.skipped(frameNumber, lastDetections);
        }
        frameSkipCounter = 0;

        Region cropRegion = projector.effectiveRegion(frame).orElse(null);
        Mat cropped = projector.crop(frame, cropRegion);
        boolean releaseCrop = cropped != frame;
        try {
            if (!motionGate.shouldRunInference(cropped)) {
                return new FrameResult(frameNumber, false, false, false, lastDetections, List.of());
            }
            inferenceCount++;

            Mat trackerInput = cropped;
            if (trackingExecutor != null) {
                // the tracking task releases its input, also after a timeout
                trackerInput = releaseCrop ? cropped : cropped.clone();
                releaseCrop = false;
            }

            List<TrackedDetection> detections;
            boolean failed = false;
            try {
                detections = projector.projectDetections(filterAllowed(DetectionValidator.validate(invokeTracker(trackerInput))), cropRegion);
                lastDetectionTime = clock.instant();
            } catch (RuntimeException e) {
                failed = true;
                detections = onTrackingFailure(frameNumber, e);
            }

            List<InventoryEvent> events = stateMachine.update(detections);
            Map<String, Integer> counts = stateMachine.currentCounts();
            batcher.append(events, counts);
            latestCounts = counts;
            lastDetections = List.copyOf(detections);
            if (!events.isEmpty()) {
                observer.onEvents(events);
            }
            return new FrameResult(frameNumber, false, true, failed, lastDetections, events);
        } finally {
            if (releaseCrop) {
                cropped.release();
            }
            recordTiming(start);
            observer.onStatus(status());
        }
    }

    /**
     * Atomically takes the events accumulated since the previous drain.
     */
    public InventoryDelta drain() {
        return batcher.drain();
    }

    /**
     * Privacy-safe copy of the latest frame with detection overlays, or empty
     * before the first frame. The returned Mat belongs to the caller.
     */
    public Optional<Mat> renderForDisplay() {
        Mat copy;
        synchronized (displayLock) {
            if (latestFrame == null) {
                return Optional.empty();
            }
            copy = latestFrame.clone();
        }
        Mat display = projector.renderForDisplay(copy);
        if (display != copy) {
            copy.release();
        }
        composer.drawDetections(display, lastDetections);
        return Optional.of(display);
    }

    /**
     * @throws InvalidRegionException if the region is malformed; the current region stays
     */
    public void updateRegion(Region region) {
        if (region == null) {
            clearRegion();
            return;
        }
        String problem = region.validate(projector.getFrameWidth(), projector.getFrameHeight());
        if (problem != null) {
            log.warn("Region update {} rejected: {}", region, problem);
            throw new InvalidRegionException(region, problem);
        }
        stagedUpdates.add(() -> {
            projector.setRegion(region);
            motionGate.reset();
        });
    }

    public void clearRegion() {
        stagedUpdates.add(() -> {
            projector.clearRegion();
            motionGate.reset();
        });
    }

    public void updateMotionThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Motion threshold must be within [0, 1]: " + threshold);
        }
        stagedUpdates.add(() -> motionGate.setThreshold(threshold));
    }

    public void updateDebounceThreshold(int debounceThreshold) {
        if (debounceThreshold < 1) {
            throw new IllegalArgumentException("Debounce threshold must be at least 1: " + debounceThreshold);
        }
        stagedUpdates.add(() -> stateMachine.setDebounceThreshold(debounceThreshold));
    }

    /**
     * Applies reloaded settings at the next frame boundary. Region, thresholds,
     * frame skipping and the class allow-list change live; the rest needs a restart.
     *
     * @throws InvalidRegionException if the new region is malformed; nothing is applied
     */
    public void applySettings(PipelineSettings newSettings) {
        Region region = newSettings.region();
        if (region != null) {
            String problem = region.validate(projector.getFrameWidth(), projector.getFrameHeight());
            if (problem != null) {
                throw new InvalidRegionException(region, problem);
            }
        }
        PipelineSettings current = settings;
        if (current.frameWidth() != newSettings.frameWidth() || current.frameHeight() != newSettings.frameHeight()
            || current.blurIntensity() != newSettings.blurIntensity()
            || current.motionBlurSize() != newSettings.motionBlurSize()
            || current.motionCooldownFrames() != newSettings.motionCooldownFrames()
            || !current.trackingTimeout().equals(newSettings.trackingTimeout())
            || !current.reconcileWindow().equals(newSettings.reconcileWindow())
            || !current.machineId().equals(newSettings.machineId())) {
            log.warn("Some changed settings only take effect after a restart");
        }
        stagedUpdates.add(() -> {
            if (region == null) {
                projector.clearRegion();
            } else {
                projector.setRegion(region);
            }
            motionGate.setThreshold(newSettings.motionThreshold());
            motionGate.reset();
            stateMachine.setDebounceThreshold(newSettings.debounceThreshold());
            settings = newSettings;
            log.info("Configuration reloaded");
        });
    }

    /**
     * Seeds the inventory from an external baseline at the next frame boundary.
     */
    public void restoreInventory(Map<String, Integer> baseline, Map<Integer, String> knownTracks) {
        Map<String, Integer> counts = new TreeMap<>(baseline);
        Map<Integer, String> tracks = new TreeMap<>(knownTracks);
        stagedUpdates.add(() -> {
            stateMachine.restore(counts, tracks);
            latestCounts = stateMachine.currentCounts();
            batcher.append(List.of(), latestCounts);
        });
    }

    /**
     * Clears inventory, motion baseline and pending events at the next frame boundary.
     */
    public void reset() {
        stagedUpdates.add(() -> {
            stateMachine.reset();
            motionGate.reset();
            batcher.clear();
            lastDetections = List.of();
            latestCounts = Map.of();
        });
    }

    public PipelineStatus status() {
        return new PipelineStatus(state, Math.round(fps * 10) / 10.0, frameCount, inferenceCount, trackingFailures,
            lastDetectionTime, motionGate.isActive(), motionGate.lastMotionScore(), latestCounts);
    }

    public Map<String, Integer> currentInventory() {
        return latestCounts;
    }

    public List<TrackedDetection> lastDetections() {
        return lastDetections;
    }

    public Optional<Region> currentRegion() {
        return projector.getRegion();
    }

    public PipelineSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        state = PipelineState.STOPPED;
        if (trackingExecutor != null) {
            trackingExecutor.shutdownNow();
        }
        tracker.close();
        motionGate.close();
        synchronized (displayLock) {
            if (latestFrame != null) {
                latestFrame.release();
                latestFrame = null;
            }
        }
        log.info("Pipeline for machine {} stopped after {} frames", settings.machineId(), frameCount);
    }

    private void applyStagedUpdates() {
        Runnable update;
        while ((update = stagedUpdates.poll()) != null) {
            update.run();
        }
    }

    /**
     * Runs the tracker inline, or on the tracking executor when a timeout is
     * configured. In the latter case the image is owned and released by the task.
     */
    private List<TrackedDetection> invokeTracker(Mat image) {
        ExecutorService executor = trackingExecutor;
        if (executor == null) {
            return tracker.track(image);
        }
        Duration timeout = settings.trackingTimeout();
        AtomicBoolean claimed = new AtomicBoolean();
        Future<List<TrackedDetection>> future;
        try {
            future = executor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return List.of();
                }
                try {
                    return tracker.track(image);
                } finally {
                    image.release();
                }
            });
        } catch (RejectedExecutionException e) {
            image.release();
            throw new TrackingException("Tracking executor is shut down", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (claimed.compareAndSet(false, true)) {
                image.release();
            }
            replaceTrackingExecutor(executor);
            throw new TrackingException("Tracking timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            throw new TrackingException("Tracking failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackingException("Interrupted while waiting for tracking", e);
        }
    }

    /**
     * A tracker that ignores interruption keeps its thread busy; later frames
     * get a fresh thread instead of queueing behind it.
     */
    private void replaceTrackingExecutor(ExecutorService stuck) {
        stuck.shutdownNow();
        trackingExecutor = newTrackingExecutor(settings.machineId());
        log.warn("Tracking executor replaced after a timed-out call");
    }

    private static ExecutorService newTrackingExecutor(String machineId) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tracking-" + machineId);
            t.setDaemon(true);
            return t;
        });
    }

    private List<TrackedDetection> filterAllowed(List<TrackedDetection> detections) {
        PipelineSettings current = settings;
        if (current.allowedClasses().isEmpty()) {
            return detections;
        }
        List<TrackedDetection> allowed = new ArrayList<>(detections.size());
        for (TrackedDetection detection : detections) {
            if (current.isAllowed(detection.getClassName())) {
                allowed.add(detection);
            }
        }
        return allowed;
    }

    private List<TrackedDetection> onTrackingFailure(long frameNumber, RuntimeException e) {
        trackingFailures++;
        try {
            observer.onTrackingFailure(frameNumber, e);
        } catch (RuntimeException observerError) {
            log.error("Observer failed while reporting tracking failure on frame {}", frameNumber, observerError);
        }
        return lastDetections;
    }

    private void keepForDisplay(Mat frame) {
        synchronized (displayLock) {
            if (latestFrame == null) {
                latestFrame = new Mat();
            }
            frame.copyTo(latestFrame);
        }
    }

    private void recordTiming(long startNanos) {
        frameDurations.addLast(System.nanoTime() - startNanos);
        if (frameDurations.size() > FPS_WINDOW) {
            frameDurations.removeFirst();
        }
        long total = 0;
        for (long d : frameDurations) {
            total += d;
        }
        fps = total > 0 ? frameDurations.size() * 1_000_000_000.0 / total : 0.0;
    }
}
