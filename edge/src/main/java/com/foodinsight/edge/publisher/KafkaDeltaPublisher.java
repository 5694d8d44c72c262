package com.foodinsight.edge.publisher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;

import com.foodinsight.pipeline.model.InventoryDelta;

/**
 * Drains inventory deltas on its own schedule and sends them to Kafka as JSON.
 *
 * <p>A delta that cannot be delivered stays in a bounded backlog and is retried
 * first on the next cycle, so events are delivered at least once while the
 * backlog has room.
 */
@Slf4j
public class KafkaDeltaPublisher implements AutoCloseable {

    static final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Supplier<InventoryDelta> deltaSource;
    private final Producer<String, String> producer;
    private final PublisherSettings settings;
    private final Deque<InventoryDelta> backlog = new ArrayDeque<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "delta-publisher");
        t.setDaemon(true);
        return t;
    });

    private long published;
    private long dropped;

    public KafkaDeltaPublisher(Supplier<InventoryDelta> deltaSource, Producer<String, String> producer,
                               PublisherSettings settings) {
        this.deltaSource = deltaSource;
        this.producer = producer;
        this.settings = settings;
    }

    public void start() {
        long intervalMs = settings.batchInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Delta publisher started: topic={}, interval={} ms", settings.topic(), intervalMs);
    }

    /**
     * One drain-and-send cycle.
     *
     * @return number of deltas delivered in this cycle
     */
    public synchronized int publishPending() {
        InventoryDelta delta = deltaSource.get();
        if (!delta.isEmpty() || settings.publishEmpty()) {
            backlog.addLast(delta);
            while (backlog.size() > settings.maxBacklog()) {
                InventoryDelta oldest = backlog.removeFirst();
                dropped++;
                log.error("Delta backlog full, dropping delta from {} with {} events",
                    oldest.getTimestamp(), oldest.getEvents().size());
            }
        }

        int delivered = 0;
        while (!backlog.isEmpty()) {
            InventoryDelta head = backlog.peekFirst();
            if (!send(head)) {
                log.warn("{} deltas waiting for the next publish cycle", backlog.size());
                break;
            }
            backlog.removeFirst();
            delivered++;
            published++;
        }
        return delivered;
    }

    public synchronized int backlogSize() {
        return backlog.size();
    }

    public synchronized long publishedCount() {
        return published;
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(settings.sendTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        publishPending();
        if (backlogSize() > 0) {
            log.error("Shutting down with {} undelivered deltas", backlogSize());
        }
        producer.close();
        log.info("Delta publisher closed: published={}, dropped={}", publishedCount(), droppedCount());
    }

    static String toJson(InventoryDelta delta) throws JsonProcessingException {
        return objectMapper.writeValueAsString(delta);
    }

    private void runCycle() {
        try {
            publishPending();
        } catch (RuntimeException e) {
            log.error("Delta publish cycle failed", e);
        }
    }

    private boolean send(InventoryDelta delta) {
        String json;
        try {
            json = toJson(delta);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise delta, discarding it", e);
            return true;
        }
        try {
            RecordMetadata rm = producer.send(new ProducerRecord<>(settings.topic(), delta.getMachineId(), json))
                .get(settings.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Delta pushed: {} events, {} items (topic={}, partition={})",
                delta.getEvents().size(), delta.getCounts().size(), rm.topic(), rm.partition());
            return true;
        } catch (ExecutionException e) {
            log.error("Error pushing delta for machine {}", delta.getMachineId(), e.getCause());
        } catch (TimeoutException e) {
            log.error("Timed out pushing delta for machine {} after {} ms",
                delta.getMachineId(), settings.sendTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pushing delta for machine {}", delta.getMachineId());
        } catch (RuntimeException e) {
            log.error("Error pushing delta for machine {}", delta.getMachineId(), e);
        }
        return false;
    }
}
