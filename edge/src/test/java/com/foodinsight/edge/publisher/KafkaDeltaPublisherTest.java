package com.foodinsight.edge.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Future;

import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.foodinsight.pipeline.model.EventType;
import com.foodinsight.pipeline.model.InventoryDelta;
import com.foodinsight.pipeline.model.InventoryEvent;

class KafkaDeltaPublisherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final PublisherSettings SETTINGS =
        new PublisherSettings("localhost:9092", "inventory-deltas", Duration.ofSeconds(1), Duration.ofSeconds(1), 3, false);

    private final Deque<InventoryDelta> deltas = new ArrayDeque<>();

    private InventoryDelta nextDelta() {
        InventoryDelta delta = deltas.pollFirst();
        return delta != null ? delta : new InventoryDelta("vm-1", NOW, Map.of("chips", 4), List.of());
    }

    private static InventoryDelta takenDelta(int trackId) {
        InventoryEvent taken = new InventoryEvent(EventType.TAKEN, "chips", NOW, trackId, 5, 4);
        return new InventoryDelta("vm-1", NOW, Map.of("chips", 4, "candy", 2), List.of(taken));
    }

    /**
     * Producer whose sends fail while {@code failing} is set.
     */
    static class FlakyProducer extends MockProducer<String, String> {
        boolean failing;

        FlakyProducer() {
            super(true, new StringSerializer(), new StringSerializer());
        }

        @Override
        public synchronized Future<RecordMetadata> send(ProducerRecord<String, String> record, Callback callback) {
            if (failing) {
                throw new KafkaException("broker unavailable");
            }
            return super.send(record, callback);
        }
    }

    @Test
    void publishesDeltaAsJsonKeyedByMachine() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, SETTINGS);
        deltas.add(takenDelta(3));

        assertEquals(1, publisher.publishPending());

        List<ProducerRecord<String, String>> sent = producer.history();
        assertEquals(1, sent.size());
        assertEquals("inventory-deltas", sent.get(0).topic());
        assertEquals("vm-1", sent.get(0).key());

        JsonNode json = new ObjectMapper().readTree(sent.get(0).value());
        assertEquals("vm-1", json.get("machine_id").asText());
        assertEquals("2026-01-15T10:00:00Z", json.get("timestamp").asText());
        assertEquals(4, json.get("items").get("chips").get("count").asInt());
        assertEquals(1.0, json.get("items").get("chips").get("confidence").asDouble(), 1e-9);
        assertEquals(2, json.get("items").get("candy").get("count").asInt());
        JsonNode event = json.get("events").get(0);
        assertEquals("SNACK_TAKEN", event.get("type").asText());
        assertEquals("chips", event.get("item").asText());
        assertEquals(3, event.get("track_id").asInt());
        assertEquals(5, event.get("count_before").asInt());
        assertEquals(4, event.get("count_after").asInt());
        assertTrue(json.get("counts") == null);
        assertEquals(1, publisher.publishedCount());
    }

    @Test
    void emptyDeltasAreNotSentByDefault() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, SETTINGS);

        assertEquals(0, publisher.publishPending());
        assertTrue(producer.history().isEmpty());
    }

    @Test
    void emptyDeltasAreSentWhenConfigured() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        PublisherSettings heartbeat =
            new PublisherSettings("localhost:9092", "inventory-deltas", Duration.ofSeconds(1), Duration.ofSeconds(1), 3, true);
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, heartbeat);

        assertEquals(1, publisher.publishPending());
        assertEquals(1, producer.history().size());
    }

    @Test
    void failedDeltaIsRetriedFirstOnNextCycle() throws Exception {
        FlakyProducer producer = new FlakyProducer();
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, SETTINGS);

        producer.failing = true;
        deltas.add(takenDelta(1));
        assertEquals(0, publisher.publishPending());
        assertEquals(1, publisher.backlogSize());

        producer.failing = false;
        deltas.add(takenDelta(2));
        assertEquals(2, publisher.publishPending());
        assertEquals(0, publisher.backlogSize());

        ObjectMapper mapper = new ObjectMapper();
        assertEquals(1, mapper.readTree(producer.history().get(0).value()).get("events").get(0).get("track_id").asInt());
        assertEquals(2, mapper.readTree(producer.history().get(1).value()).get("events").get(0).get("track_id").asInt());
    }

    @Test
    void backlogDropsOldestWhenFull() throws Exception {
        FlakyProducer producer = new FlakyProducer();
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, SETTINGS);

        producer.failing = true;
        for (int i = 1; i <= 5; i++) {
            deltas.add(takenDelta(i));
            publisher.publishPending();
        }
        assertEquals(3, publisher.backlogSize());
        assertEquals(2, publisher.droppedCount());

        producer.failing = false;
        assertEquals(3, publisher.publishPending());
        assertEquals(3, new ObjectMapper().readTree(producer.history().get(0).value())
            .get("events").get(0).get("track_id").asInt());
    }

    @Test
    void closeFlushesPendingDelta() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDeltaPublisher publisher = new KafkaDeltaPublisher(this::nextDelta, producer, SETTINGS);
        deltas.add(takenDelta(1));

        publisher.close();

        assertEquals(1, producer.history().size());
        assertTrue(producer.closed());
    }

    @Test
    void producerPropertiesPassThroughOverrides() {
        Properties app = new Properties();
        app.setProperty("kafka.bootstrap.servers", "broker:9093");
        app.setProperty("kafka.producer.client.id", "edge-7");

        Properties kafka = PublisherSettings.producerProperties(app);

        assertEquals("broker:9093", kafka.getProperty("bootstrap.servers"));
        assertEquals("edge-7", kafka.getProperty("client.id"));
        assertEquals("all", kafka.getProperty("acks"));
    }
}
