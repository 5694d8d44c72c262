package com.foodinsight.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * Batch of inventory events plus the counts snapshot taken with them.
 * Serialises to the backend's inventory update shape.
 */
@Value
public class InventoryDelta {

    @JsonProperty("machine_id")
    String machineId;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    @JsonIgnore
    Map<String, Integer> counts;

    @JsonProperty("events")
    List<InventoryEvent> events;

    public InventoryDelta(String machineId, Instant timestamp, Map<String, Integer> counts, List<InventoryEvent> events) {
        this.machineId = machineId;
        this.timestamp = timestamp;
        this.counts = Collections.unmodifiableMap(new TreeMap<>(counts));
        this.events = List.copyOf(events);
    }

    @JsonProperty("items")
    public Map<String, ItemCount> getItems() {
        Map<String, ItemCount> items = new LinkedHashMap<>();
        counts.forEach((item, count) -> items.put(item, new ItemCount(count, 1.0)));
        return items;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return events.isEmpty();
    }

    public record ItemCount(@JsonProperty("count") int count, @JsonProperty("confidence") double confidence) {
    }
}
