package com.foodinsight.pipeline.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class InventoryEvent {

    @JsonProperty("type")
    EventType type;

    @JsonProperty("item")
    String item;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    @JsonProperty("track_id")
    int trackId;

    @JsonProperty("count_before")
    int countBefore;

    @JsonProperty("count_after")
    int countAfter;
}
