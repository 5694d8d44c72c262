package com.foodinsight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {

    ADDED("SNACK_ADDED"),
    TAKEN("SNACK_TAKEN");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
