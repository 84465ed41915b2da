package com.bothsides.rostersync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a sync job. Each level maps to a queue weight where
 * lower values are serviced first.
 */
public enum SyncPriority {
    LOW("low", 10),
    NORMAL("normal", 5),
    HIGH("high", 2),
    CRITICAL("critical", 1);

    private final String value;
    private final int weight;

    SyncPriority(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static SyncPriority fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SyncPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown sync priority: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
