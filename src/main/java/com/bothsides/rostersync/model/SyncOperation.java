package com.bothsides.rostersync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome kind of a single provider operation
 */
public enum SyncOperation {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    SKIP("skip");

    private final String value;

    SyncOperation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SyncOperation fromValue(String value) {
        for (SyncOperation operation : values()) {
            if (operation.value.equalsIgnoreCase(value)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown sync operation: " + value);
    }
}
