package com.bothsides.rostersync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WebhookAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    WebhookAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup: unrecognized values resolve to {@code null} so that
     * webhook validation can reject them with a domain error.
     */
    @JsonCreator
    public static WebhookAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (WebhookAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
