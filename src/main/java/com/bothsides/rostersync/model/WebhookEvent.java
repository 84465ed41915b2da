package com.bothsides.rostersync.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Inbound webhook event announcing a change to a single roster entity
 * in an external system
 */
public class WebhookEvent {

    private String id;
    private String integrationId;
    private String eventType;
    private String entityType;
    private String entityId;
    private WebhookAction action;
    private Map<String, Object> payload;
    private Map<String, String> headers;
    private String signature;
    private Instant receivedAt;

    public WebhookEvent() {
        this.payload = new HashMap<>();
        this.headers = new HashMap<>();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final WebhookEvent event = new WebhookEvent();

        public Builder id(String id) {
            event.id = id;
            return this;
        }

        public Builder integrationId(String integrationId) {
            event.integrationId = integrationId;
            return this;
        }

        public Builder eventType(String eventType) {
            event.eventType = eventType;
            return this;
        }

        public Builder entityType(String entityType) {
            event.entityType = entityType;
            return this;
        }

        public Builder entityId(String entityId) {
            event.entityId = entityId;
            return this;
        }

        public Builder action(WebhookAction action) {
            event.action = action;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            event.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
            return this;
        }

        public Builder addHeader(String name, String value) {
            event.headers.put(name, value);
            return this;
        }

        public Builder signature(String signature) {
            event.signature = signature;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            event.receivedAt = receivedAt;
            return this;
        }

        public WebhookEvent build() {
            return event;
        }
    }

    /**
     * Composite key used to deduplicate webhook persistence:
     * integration id, event id and receipt time in epoch milliseconds
     */
    public String idempotencyKey() {
        return integrationId + "_" + id + "_" + (receivedAt != null ? receivedAt.toEpochMilli() : 0L);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getIntegrationId() { return integrationId; }
    public void setIntegrationId(String integrationId) { this.integrationId = integrationId; }

    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }

    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }

    public String getEntityId() { return entityId; }
    public void setEntityId(String entityId) { this.entityId = entityId; }

    public WebhookAction getAction() { return action; }
    public void setAction(WebhookAction action) { this.action = action; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public Map<String, String> getHeaders() { return headers; }
    public void setHeaders(Map<String, String> headers) { this.headers = headers; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public Instant getReceivedAt() { return receivedAt; }
    public void setReceivedAt(Instant receivedAt) { this.receivedAt = receivedAt; }

    @Override
    public String toString() {
        return "WebhookEvent{" +
                "id='" + id + '\'' +
                ", integrationId='" + integrationId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", entity=" + entityType + ":" + entityId +
                ", action=" + action +
                ", receivedAt=" + receivedAt +
                '}';
    }
}
