package com.bothsides.rostersync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable request to run a sync job against one integration.
 * Never mutated after submission.
 */
public class SyncJobConfig {

    private final String integrationId;
    private final SyncStrategy strategy;
    private final List<String> entityTypes;
    private final SyncPriority priority;
    private final Integer batchSize;
    private final Integer maxRetries;
    private final Long timeoutMs;
    private final Long scheduleDelayMs;
    private final Map<String, Object> metadata;
    private final WebhookEvent webhookEvent;

    private SyncJobConfig(Builder builder) {
        this.integrationId = builder.integrationId;
        this.strategy = builder.strategy;
        this.entityTypes = List.copyOf(builder.entityTypes);
        this.priority = builder.priority;
        this.batchSize = builder.batchSize;
        this.maxRetries = builder.maxRetries;
        this.timeoutMs = builder.timeoutMs;
        this.scheduleDelayMs = builder.scheduleDelayMs;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.webhookEvent = builder.webhookEvent;
    }

    public static Builder builder(String integrationId, SyncStrategy strategy) {
        return new Builder(integrationId, strategy);
    }

    // Getters
    public String getIntegrationId() { return integrationId; }
    public SyncStrategy getStrategy() { return strategy; }
    public List<String> getEntityTypes() { return entityTypes; }
    public SyncPriority getPriority() { return priority; }
    public Integer getBatchSize() { return batchSize; }
    public Integer getMaxRetries() { return maxRetries; }
    public Long getTimeoutMs() { return timeoutMs; }
    public Long getScheduleDelayMs() { return scheduleDelayMs; }
    public Map<String, Object> getMetadata() { return metadata; }

    @JsonIgnore
    public WebhookEvent getWebhookEvent() { return webhookEvent; }

    public boolean isWebhookTriggered() {
        return webhookEvent != null;
    }

    public static class Builder {
        private final String integrationId;
        private final SyncStrategy strategy;
        private List<String> entityTypes = List.of();
        private SyncPriority priority = SyncPriority.NORMAL;
        private Integer batchSize;
        private Integer maxRetries;
        private Long timeoutMs;
        private Long scheduleDelayMs;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private WebhookEvent webhookEvent;

        private Builder(String integrationId, SyncStrategy strategy) {
            this.integrationId = integrationId;
            this.strategy = strategy;
        }

        public Builder entityTypes(List<String> entityTypes) {
            this.entityTypes = entityTypes != null ? entityTypes : List.of();
            return this;
        }

        public Builder priority(SyncPriority priority) {
            this.priority = priority != null ? priority : SyncPriority.NORMAL;
            return this;
        }

        public Builder batchSize(Integer batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder scheduleDelayMs(Long scheduleDelayMs) {
            this.scheduleDelayMs = scheduleDelayMs;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder addMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder webhookEvent(WebhookEvent webhookEvent) {
            this.webhookEvent = webhookEvent;
            return this;
        }

        public SyncJobConfig build() {
            return new SyncJobConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SyncJobConfig{" +
                "integrationId='" + integrationId + '\'' +
                ", strategy=" + strategy +
                ", entityTypes=" + entityTypes +
                ", priority=" + priority +
                ", maxRetries=" + maxRetries +
                ", timeoutMs=" + timeoutMs +
                ", scheduleDelayMs=" + scheduleDelayMs +
                '}';
    }
}
