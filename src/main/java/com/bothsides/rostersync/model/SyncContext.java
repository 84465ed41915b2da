package com.bothsides.rostersync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context information for one sync job invocation.
 * Created at scheduling time and handed to the strategy processor and the provider.
 */
public class SyncContext {

    private final String syncId;
    private final String integrationId;
    private final Instant startTime;
    private final Map<String, Object> metadata;

    public SyncContext(String syncId, String integrationId, Instant startTime, Map<String, Object> metadata) {
        this.syncId = syncId;
        this.integrationId = integrationId;
        this.startTime = startTime;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Builds the context for a scheduled job: the config's free-form metadata
     * plus its strategy, entity types and priority
     */
    public static SyncContext forJob(String jobId, SyncJobConfig config, Instant startTime) {
        Map<String, Object> metadata = new LinkedHashMap<>(config.getMetadata());
        metadata.put("strategy", config.getStrategy().getValue());
        metadata.put("entityTypes", config.getEntityTypes());
        metadata.put("priority", config.getPriority().getValue());
        return new SyncContext(jobId, config.getIntegrationId(), startTime, metadata);
    }

    // Getters
    public String getSyncId() { return syncId; }
    public String getIntegrationId() { return integrationId; }
    public Instant getStartTime() { return startTime; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "SyncContext{" +
                "syncId='" + syncId + '\'' +
                ", integrationId='" + integrationId + '\'' +
                ", startTime=" + startTime +
                ", metadata=" + metadata +
                '}';
    }
}
