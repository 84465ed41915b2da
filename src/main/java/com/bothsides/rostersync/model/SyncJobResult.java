package com.bothsides.rostersync.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform result of a sync job, whatever strategy produced it
 */
public class SyncJobResult {

    private final String jobId;
    private final String integrationId;
    private final SyncStrategy strategy;
    private final List<String> entityTypes;
    private final Instant startTime;
    private final Instant endTime;
    private final long durationMs;
    private final boolean success;
    private final List<SyncOperationResult> results;
    private final SyncSummary summary;
    private final List<String> errors;
    private final Map<String, Object> metadata;

    private SyncJobResult(Builder builder) {
        this.jobId = builder.jobId;
        this.integrationId = builder.integrationId;
        this.strategy = builder.strategy;
        this.entityTypes = List.copyOf(builder.entityTypes);
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.durationMs = Duration.between(builder.startTime, builder.endTime).toMillis();
        this.success = builder.success;
        this.results = List.copyOf(builder.results);
        this.summary = builder.summary;
        this.errors = List.copyOf(builder.errors);
        this.metadata = Map.copyOf(builder.metadata);
    }

    public static Builder builder(String jobId, String integrationId, SyncStrategy strategy) {
        return new Builder(jobId, integrationId, strategy);
    }

    // Getters
    public String getJobId() { return jobId; }
    public String getIntegrationId() { return integrationId; }
    public SyncStrategy getStrategy() { return strategy; }
    public List<String> getEntityTypes() { return entityTypes; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public long getDurationMs() { return durationMs; }
    public boolean isSuccess() { return success; }
    public List<SyncOperationResult> getResults() { return results; }
    public SyncSummary getSummary() { return summary; }
    public List<String> getErrors() { return errors; }
    public Map<String, Object> getMetadata() { return metadata; }

    public String getFirstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    public static class Builder {
        private final String jobId;
        private final String integrationId;
        private final SyncStrategy strategy;
        private List<String> entityTypes = List.of();
        private Instant startTime = Instant.now();
        private Instant endTime;
        private boolean success = true;
        private List<SyncOperationResult> results = new ArrayList<>();
        private SyncSummary summary = SyncSummary.empty();
        private final List<String> errors = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String jobId, String integrationId, SyncStrategy strategy) {
            this.jobId = jobId;
            this.integrationId = integrationId;
            this.strategy = strategy;
        }

        public Builder entityTypes(List<String> entityTypes) {
            this.entityTypes = entityTypes != null ? entityTypes : List.of();
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder results(List<SyncOperationResult> results) {
            this.results = new ArrayList<>(results);
            return this;
        }

        public Builder summary(SyncSummary summary) {
            this.summary = summary != null ? summary : SyncSummary.empty();
            return this;
        }

        public Builder addError(String error) {
            this.errors.add(error != null ? error : "Unknown error");
            this.success = false;
            return this;
        }

        public Builder addMetadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public SyncJobResult build() {
            if (endTime == null) {
                endTime = Instant.now();
            }
            return new SyncJobResult(this);
        }
    }

    @Override
    public String toString() {
        return "SyncJobResult{" +
                "jobId='" + jobId + '\'' +
                ", integrationId='" + integrationId + '\'' +
                ", strategy=" + strategy +
                ", success=" + success +
                ", summary=" + summary +
                ", durationMs=" + durationMs +
                ", errors=" + errors +
                '}';
    }
}
