package com.bothsides.rostersync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Synchronization strategy of a sync job.
 * Determines which provider operation a job invokes and which worker lane runs it.
 */
public enum SyncStrategy {
    FULL("full", "full-sync", 3),               // Complete roster pull
    INCREMENTAL("incremental", "incremental-sync", 5), // Changes since last successful sync
    REAL_TIME("real_time", "real-time-sync", 10),      // Single entity, triggered by webhook
    MANUAL("manual", "manual-sync", 2);         // Operator-triggered full pull

    private final String value;
    private final String jobName;
    private final int defaultConcurrency;

    SyncStrategy(String value, String jobName, int defaultConcurrency) {
        this.value = value;
        this.jobName = jobName;
        this.defaultConcurrency = defaultConcurrency;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Queue job name, e.g. {@code full-sync}
     */
    public String getJobName() {
        return jobName;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    @JsonCreator
    public static SyncStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SyncStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown sync strategy: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
