package com.bothsides.rostersync.model;

import java.time.Instant;
import java.util.List;

/**
 * In-memory tracking entry for a job that has been handed to the queue
 * and has not yet reached a terminal state
 */
public record ActiveSyncJob(
        String jobId,
        String integrationId,
        SyncStrategy strategy,
        Instant startTime,
        List<String> entityTypes) {

    public ActiveSyncJob {
        entityTypes = entityTypes != null ? List.copyOf(entityTypes) : List.of();
    }
}
