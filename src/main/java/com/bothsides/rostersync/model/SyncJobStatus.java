package com.bothsides.rostersync.model;

import com.bothsides.rostersync.queue.JobState;

import java.time.Instant;

/**
 * Materialized view of a queued sync job for status polling
 */
public record SyncJobStatus(
        String id,
        JobState state,
        int progress,
        int attemptsMade,
        SyncJobConfig data,
        SyncJobResult result,
        String failedReason,
        Instant processedOn,
        Instant finishedOn) {
}
