package com.bothsides.rostersync.model;

import java.util.Map;

/**
 * Summary counters for the sync engine.
 *
 * <p>{@code jobsByStrategy}, {@code jobsByPriority} and {@code averageJobDuration} are reported
 * as zero: they need persistent per-job counters that the engine does not keep.
 */
public record SyncEngineStats(
        int activeJobs,
        long totalJobsProcessed,
        long waitingJobs,
        long delayedJobs,
        long runningJobs,
        Map<SyncStrategy, Long> jobsByStrategy,
        Map<SyncPriority, Long> jobsByPriority,
        double averageJobDuration,
        double successRate,
        Map<String, RateLimitStatus> rateLimitStatus) {
}
