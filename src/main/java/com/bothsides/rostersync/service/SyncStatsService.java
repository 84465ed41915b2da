package com.bothsides.rostersync.service;

import com.bothsides.rostersync.model.SyncEngineStats;
import com.bothsides.rostersync.model.SyncPriority;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.queue.JobCounts;
import com.bothsides.rostersync.queue.SyncJobQueue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregates queue counters, job tracking and rate limiter state into one snapshot
 */
@Service
public class SyncStatsService {

    private final SyncJobQueue queue;
    private final SyncOrchestrationService orchestrationService;
    private final RateLimiterService rateLimiter;

    @Autowired
    public SyncStatsService(SyncJobQueue queue,
                            SyncOrchestrationService orchestrationService,
                            RateLimiterService rateLimiter) {
        this.queue = queue;
        this.orchestrationService = orchestrationService;
        this.rateLimiter = rateLimiter;
    }

    public Mono<SyncEngineStats> getSyncEngineStats() {
        return queue.getJobCounts().map(this::toStats);
    }

    private SyncEngineStats toStats(JobCounts counts) {
        long processed = counts.completed() + counts.failed();
        double successRate = processed > 0 ? (double) counts.completed() / processed * 100.0 : 0.0;

        return new SyncEngineStats(
                orchestrationService.getActiveJobCount(),
                processed,
                counts.waiting(),
                counts.delayed(),
                counts.active(),
                zeroCounts(SyncStrategy.class),
                zeroCounts(SyncPriority.class),
                0.0,
                successRate,
                rateLimiter.getStatusSnapshot());
    }

    private static <E extends Enum<E>> Map<E, Long> zeroCounts(Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E constant : type.getEnumConstants()) {
            counts.put(constant, 0L);
        }
        return counts;
    }
}
