package com.bothsides.rostersync.service;

import com.bothsides.rostersync.exception.IntegrationInactiveException;
import com.bothsides.rostersync.exception.RateLimitExceededException;
import com.bothsides.rostersync.model.ActiveSyncJob;
import com.bothsides.rostersync.model.SyncAuditStatus;
import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobStatus;
import com.bothsides.rostersync.queue.JobOptions;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.queue.SyncJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service for scheduling, cancelling and inspecting sync jobs
 */
@Service
public class SyncOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrationService.class);

    static final int DEFAULT_ATTEMPTS = 3;
    static final long DEFAULT_TIMEOUT_MS = 300_000L;

    private final SyncJobQueue queue;
    private final IntegrationService integrationService;
    private final RateLimiterService rateLimiter;
    private final SyncAuditService auditService;
    private final Clock clock;

    // Jobs scheduled and not yet finished, keyed by job id
    private final Map<String, ActiveSyncJob> activeJobs = new ConcurrentHashMap<>();
    private final AtomicLong lastJobTimestamp = new AtomicLong();

    @Autowired
    public SyncOrchestrationService(SyncJobQueue queue,
                                    IntegrationService integrationService,
                                    RateLimiterService rateLimiter,
                                    SyncAuditService auditService,
                                    Clock clock) {
        this.queue = queue;
        this.integrationService = integrationService;
        this.rateLimiter = rateLimiter;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Validate the integration, apply admission control and enqueue the job.
     *
     * @return the new job id
     */
    public Mono<String> scheduleSyncJob(SyncJobConfig config) {
        String integrationId = config.getIntegrationId();

        return integrationService.findActive(integrationId)
                .switchIfEmpty(Mono.error(() -> new IntegrationInactiveException(integrationId)))
                .flatMap(integration -> rateLimiter.tryAcquire(integrationId, integrationService.getRateLimits(integration)))
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        return Mono.error(new RateLimitExceededException(integrationId, decision.nextAvailableTime()));
                    }
                    return enqueue(config);
                })
                .doOnSuccess(jobId -> logger.info("Scheduled {} sync job {} for integration {}",
                        config.getStrategy().getValue(), jobId, integrationId))
                .doOnError(error -> logger.warn("Failed to schedule {} sync for integration {}: {}",
                        config.getStrategy().getValue(), integrationId, error.getMessage()));
    }

    private Mono<String> enqueue(SyncJobConfig config) {
        Instant now = clock.instant();
        String jobId = nextJobId(config, now);
        SyncContext context = SyncContext.forJob(jobId, config, now);
        JobOptions options = new JobOptions(
                config.getPriority().getWeight(),
                config.getScheduleDelayMs() != null ? config.getScheduleDelayMs() : 0L,
                config.getMaxRetries() != null ? config.getMaxRetries() : DEFAULT_ATTEMPTS,
                config.getTimeoutMs() != null ? config.getTimeoutMs() : DEFAULT_TIMEOUT_MS);

        // Tracked before submission so a fast completion cannot race the insert
        activeJobs.put(jobId, new ActiveSyncJob(jobId, config.getIntegrationId(), config.getStrategy(),
                now, config.getEntityTypes()));

        return queue.submit(jobId, config, context, options)
                .doOnError(error -> activeJobs.remove(jobId))
                .then(Mono.defer(() -> auditService.recordSyncJob(jobId, config, SyncAuditStatus.SCHEDULED, null)))
                .thenReturn(jobId);
    }

    /**
     * Remove a job from the queue and from tracking.
     *
     * @return true if the job existed and was removed; errors are logged and reported as false
     */
    public Mono<Boolean> cancelSyncJob(String jobId) {
        return queue.getJob(jobId)
                .flatMap(job -> queue.remove(jobId)
                        .flatMap(removed -> {
                            removeTracking(jobId);
                            if (!removed) {
                                return Mono.just(false);
                            }
                            logger.info("Cancelled sync job {}", jobId);
                            return auditService.recordSyncJob(jobId, job.getConfig(), SyncAuditStatus.CANCELLED, null)
                                    .thenReturn(true);
                        }))
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    logger.error("Failed to cancel sync job {}: {}", jobId, error.getMessage(), error);
                    return Mono.just(false);
                });
    }

    /**
     * Current view of a job, empty if the queue no longer holds it
     */
    public Mono<SyncJobStatus> getSyncJobStatus(String jobId) {
        return queue.getJob(jobId).map(QueuedSyncJob::toStatus);
    }

    public Flux<ActiveSyncJob> getActiveSyncJobs(String integrationId) {
        return Flux.fromStream(() -> activeJobs.values().stream()
                .filter(job -> job.integrationId().equals(integrationId))
                .sorted(Comparator.comparing(ActiveSyncJob::startTime).thenComparing(ActiveSyncJob::jobId)));
    }

    public Flux<ActiveSyncJob> getAllActiveSyncJobs() {
        return Flux.fromStream(() -> activeJobs.values().stream()
                .sorted(Comparator.comparing(ActiveSyncJob::startTime).thenComparing(ActiveSyncJob::jobId)));
    }

    public int getActiveJobCount() {
        return activeJobs.size();
    }

    /**
     * Drop the job from tracking. Safe to call for unknown ids.
     */
    public void removeTracking(String jobId) {
        if (activeJobs.remove(jobId) != null) {
            logger.debug("Stopped tracking sync job {}", jobId);
        }
    }

    /**
     * Job ids embed a strictly increasing epoch-millis stamp so that two jobs
     * created in the same millisecond never collide
     */
    private String nextJobId(SyncJobConfig config, Instant now) {
        long stamp = lastJobTimestamp.updateAndGet(previous -> Math.max(previous + 1, now.toEpochMilli()));
        return String.format("sync_%s_%s_%d", config.getIntegrationId(), config.getStrategy().getValue(), stamp);
    }
}
