package com.bothsides.rostersync.service;

import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.queue.QueueEvent;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.queue.SyncJobQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Reacts to queue lifecycle events: clears job tracking and keeps the
 * integration's sync health fields current
 */
@Component
public class SyncJobLifecycleHandler {

    private static final Logger logger = LoggerFactory.getLogger(SyncJobLifecycleHandler.class);

    private final SyncJobQueue queue;
    private final SyncOrchestrationService orchestrationService;
    private final IntegrationService integrationService;

    private Disposable subscription;

    @Autowired
    public SyncJobLifecycleHandler(SyncJobQueue queue,
                                   SyncOrchestrationService orchestrationService,
                                   IntegrationService integrationService) {
        this.queue = queue;
        this.orchestrationService = orchestrationService;
        this.integrationService = integrationService;
    }

    @PostConstruct
    public void subscribe() {
        subscription = queue.events()
                .concatMap(event -> handle(event)
                        .onErrorResume(error -> {
                            logger.error("Failed to handle {} event for job {}: {}",
                                    event.type(), event.job().getId(), error.getMessage(), error);
                            return Mono.empty();
                        }))
                .subscribe();
        logger.info("Subscribed to sync queue lifecycle events");
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    public Mono<Void> handle(QueueEvent event) {
        return switch (event.type()) {
            case COMPLETED -> onCompleted(event.job(), event.result());
            case FAILED -> onFailed(event.job(), event.failedReason(), event.finalAttempt());
            case STALLED -> onStalled(event.job());
        };
    }

    private Mono<Void> onCompleted(QueuedSyncJob job, SyncJobResult result) {
        orchestrationService.removeTracking(job.getId());
        logger.info("Sync job {} completed: success={}", job.getId(), result != null && result.isSuccess());

        if (result == null || !result.isSuccess()) {
            return Mono.empty();
        }
        return integrationService.markSyncSucceeded(job.getConfig().getIntegrationId(), result.getEndTime());
    }

    private Mono<Void> onFailed(QueuedSyncJob job, String reason, boolean finalAttempt) {
        logger.error("Sync job {} failed on attempt {}: {}", job.getId(), job.getAttemptsMade(), reason);

        if (finalAttempt) {
            orchestrationService.removeTracking(job.getId());
        }
        return integrationService.recordFailure(job.getConfig().getIntegrationId(), reason);
    }

    private Mono<Void> onStalled(QueuedSyncJob job) {
        logger.warn("Sync job {} stalled", job.getId());
        return Mono.empty();
    }
}
