package com.bothsides.rostersync.service;

import com.bothsides.rostersync.exception.InvalidWebhookEventException;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncPriority;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.model.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Turns inbound provider webhooks into real-time sync jobs
 */
@Service
public class WebhookIntakeService {

    private static final Logger logger = LoggerFactory.getLogger(WebhookIntakeService.class);

    static final int WEBHOOK_BATCH_SIZE = 1;
    static final int WEBHOOK_MAX_RETRIES = 2;
    static final long WEBHOOK_TIMEOUT_MS = 30_000L;

    private final SyncOrchestrationService orchestrationService;
    private final WebhookEventService webhookEventService;
    private final Clock clock;

    @Autowired
    public WebhookIntakeService(SyncOrchestrationService orchestrationService,
                                WebhookEventService webhookEventService,
                                Clock clock) {
        this.orchestrationService = orchestrationService;
        this.webhookEventService = webhookEventService;
        this.clock = clock;
    }

    /**
     * Validate the event, schedule a high-priority real-time sync for its entity
     * and record the event.
     *
     * @return the id of the scheduled job
     */
    public Mono<String> processWebhook(WebhookEvent event) {
        return Mono.fromCallable(() -> {
                    validate(event);
                    if (event.getReceivedAt() == null) {
                        event.setReceivedAt(clock.instant());
                    }
                    logger.info("Processing webhook event {} for entity {}:{}",
                            event.getEventType(), event.getEntityType(), event.getEntityId());
                    return toSyncConfig(event);
                })
                .flatMap(orchestrationService::scheduleSyncJob)
                .flatMap(jobId -> webhookEventService.persist(event, event.idempotencyKey(), jobId)
                        .thenReturn(jobId));
    }

    private SyncJobConfig toSyncConfig(WebhookEvent event) {
        return SyncJobConfig.builder(event.getIntegrationId(), SyncStrategy.REAL_TIME)
                .entityTypes(List.of(event.getEntityType()))
                .priority(SyncPriority.HIGH)
                .batchSize(WEBHOOK_BATCH_SIZE)
                .maxRetries(WEBHOOK_MAX_RETRIES)
                .timeoutMs(WEBHOOK_TIMEOUT_MS)
                .addMetadata("webhookEventId", event.getId())
                .addMetadata("webhookEventType", event.getEventType())
                .addMetadata("webhookAction", event.getAction().getValue())
                .webhookEvent(event)
                .build();
    }

    private void validate(WebhookEvent event) {
        if (event == null) {
            throw new InvalidWebhookEventException("Webhook event is required");
        }
        requireText(event.getId(), "id");
        requireText(event.getIntegrationId(), "integrationId");
        requireText(event.getEventType(), "eventType");
        requireText(event.getEntityType(), "entityType");
        requireText(event.getEntityId(), "entityId");
        if (event.getAction() == null) {
            throw new InvalidWebhookEventException("Webhook event is missing a valid action");
        }
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidWebhookEventException("Webhook event is missing required field: " + field);
        }
    }
}
