package com.bothsides.rostersync.service;

import com.bothsides.rostersync.entity.IntegrationWebhookEvent;
import com.bothsides.rostersync.model.WebhookEvent;
import com.bothsides.rostersync.repository.IntegrationWebhookEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Stores received webhook events, at most once per idempotency key.
 * Persistence is best-effort and never fails the intake path.
 */
@Service
public class WebhookEventService {

    private static final Logger logger = LoggerFactory.getLogger(WebhookEventService.class);

    private final IntegrationWebhookEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public WebhookEventService(IntegrationWebhookEventRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Persist the event linked to the job it triggered, unless the key was already stored
     */
    public Mono<Void> persist(WebhookEvent event, String idempotencyKey, String jobId) {
        return repository.existsByIdempotencyKey(idempotencyKey)
                .flatMap(exists -> {
                    if (exists) {
                        logger.info("Webhook event {} already stored under key {}, skipping", event.getId(), idempotencyKey);
                        return Mono.<IntegrationWebhookEvent>empty();
                    }
                    return Mono.fromCallable(() -> toEntity(event, idempotencyKey, jobId))
                            .flatMap(repository::save);
                })
                .doOnNext(saved -> logger.debug("Stored webhook event {} for job {}", event.getId(), jobId))
                .onErrorResume(DataIntegrityViolationException.class, error -> {
                    logger.info("Webhook event {} stored concurrently under key {}, skipping", event.getId(), idempotencyKey);
                    return Mono.empty();
                })
                .onErrorResume(error -> {
                    logger.error("Failed to store webhook event {}: {}", event.getId(), error.getMessage(), error);
                    return Mono.empty();
                })
                .then();
    }

    private IntegrationWebhookEvent toEntity(WebhookEvent event, String idempotencyKey, String jobId)
            throws JsonProcessingException {
        IntegrationWebhookEvent entity = new IntegrationWebhookEvent();
        entity.setWebhookId("webhook_" + event.getIntegrationId());
        entity.setIntegrationId(event.getIntegrationId());
        entity.setEventId(event.getId());
        entity.setEventType(event.getEventType());
        entity.setEntityType(event.getEntityType());
        entity.setEntityId(event.getEntityId());
        entity.setAction(event.getAction() != null ? event.getAction().getValue() : null);
        entity.setPayload(writeJson(event.getPayload()));
        entity.setHeaders(writeJson(event.getHeaders()));
        entity.setSignature(event.getSignature());
        entity.setIdempotencyKey(idempotencyKey);
        entity.setSyncJobId(jobId);
        entity.setReceivedAt(LocalDateTime.ofInstant(event.getReceivedAt(), ZoneOffset.UTC));
        entity.setCreatedAt(LocalDateTime.now(clock.withZone(ZoneOffset.UTC)));
        return entity;
    }

    private String writeJson(Map<String, ?> value) throws JsonProcessingException {
        return value != null ? objectMapper.writeValueAsString(value) : null;
    }
}
