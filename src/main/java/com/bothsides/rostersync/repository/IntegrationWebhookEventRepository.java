package com.bothsides.rostersync.repository;

import com.bothsides.rostersync.entity.IntegrationWebhookEvent;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for received webhook events
 */
@Repository
public interface IntegrationWebhookEventRepository extends R2dbcRepository<IntegrationWebhookEvent, Long> {

    Mono<Boolean> existsByIdempotencyKey(String idempotencyKey);

    Mono<Long> countByIntegrationId(String integrationId);
}
