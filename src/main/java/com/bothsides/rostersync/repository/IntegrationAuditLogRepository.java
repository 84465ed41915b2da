package com.bothsides.rostersync.repository;

import com.bothsides.rostersync.entity.IntegrationAuditLog;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for integration audit entries
 */
@Repository
public interface IntegrationAuditLogRepository extends R2dbcRepository<IntegrationAuditLog, Long> {

    Flux<IntegrationAuditLog> findByCorrelationIdOrderByIdAsc(String correlationId);
}
