package com.bothsides.rostersync.service;

import com.bothsides.rostersync.entity.Integration;
import com.bothsides.rostersync.model.RateLimitConfig;
import com.bothsides.rostersync.repository.IntegrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Service for reading integration records and maintaining their sync health fields
 */
@Service
public class IntegrationService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationService.class);

    /** Width of the integrations.last_error column */
    static final int MAX_ERROR_LENGTH = 2000;

    private final IntegrationRepository repository;
    private final Clock clock;

    @Value("${sync-engine.rate-limit.requests-per-minute:60}")
    private int defaultRequestsPerMinute = RateLimitConfig.DEFAULT_REQUESTS_PER_MINUTE;

    @Value("${sync-engine.rate-limit.requests-per-hour:3600}")
    private int defaultRequestsPerHour = RateLimitConfig.DEFAULT_REQUESTS_PER_HOUR;

    @Autowired
    public IntegrationService(IntegrationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Get the integration only if it is enabled and ACTIVE
     */
    public Mono<Integration> findActive(String integrationId) {
        return repository.findActiveByIntegrationId(integrationId);
    }

    public Mono<Integration> findByIntegrationId(String integrationId) {
        return repository.findByIntegrationId(integrationId);
    }

    /**
     * Get the last successful sync time, if one was recorded
     */
    public Mono<Instant> getLastSuccessfulSync(String integrationId) {
        return repository.findByIntegrationId(integrationId)
                .filter(integration -> integration.getLastSuccessfulSync() != null)
                .map(integration -> integration.getLastSuccessfulSync().toInstant(ZoneOffset.UTC));
    }

    /**
     * Advance the incremental watermark without touching the error counter
     */
    public Mono<Void> updateLastSuccessfulSync(String integrationId, Instant syncTime) {
        return repository.updateLastSuccessfulSync(integrationId, toUtc(syncTime), now())
                .doOnNext(rows -> logger.debug("Updated last successful sync for {} to {} ({} rows)",
                        integrationId, syncTime, rows))
                .then();
    }

    /**
     * Record a successful sync and reset the error counter
     */
    public Mono<Void> markSyncSucceeded(String integrationId, Instant syncTime) {
        return repository.markSyncSucceeded(integrationId, toUtc(syncTime), now())
                .doOnNext(rows -> logger.debug("Marked sync succeeded for {} at {} ({} rows)",
                        integrationId, syncTime, rows))
                .then();
    }

    /**
     * Increment the error counter and store the latest error
     */
    public Mono<Void> recordFailure(String integrationId, String error) {
        return repository.recordFailure(integrationId, truncate(error, MAX_ERROR_LENGTH), now())
                .doOnNext(rows -> logger.debug("Recorded sync failure for {} ({} rows)", integrationId, rows))
                .then();
    }

    /**
     * Admission limits for the integration, falling back to the configured defaults
     */
    public RateLimitConfig getRateLimits(Integration integration) {
        int perMinute = integration.getRequestsPerMinute() != null
                ? integration.getRequestsPerMinute() : defaultRequestsPerMinute;
        int perHour = integration.getRequestsPerHour() != null
                ? integration.getRequestsPerHour() : defaultRequestsPerHour;
        return new RateLimitConfig(perMinute, perHour);
    }

    /**
     * Cut a value down to a column width so an oversized provider message cannot fail the write
     */
    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
