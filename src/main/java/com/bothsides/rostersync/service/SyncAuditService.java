package com.bothsides.rostersync.service;

import com.bothsides.rostersync.entity.IntegrationAuditLog;
import com.bothsides.rostersync.model.SyncAuditStatus;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.repository.IntegrationAuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends sync job lifecycle entries to the integration audit log.
 * Writes are best-effort: a storage failure is logged and never fails the caller.
 */
@Service
public class SyncAuditService {

    private static final Logger logger = LoggerFactory.getLogger(SyncAuditService.class);

    static final String EVENT_TYPE = "sync";
    static final String EVENT_CATEGORY = "operation";
    static final int MAX_DESCRIPTION_LENGTH = 1000;
    static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    private final IntegrationAuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SyncAuditService(IntegrationAuditLogRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Record one lifecycle point of a sync job.
     *
     * @param result the job result, or null for scheduling and cancellation
     */
    public Mono<Void> recordSyncJob(String jobId, SyncJobConfig config, SyncAuditStatus status, SyncJobResult result) {
        return Mono.fromCallable(() -> buildEntry(jobId, config, status, result))
                .flatMap(repository::save)
                .doOnNext(saved -> logger.debug("Audited sync job {} as {}", jobId, status.getValue()))
                .onErrorResume(error -> {
                    logger.error("Failed to write audit entry for sync job {}: {}", jobId, error.getMessage(), error);
                    return Mono.empty();
                })
                .then();
    }

    private IntegrationAuditLog buildEntry(String jobId, SyncJobConfig config, SyncAuditStatus status,
                                           SyncJobResult result) throws JsonProcessingException {
        IntegrationAuditLog entry = new IntegrationAuditLog();
        entry.setIntegrationId(config.getIntegrationId());
        entry.setEventType(EVENT_TYPE);
        entry.setEventCategory(EVENT_CATEGORY);
        entry.setSeverity(result != null && !result.isSuccess() ? "error" : "info");
        entry.setDescription(IntegrationService.truncate(String.format("Sync job %s: %s sync for %s",
                status.getValue(), config.getStrategy().getValue(), String.join(", ", config.getEntityTypes())),
                MAX_DESCRIPTION_LENGTH));
        entry.setDetails(objectMapper.writeValueAsString(details(jobId, config, status, result)));
        entry.setCorrelationId(jobId);
        entry.setDurationMs(result != null ? result.getDurationMs() : null);
        entry.setErrorMessage(result != null
                ? IntegrationService.truncate(result.getFirstError(), MAX_ERROR_MESSAGE_LENGTH) : null);
        entry.setCreatedAt(LocalDateTime.now(clock.withZone(ZoneOffset.UTC)));
        return entry;
    }

    private Map<String, Object> details(String jobId, SyncJobConfig config, SyncAuditStatus status,
                                        SyncJobResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("jobId", jobId);
        details.put("strategy", config.getStrategy().getValue());
        details.put("entityTypes", config.getEntityTypes());
        details.put("priority", config.getPriority().getValue());
        details.put("status", status.getValue());
        if (result != null) {
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("success", result.isSuccess());
            outcome.put("duration", result.getDurationMs());
            outcome.put("summary", result.getSummary());
            outcome.put("errors", result.getErrors());
            details.put("result", outcome);
        }
        return details;
    }
}
