package com.bothsides.rostersync.service;

import com.bothsides.rostersync.entity.IntegrationAuditLog;
import com.bothsides.rostersync.model.SyncAuditStatus;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.model.SyncSummary;
import com.bothsides.rostersync.repository.IntegrationAuditLogRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncAuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private IntegrationAuditLogRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SyncAuditService auditService;
    private SyncJobConfig config;

    @BeforeEach
    void setUp() {
        auditService = new SyncAuditService(repository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        config = SyncJobConfig.builder("school-A", SyncStrategy.INCREMENTAL)
                .entityTypes(List.of("student", "class"))
                .build();
    }

    @Test
    void shouldRecordScheduledEntry() throws Exception {
        when(repository.save(any(IntegrationAuditLog.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(auditService.recordSyncJob("job-1", config, SyncAuditStatus.SCHEDULED, null))
                .verifyComplete();

        IntegrationAuditLog entry = captureSaved();
        assertThat(entry.getEventType()).isEqualTo("sync");
        assertThat(entry.getEventCategory()).isEqualTo("operation");
        assertThat(entry.getSeverity()).isEqualTo("info");
        assertThat(entry.getDescription()).isEqualTo("Sync job scheduled: incremental sync for student, class");
        assertThat(entry.getCorrelationId()).isEqualTo("job-1");
        assertThat(entry.getDurationMs()).isNull();

        JsonNode details = objectMapper.readTree(entry.getDetails());
        assertThat(details.get("status").asText()).isEqualTo("scheduled");
        assertThat(details.get("priority").asText()).isEqualTo("normal");
        assertThat(details.has("result")).isFalse();
    }

    @Test
    void shouldRecordFailedResultAsError() throws Exception {
        when(repository.save(any(IntegrationAuditLog.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        SyncJobResult result = SyncJobResult.builder("job-1", "school-A", SyncStrategy.INCREMENTAL)
                .startTime(NOW)
                .endTime(NOW.plusMillis(250))
                .summary(SyncSummary.singleError())
                .addError("provider unavailable")
                .build();

        auditService.recordSyncJob("job-1", config, SyncAuditStatus.FAILED, result).block();

        IntegrationAuditLog entry = captureSaved();
        assertThat(entry.getSeverity()).isEqualTo("error");
        assertThat(entry.getErrorMessage()).isEqualTo("provider unavailable");
        assertThat(entry.getDurationMs()).isEqualTo(250L);
        JsonNode details = objectMapper.readTree(entry.getDetails());
        assertThat(details.get("result").get("success").asBoolean()).isFalse();
        assertThat(details.get("result").get("summary").get("errors").asInt()).isEqualTo(1);
    }

    @Test
    void shouldTruncateOversizedErrorMessage() {
        when(repository.save(any(IntegrationAuditLog.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        SyncJobResult result = SyncJobResult.builder("job-1", "school-A", SyncStrategy.INCREMENTAL)
                .startTime(NOW)
                .endTime(NOW)
                .summary(SyncSummary.singleError())
                .addError("SIS returned 500: " + "x".repeat(2500))
                .build();

        auditService.recordSyncJob("job-1", config, SyncAuditStatus.FAILED, result).block();

        IntegrationAuditLog entry = captureSaved();
        assertThat(entry.getErrorMessage())
                .hasSize(SyncAuditService.MAX_ERROR_MESSAGE_LENGTH)
                .startsWith("SIS returned 500: ");
    }

    @Test
    void shouldNotPropagateStorageFailure() {
        when(repository.save(any(IntegrationAuditLog.class)))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(auditService.recordSyncJob("job-1", config, SyncAuditStatus.COMPLETED, null))
                .verifyComplete();
    }

    private IntegrationAuditLog captureSaved() {
        ArgumentCaptor<IntegrationAuditLog> captor = ArgumentCaptor.forClass(IntegrationAuditLog.class);
        verify(repository).save(captor.capture());
        return captor.getValue();
    }
}
