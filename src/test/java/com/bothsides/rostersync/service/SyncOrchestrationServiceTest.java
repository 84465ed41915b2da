package com.bothsides.rostersync.service;

import com.bothsides.rostersync.entity.Integration;
import com.bothsides.rostersync.exception.IntegrationInactiveException;
import com.bothsides.rostersync.exception.RateLimitExceededException;
import com.bothsides.rostersync.model.ActiveSyncJob;
import com.bothsides.rostersync.model.RateLimitConfig;
import com.bothsides.rostersync.model.RateLimitDecision;
import com.bothsides.rostersync.model.SyncAuditStatus;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncPriority;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.queue.InMemorySyncJobQueue;
import com.bothsides.rostersync.queue.JobOptions;
import com.bothsides.rostersync.queue.JobState;
import com.bothsides.rostersync.queue.SyncJobQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncOrchestrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private IntegrationService integrationService;

    @Mock
    private RateLimiterService rateLimiter;

    @Mock
    private SyncAuditService auditService;

    private Clock clock;
    private SyncJobQueue queue;
    private SyncOrchestrationService orchestrationService;
    private Integration integration;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        // No processors registered, so submitted jobs stay queued
        queue = new InMemorySyncJobQueue(clock);
        orchestrationService = new SyncOrchestrationService(queue, integrationService, rateLimiter, auditService, clock);

        integration = new Integration();
        integration.setIntegrationId("school-A");
        integration.setName("School A");
        integration.setEnabled(true);

        lenient().when(auditService.recordSyncJob(anyString(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(integrationService.getRateLimits(any())).thenReturn(RateLimitConfig.defaults());
    }

    @Test
    void shouldScheduleJobForActiveIntegration() {
        // Arrange
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        // Act & Assert
        StepVerifier.create(orchestrationService.scheduleSyncJob(fullSync()))
                .assertNext(jobId -> {
                    assertThat(jobId).isEqualTo("sync_school-A_full_" + NOW.toEpochMilli());
                    assertThat(orchestrationService.getActiveJobCount()).isEqualTo(1);
                })
                .verifyComplete();

        verify(auditService).recordSyncJob(startsWith("sync_school-A_full_"), any(), eq(SyncAuditStatus.SCHEDULED), isNull());
    }

    @Test
    void shouldExposeQueuedJobStatus() {
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        String jobId = orchestrationService.scheduleSyncJob(fullSync()).block();

        StepVerifier.create(orchestrationService.getSyncJobStatus(jobId))
                .assertNext(status -> {
                    assertThat(status.id()).isEqualTo(jobId);
                    assertThat(status.state()).isEqualTo(JobState.WAITING);
                    assertThat(status.attemptsMade()).isZero();
                    assertThat(status.data().getEntityTypes()).containsExactly("student", "class");
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectInactiveIntegration() {
        when(integrationService.findActive("school-A")).thenReturn(Mono.empty());

        StepVerifier.create(orchestrationService.scheduleSyncJob(fullSync()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(IntegrationInactiveException.class);
                    assertThat(((IntegrationInactiveException) error).getIntegrationId()).isEqualTo("school-A");
                })
                .verify();

        verifyNoInteractions(rateLimiter);
        assertThat(orchestrationService.getActiveJobCount()).isZero();
        assertThat(queue.getJobCounts().block().waiting()).isZero();
    }

    @Test
    void shouldRejectWhenRateLimited() {
        Instant next = Instant.parse("2026-03-02T09:01:00Z");
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.reject(next)));

        StepVerifier.create(orchestrationService.scheduleSyncJob(fullSync()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RateLimitExceededException.class);
                    assertThat(((RateLimitExceededException) error).getNextAvailableTime()).isEqualTo(next);
                })
                .verify();

        verify(auditService, never()).recordSyncJob(anyString(), any(), any(), any());
        assertThat(orchestrationService.getActiveJobCount()).isZero();
    }

    @Test
    void shouldGenerateDistinctIdsWithinSameMillisecond() {
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        String first = orchestrationService.scheduleSyncJob(fullSync()).block();
        String second = orchestrationService.scheduleSyncJob(fullSync()).block();

        assertThat(first).isNotEqualTo(second);
        assertThat(orchestrationService.getActiveJobCount()).isEqualTo(2);
    }

    @Test
    void shouldCancelQueuedJob() {
        // Arrange
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));
        String jobId = orchestrationService.scheduleSyncJob(fullSync()).block();

        // Act & Assert
        StepVerifier.create(orchestrationService.cancelSyncJob(jobId))
                .expectNext(true)
                .verifyComplete();

        StepVerifier.create(orchestrationService.getSyncJobStatus(jobId)).verifyComplete();
        StepVerifier.create(orchestrationService.getActiveSyncJobs("school-A")).verifyComplete();
        verify(auditService).recordSyncJob(eq(jobId), any(), eq(SyncAuditStatus.CANCELLED), isNull());
    }

    @Test
    void shouldReturnFalseWhenCancellingUnknownJob() {
        StepVerifier.create(orchestrationService.cancelSyncJob("sync_missing_full_1"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void shouldStopTrackingWhenSubmissionFails() {
        SyncJobQueue failingQueue = mock(SyncJobQueue.class);
        when(failingQueue.submit(anyString(), any(), any(), any(JobOptions.class)))
                .thenReturn(Mono.error(new IllegalStateException("queue unavailable")));
        SyncOrchestrationService service =
                new SyncOrchestrationService(failingQueue, integrationService, rateLimiter, auditService, clock);
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        StepVerifier.create(service.scheduleSyncJob(fullSync()))
                .expectError(IllegalStateException.class)
                .verify();

        assertThat(service.getActiveJobCount()).isZero();
        verify(auditService, never()).recordSyncJob(anyString(), any(), any(), any());
    }

    @Test
    void shouldApplyDefaultsToQueueOptions() {
        SyncJobQueue mockQueue = mock(SyncJobQueue.class);
        when(mockQueue.submit(anyString(), any(), any(), any(JobOptions.class))).thenReturn(Mono.empty());
        SyncOrchestrationService service =
                new SyncOrchestrationService(mockQueue, integrationService, rateLimiter, auditService, clock);
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(rateLimiter.tryAcquire(eq("school-A"), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        service.scheduleSyncJob(SyncJobConfig.builder("school-A", SyncStrategy.INCREMENTAL)
                .entityTypes(List.of("student"))
                .priority(SyncPriority.CRITICAL)
                .build()).block();

        ArgumentCaptor<JobOptions> options = ArgumentCaptor.forClass(JobOptions.class);
        verify(mockQueue).submit(anyString(), any(), any(), options.capture());
        assertThat(options.getValue().priority()).isEqualTo(1);
        assertThat(options.getValue().attempts()).isEqualTo(3);
        assertThat(options.getValue().timeoutMs()).isEqualTo(300_000L);
        assertThat(options.getValue().delayMs()).isZero();
    }

    @Test
    void shouldListActiveJobsPerIntegration() {
        Integration other = new Integration();
        other.setIntegrationId("school-B");
        when(integrationService.findActive("school-A")).thenReturn(Mono.just(integration));
        when(integrationService.findActive("school-B")).thenReturn(Mono.just(other));
        when(rateLimiter.tryAcquire(anyString(), any())).thenReturn(Mono.just(RateLimitDecision.allow()));

        orchestrationService.scheduleSyncJob(fullSync()).block();
        orchestrationService.scheduleSyncJob(SyncJobConfig.builder("school-B", SyncStrategy.MANUAL)
                .entityTypes(List.of("staff")).build()).block();

        StepVerifier.create(orchestrationService.getActiveSyncJobs("school-B"))
                .assertNext(job -> {
                    assertThat(job.integrationId()).isEqualTo("school-B");
                    assertThat(job.strategy()).isEqualTo(SyncStrategy.MANUAL);
                    assertThat(job.entityTypes()).containsExactly("staff");
                })
                .verifyComplete();
        StepVerifier.create(orchestrationService.getAllActiveSyncJobs().map(ActiveSyncJob::integrationId))
                .expectNext("school-A", "school-B")
                .verifyComplete();
    }

    private static SyncJobConfig fullSync() {
        return SyncJobConfig.builder("school-A", SyncStrategy.FULL)
                .entityTypes(List.of("student", "class"))
                .build();
    }
}
