package com.bothsides.rostersync.integration;

import com.bothsides.rostersync.entity.Integration;
import com.bothsides.rostersync.entity.IntegrationAuditLog;
import com.bothsides.rostersync.exception.IntegrationInactiveException;
import com.bothsides.rostersync.model.ProviderSyncResult;
import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncOperation;
import com.bothsides.rostersync.model.SyncOperationResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.model.SyncSummary;
import com.bothsides.rostersync.model.WebhookAction;
import com.bothsides.rostersync.model.WebhookEvent;
import com.bothsides.rostersync.provider.RosterProvider;
import com.bothsides.rostersync.queue.JobState;
import com.bothsides.rostersync.repository.IntegrationAuditLogRepository;
import com.bothsides.rostersync.repository.IntegrationRepository;
import com.bothsides.rostersync.repository.IntegrationWebhookEventRepository;
import com.bothsides.rostersync.service.SyncOrchestrationService;
import com.bothsides.rostersync.service.WebhookIntakeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RosterSyncIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Autowired
    private SyncOrchestrationService orchestrationService;

    @Autowired
    private WebhookIntakeService webhookIntakeService;

    @Autowired
    private IntegrationRepository integrationRepository;

    @Autowired
    private IntegrationAuditLogRepository auditLogRepository;

    @Autowired
    private IntegrationWebhookEventRepository webhookEventRepository;

    @BeforeEach
    void setUp() {
        auditLogRepository.deleteAll().block();
        webhookEventRepository.deleteAll().block();
        integrationRepository.deleteAll().block();

        integrationRepository.save(new Integration("school-A", "School A", true)).block();
        integrationRepository.save(new Integration("school-B", "School B", false)).block();
        integrationRepository.save(new Integration("school-C", "School C", true)).block();
        integrationRepository.save(new Integration("school-D", "School D", true)).block();
    }

    @Test
    void fullSync_CompletesAndRecordsHealth() {
        String jobId = orchestrationService.scheduleSyncJob(SyncJobConfig.builder("school-A", SyncStrategy.FULL)
                .entityTypes(List.of("student", "class"))
                .build()).block();

        awaitValue(() -> orchestrationService.getSyncJobStatus(jobId),
                status -> status.state() == JobState.COMPLETED);
        Integration integration = awaitValue(() -> integrationRepository.findByIntegrationId("school-A"),
                record -> record.getLastSuccessfulSync() != null);

        assertThat(integration.getErrorCount()).isZero();
        List<IntegrationAuditLog> audit = awaitValue(
                () -> auditLogRepository.findByCorrelationIdOrderByIdAsc(jobId).collectList(),
                entries -> entries.size() >= 2);
        assertThat(audit).extracting(IntegrationAuditLog::getDescription)
                .containsExactlyInAnyOrder(
                        "Sync job scheduled: full sync for student, class",
                        "Sync job completed: full sync for student, class");
        StepVerifier.create(orchestrationService.getActiveSyncJobs("school-A")).verifyComplete();
    }

    @Test
    void scheduling_RejectsDisabledIntegration() {
        StepVerifier.create(orchestrationService.scheduleSyncJob(SyncJobConfig.builder("school-B", SyncStrategy.FULL)
                        .entityTypes(List.of("student"))
                        .build()))
                .expectError(IntegrationInactiveException.class)
                .verify();

        assertThat(orchestrationService.getActiveSyncJobs("school-B").collectList().block()).isEmpty();
    }

    @Test
    void failedSync_IncrementsErrorCount() {
        String jobId = orchestrationService.scheduleSyncJob(SyncJobConfig.builder("school-C", SyncStrategy.FULL)
                .entityTypes(List.of("student"))
                .maxRetries(1)
                .build()).block();

        awaitValue(() -> orchestrationService.getSyncJobStatus(jobId),
                status -> status.state() == JobState.FAILED);
        Integration integration = awaitValue(() -> integrationRepository.findByIntegrationId("school-C"),
                record -> record.getErrorCount() != null && record.getErrorCount() > 0);

        assertThat(integration.getErrorCount()).isEqualTo(1);
        assertThat(integration.getLastError()).isEqualTo("SIS unreachable");
        assertThat(integration.getLastSuccessfulSync()).isNull();
    }

    @Test
    void failedSync_WithOversizedError_StillCountsAndAudits() {
        String jobId = orchestrationService.scheduleSyncJob(SyncJobConfig.builder("school-D", SyncStrategy.FULL)
                .entityTypes(List.of("student"))
                .maxRetries(1)
                .build()).block();

        awaitValue(() -> orchestrationService.getSyncJobStatus(jobId),
                status -> status.state() == JobState.FAILED);
        Integration integration = awaitValue(() -> integrationRepository.findByIntegrationId("school-D"),
                record -> record.getErrorCount() != null && record.getErrorCount() > 0);

        assertThat(integration.getErrorCount()).isEqualTo(1);
        assertThat(integration.getLastError()).startsWith("SIS returned 500: ").hasSize(2000);

        List<IntegrationAuditLog> audit = awaitValue(
                () -> auditLogRepository.findByCorrelationIdOrderByIdAsc(jobId).collectList(),
                entries -> entries.size() >= 2);
        assertThat(audit).extracting(IntegrationAuditLog::getDescription)
                .contains("Sync job failed: full sync for student");
        assertThat(audit).filteredOn(entry -> entry.getErrorMessage() != null)
                .allSatisfy(entry -> assertThat(entry.getErrorMessage()).hasSizeLessThanOrEqualTo(2000));
    }

    @Test
    void duplicateWebhook_StoredOnce() {
        Instant receivedAt = Instant.parse("2026-03-02T09:00:00Z");

        String first = webhookIntakeService.processWebhook(webhookEvent(receivedAt)).block();
        String second = webhookIntakeService.processWebhook(webhookEvent(receivedAt)).block();

        assertThat(first).isNotEqualTo(second);
        StepVerifier.create(webhookEventRepository.countByIntegrationId("school-A"))
                .expectNext(1L)
                .verifyComplete();
    }

    private static WebhookEvent webhookEvent(Instant receivedAt) {
        return WebhookEvent.builder()
                .id("evt-1")
                .integrationId("school-A")
                .eventType("student.updated")
                .entityType("student")
                .entityId("s1")
                .action(WebhookAction.UPDATE)
                .receivedAt(receivedAt)
                .build();
    }

    private static <T> T awaitValue(Supplier<Mono<T>> check, Predicate<T> done) {
        return Flux.interval(Duration.ZERO, Duration.ofMillis(50))
                .concatMap(tick -> check.get())
                .filter(done)
                .blockFirst(WAIT);
    }

    @TestConfiguration
    static class TestProviders {

        @Bean
        RosterProvider schoolAProvider() {
            return new StubRosterProvider("school-A", null);
        }

        @Bean
        RosterProvider schoolCProvider() {
            return new StubRosterProvider("school-C", "SIS unreachable");
        }

        @Bean
        RosterProvider schoolDProvider() {
            return new StubRosterProvider("school-D", "SIS returned 500: " + "x".repeat(2500));
        }
    }

    static class StubRosterProvider implements RosterProvider {

        private final String integrationId;
        private final String failure;

        StubRosterProvider(String integrationId, String failure) {
            this.integrationId = integrationId;
            this.failure = failure;
        }

        @Override
        public String getIntegrationId() {
            return integrationId;
        }

        @Override
        public Set<String> getCapabilities() {
            return Set.of(ROSTER_CAPABILITY);
        }

        @Override
        public Mono<ProviderSyncResult> performFullSync(SyncContext context) {
            if (failure != null) {
                return Mono.error(new IllegalStateException(failure));
            }
            return Mono.just(new ProviderSyncResult(true,
                    List.of(SyncOperationResult.succeeded("student", "s1", SyncOperation.UPDATE)),
                    new SyncSummary(1, 0, 1, 0, 0, 0)));
        }

        @Override
        public Mono<ProviderSyncResult> performIncrementalSync(SyncContext context, Instant since) {
            return performFullSync(context);
        }

        @Override
        public Mono<SyncOperationResult> syncEntity(String entityType, String entityId, SyncContext context) {
            return Mono.just(SyncOperationResult.succeeded(entityType, entityId, SyncOperation.UPDATE));
        }
    }
}
