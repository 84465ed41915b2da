package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.provider.ProviderRegistry;
import com.bothsides.rostersync.provider.RosterProvider;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.service.IntegrationService;
import com.bothsides.rostersync.service.SyncAuditService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Synchronizes entities changed since the integration's last successful sync.
 * The watermark advances to the job's start time only when the provider succeeds.
 */
@Component
public class IncrementalSyncProcessor extends AbstractSyncJobProcessor {

    static final String FAILURE_MESSAGE = "Incremental sync failed";

    private final IntegrationService integrationService;

    @Autowired
    public IncrementalSyncProcessor(ProviderRegistry providerRegistry,
                                    SyncAuditService auditService,
                                    IntegrationService integrationService,
                                    Clock clock) {
        super(providerRegistry, auditService, clock);
        this.integrationService = integrationService;
    }

    @Override
    public SyncStrategy getStrategy() {
        return SyncStrategy.INCREMENTAL;
    }

    @Override
    protected Mono<SyncJobResult> doProcess(RosterProvider provider, QueuedSyncJob job, Instant startTime) {
        String integrationId = job.getConfig().getIntegrationId();

        return integrationService.getLastSuccessfulSync(integrationId)
                .defaultIfEmpty(Instant.EPOCH)
                .doOnNext(since -> logger.debug("Incremental sync {} for {} since {}", job.getId(), integrationId, since))
                .flatMap(since -> provider.performIncrementalSync(job.getContext(), since))
                .flatMap(syncResult -> {
                    Mono<Void> watermark = syncResult.success()
                            ? integrationService.updateLastSuccessfulSync(integrationId, startTime)
                            : Mono.empty();
                    return watermark.then(Mono.fromSupplier(() -> {
                        SyncJobResult.Builder builder = resultBuilder(job, startTime)
                                .results(syncResult.results())
                                .summary(syncResult.summary());
                        if (!syncResult.success()) {
                            builder.addError(FAILURE_MESSAGE);
                        }
                        return builder.build();
                    }));
                });
    }
}
