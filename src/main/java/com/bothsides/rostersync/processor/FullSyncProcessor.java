package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.provider.ProviderRegistry;
import com.bothsides.rostersync.provider.RosterProvider;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.service.SyncAuditService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Resynchronizes every roster entity of an integration
 */
@Component
public class FullSyncProcessor extends AbstractSyncJobProcessor {

    static final String FAILURE_MESSAGE = "Full sync failed";

    @Autowired
    public FullSyncProcessor(ProviderRegistry providerRegistry, SyncAuditService auditService, Clock clock) {
        super(providerRegistry, auditService, clock);
    }

    @Override
    public SyncStrategy getStrategy() {
        return SyncStrategy.FULL;
    }

    @Override
    protected Mono<SyncJobResult> doProcess(RosterProvider provider, QueuedSyncJob job, Instant startTime) {
        return provider.performFullSync(job.getContext())
                .map(syncResult -> {
                    SyncJobResult.Builder builder = resultBuilder(job, startTime)
                            .results(syncResult.results())
                            .summary(syncResult.summary());
                    if (!syncResult.success()) {
                        builder.addError(FAILURE_MESSAGE);
                    }
                    return builder.build();
                });
    }
}
