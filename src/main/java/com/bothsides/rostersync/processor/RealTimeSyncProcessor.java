package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.exception.InvalidWebhookEventException;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.model.SyncSummary;
import com.bothsides.rostersync.model.WebhookEvent;
import com.bothsides.rostersync.provider.ProviderRegistry;
import com.bothsides.rostersync.provider.RosterProvider;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.service.SyncAuditService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Synchronizes the single entity named by the webhook event that triggered the job
 */
@Component
public class RealTimeSyncProcessor extends AbstractSyncJobProcessor {

    static final String FAILURE_MESSAGE = "Real-time sync failed";

    @Autowired
    public RealTimeSyncProcessor(ProviderRegistry providerRegistry, SyncAuditService auditService, Clock clock) {
        super(providerRegistry, auditService, clock);
    }

    @Override
    public SyncStrategy getStrategy() {
        return SyncStrategy.REAL_TIME;
    }

    @Override
    protected Mono<SyncJobResult> doProcess(RosterProvider provider, QueuedSyncJob job, Instant startTime) {
        if (!job.getConfig().isWebhookTriggered()) {
            return Mono.error(new InvalidWebhookEventException("Real-time job " + job.getId() + " has no webhook event"));
        }
        WebhookEvent event = job.getConfig().getWebhookEvent();

        return provider.syncEntity(event.getEntityType(), event.getEntityId(), job.getContext())
                .map(operation -> {
                    SyncJobResult.Builder builder = resultBuilder(job, startTime)
                            .results(List.of(operation))
                            .summary(SyncSummary.ofOperation(operation));
                    if (!operation.success()) {
                        builder.addError(operation.error() != null ? operation.error() : FAILURE_MESSAGE);
                    }
                    return builder.build();
                });
    }

    @Override
    protected List<String> resultEntityTypes(QueuedSyncJob job) {
        WebhookEvent event = job.getConfig().getWebhookEvent();
        return event != null ? List.of(event.getEntityType()) : job.getConfig().getEntityTypes();
    }

    @Override
    protected SyncJobResult.Builder decorate(SyncJobResult.Builder builder, QueuedSyncJob job) {
        WebhookEvent event = job.getConfig().getWebhookEvent();
        if (event != null) {
            builder.addMetadata("webhookEventId", event.getId())
                    .addMetadata("webhookEventType", event.getEventType());
        }
        return builder;
    }
}
