package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.exception.ProviderExecutionException;
import com.bothsides.rostersync.exception.ProviderNotFoundException;
import com.bothsides.rostersync.exception.SyncEngineException;
import com.bothsides.rostersync.model.SyncAuditStatus;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.model.SyncSummary;
import com.bothsides.rostersync.provider.ProviderRegistry;
import com.bothsides.rostersync.provider.RosterProvider;
import com.bothsides.rostersync.queue.QueuedSyncJob;
import com.bothsides.rostersync.queue.SyncJobHandler;
import com.bothsides.rostersync.service.SyncAuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for strategy processors.
 *
 * <p>Resolves the integration's roster provider, delegates the strategy-specific
 * call and audits the outcome. A failed attempt is audited and then re-raised
 * so the queue's retry policy applies.
 */
public abstract class AbstractSyncJobProcessor implements SyncJobHandler {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final ProviderRegistry providerRegistry;
    protected final SyncAuditService auditService;
    protected final Clock clock;

    protected AbstractSyncJobProcessor(ProviderRegistry providerRegistry, SyncAuditService auditService, Clock clock) {
        this.providerRegistry = providerRegistry;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * The strategy whose lane this processor serves
     */
    public abstract SyncStrategy getStrategy();

    @Override
    public Mono<SyncJobResult> process(QueuedSyncJob job) {
        SyncJobConfig config = job.getConfig();
        String integrationId = config.getIntegrationId();
        Instant startTime = clock.instant();

        logger.info("Processing {} sync job {} for integration {}", getStrategy().getValue(), job.getId(), integrationId);

        return providerRegistry.resolveCapableProvider(integrationId, RosterProvider.ROSTER_CAPABILITY)
                .switchIfEmpty(Mono.error(() -> new ProviderNotFoundException(integrationId, RosterProvider.ROSTER_CAPABILITY)))
                .flatMap(provider -> doProcess(provider, job, startTime))
                .flatMap(result -> {
                    job.reportProgress(100, clock.instant());
                    return auditService.recordSyncJob(job.getId(), config, SyncAuditStatus.COMPLETED, result)
                            .thenReturn(result);
                })
                .onErrorResume(error -> {
                    logger.error("{} sync job {} failed: {}", getStrategy().getValue(), job.getId(), error.getMessage(), error);
                    SyncJobResult failed = failedResult(job, startTime, error);
                    return auditService.recordSyncJob(job.getId(), config, SyncAuditStatus.FAILED, failed)
                            .then(Mono.error(wrap(error)));
                });
    }

    @Override
    public Mono<Void> onTimeout(QueuedSyncJob job, TimeoutException timeout) {
        logger.error("{} sync job {} failed: {}", getStrategy().getValue(), job.getId(), timeout.getMessage());
        Instant startTime = job.getProcessedAt() != null ? job.getProcessedAt() : clock.instant();
        return auditService.recordSyncJob(job.getId(), job.getConfig(), SyncAuditStatus.FAILED,
                failedResult(job, startTime, timeout));
    }

    /**
     * Template method: run the strategy against the provider and build the result
     */
    protected abstract Mono<SyncJobResult> doProcess(RosterProvider provider, QueuedSyncJob job, Instant startTime);

    /**
     * Hook for strategies that attach extra detail to every result, successful or not
     */
    protected SyncJobResult.Builder decorate(SyncJobResult.Builder builder, QueuedSyncJob job) {
        return builder;
    }

    /**
     * Entity types reported on the result
     */
    protected List<String> resultEntityTypes(QueuedSyncJob job) {
        return job.getConfig().getEntityTypes();
    }

    protected SyncJobResult.Builder resultBuilder(QueuedSyncJob job, Instant startTime) {
        SyncJobResult.Builder builder = SyncJobResult.builder(job.getId(), job.getConfig().getIntegrationId(), getStrategy())
                .entityTypes(resultEntityTypes(job))
                .startTime(startTime)
                .endTime(clock.instant());
        return decorate(builder, job);
    }

    private SyncJobResult failedResult(QueuedSyncJob job, Instant startTime, Throwable error) {
        return resultBuilder(job, startTime)
                .summary(SyncSummary.singleError())
                .addError(error.getMessage())
                .build();
    }

    private Throwable wrap(Throwable error) {
        if (error instanceof SyncEngineException) {
            return error;
        }
        return new ProviderExecutionException(error.getMessage(), error);
    }
}
