package com.bothsides.rostersync.queue;

import com.bothsides.rostersync.model.SyncJobResult;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * Executes one attempt of a queued job. An error signal fails the attempt
 * and hands the job to the queue's retry policy.
 */
@FunctionalInterface
public interface SyncJobHandler {

    Mono<SyncJobResult> process(QueuedSyncJob job);

    /**
     * Called after the queue cancelled an attempt that ran past its timeout,
     * before the attempt is failed
     */
    default Mono<Void> onTimeout(QueuedSyncJob job, TimeoutException timeout) {
        return Mono.empty();
    }
}
