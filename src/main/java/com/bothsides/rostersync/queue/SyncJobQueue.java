package com.bothsides.rostersync.queue;

import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Job queue with one named lane per sync strategy.
 * Each lane honors priority, delay, bounded retries and a per-attempt timeout,
 * and publishes lifecycle events to subscribers.
 */
public interface SyncJobQueue {

    /**
     * Submits a job under the given id. Fails if the id is already held.
     */
    Mono<QueuedSyncJob> submit(String jobId, SyncJobConfig config, SyncContext context, JobOptions options);

    Mono<QueuedSyncJob> getJob(String jobId);

    /**
     * Removes a job in any state, cancelling it if it is waiting, delayed or running.
     *
     * @return true if the queue held the job
     */
    Mono<Boolean> remove(String jobId);

    Mono<JobCounts> getJobCounts();

    /**
     * Hot stream of job lifecycle events
     */
    Flux<QueueEvent> events();

    /**
     * Attaches the worker for a lane and sets how many jobs may run at once on it
     */
    void registerProcessor(SyncStrategy strategy, int concurrency, SyncJobHandler handler);

    /**
     * Emits a STALLED event for every running job without progress past the stall threshold
     *
     * @return the number of jobs newly reported as stalled
     */
    int inspectStalledJobs();
}
