package com.bothsides.rostersync.queue;

import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process implementation of {@link SyncJobQueue}.
 * Jobs run on the bounded elastic scheduler; each lane caps its own concurrency.
 */
@Component
public class InMemorySyncJobQueue implements SyncJobQueue {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySyncJobQueue.class);

    private static final Comparator<QueuedSyncJob> LANE_ORDER = Comparator
            .comparingInt((QueuedSyncJob job) -> job.getOptions().priority())
            .thenComparingLong(QueuedSyncJob::getSequence);

    private static final int EVENT_BUFFER_SIZE = 256;

    private final Clock clock;
    private final Scheduler workerScheduler;
    private final Map<String, QueuedSyncJob> jobs = new ConcurrentHashMap<>();
    private final Map<SyncStrategy, Lane> lanes = new EnumMap<>(SyncStrategy.class);
    private final Deque<String> completedJobIds = new ConcurrentLinkedDeque<>();
    private final Deque<String> failedJobIds = new ConcurrentLinkedDeque<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final Sinks.Many<QueueEvent> events =
            Sinks.many().multicast().onBackpressureBuffer(EVENT_BUFFER_SIZE, false);

    @Value("${sync-engine.queue.backoff-ms:1000}")
    private long backoffMs = 1000;

    @Value("${sync-engine.queue.remove-on-complete:100}")
    private int removeOnComplete = 100;

    @Value("${sync-engine.queue.remove-on-fail:50}")
    private int removeOnFail = 50;

    @Value("${sync-engine.queue.stalled-threshold-ms:60000}")
    private long stalledThresholdMs = 60000;

    @Autowired
    public InMemorySyncJobQueue(Clock clock) {
        this(clock, Schedulers.boundedElastic());
    }

    InMemorySyncJobQueue(Clock clock, Scheduler workerScheduler) {
        this.clock = clock;
        this.workerScheduler = workerScheduler;
        for (SyncStrategy strategy : SyncStrategy.values()) {
            lanes.put(strategy, new Lane(strategy));
        }
    }

    @Override
    public Mono<QueuedSyncJob> submit(String jobId, SyncJobConfig config, SyncContext context, JobOptions options) {
        return Mono.fromCallable(() -> {
            QueuedSyncJob job = new QueuedSyncJob(jobId, config, context, options,
                    sequence.incrementAndGet(), clock.instant());
            if (jobs.putIfAbsent(jobId, job) != null) {
                throw new IllegalStateException("Job already queued: " + jobId);
            }

            if (options.delayMs() > 0) {
                delay(job, options.delayMs());
            } else {
                enqueue(job);
            }
            logger.debug("Queued job {} on lane {} (priority={}, delay={}ms)",
                    jobId, config.getStrategy().getJobName(), options.priority(), options.delayMs());
            return job;
        });
    }

    @Override
    public Mono<QueuedSyncJob> getJob(String jobId) {
        return Mono.fromSupplier(() -> jobs.get(jobId));
    }

    @Override
    public Mono<Boolean> remove(String jobId) {
        return Mono.fromCallable(() -> {
            QueuedSyncJob job = jobs.remove(jobId);
            if (job == null) {
                return false;
            }

            Lane lane = lanes.get(job.getStrategy());
            JobState previous;
            synchronized (lane) {
                previous = job.remove(clock.instant());
                lane.waiting.remove(job);
            }

            if (previous == JobState.ACTIVE && job.releaseSlot()) {
                lane.release();
                drain(lane);
            }
            logger.debug("Removed job {} (was {})", jobId, previous);
            return true;
        });
    }

    @Override
    public Mono<JobCounts> getJobCounts() {
        return Mono.fromSupplier(() -> {
            long waiting = 0;
            long active = 0;
            long delayed = 0;
            for (QueuedSyncJob job : jobs.values()) {
                switch (job.getState()) {
                    case WAITING -> waiting++;
                    case ACTIVE -> active++;
                    case DELAYED -> delayed++;
                    default -> {
                        // terminal jobs are reported through the lifetime counters
                    }
                }
            }
            return new JobCounts(waiting, active, delayed, completedCount.get(), failedCount.get());
        });
    }

    @Override
    public Flux<QueueEvent> events() {
        return events.asFlux();
    }

    @Override
    public void registerProcessor(SyncStrategy strategy, int concurrency, SyncJobHandler handler) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        Lane lane = lanes.get(strategy);
        synchronized (lane) {
            lane.handler = handler;
            lane.concurrency = concurrency;
        }
        logger.info("Registered processor for {} with concurrency {}", strategy.getJobName(), concurrency);
        drain(lane);
    }

    @Override
    public int inspectStalledJobs() {
        Instant threshold = clock.instant().minusMillis(stalledThresholdMs);
        int stalled = 0;
        for (QueuedSyncJob job : jobs.values()) {
            if (job.markStalled(threshold)) {
                stalled++;
                logger.warn("Job {} has made no progress for over {}ms", job.getId(), stalledThresholdMs);
                emit(QueueEvent.stalled(job));
            }
        }
        return stalled;
    }

    private void delay(QueuedSyncJob job, long delayMs) {
        if (!job.markDelayed()) {
            return;
        }
        Disposable timer = Mono.delay(Duration.ofMillis(delayMs))
                .subscribe(tick -> enqueue(job));
        job.setPending(timer);
    }

    private void enqueue(QueuedSyncJob job) {
        Lane lane = lanes.get(job.getStrategy());
        synchronized (lane) {
            if (!job.markWaiting()) {
                return;
            }
            lane.waiting.add(job);
        }
        drain(lane);
    }

    private void drain(Lane lane) {
        List<QueuedSyncJob> started = new ArrayList<>();
        SyncJobHandler handler;
        synchronized (lane) {
            handler = lane.handler;
            if (handler == null) {
                return;
            }
            while (lane.active < lane.concurrency && !lane.waiting.isEmpty()) {
                QueuedSyncJob next = lane.waiting.poll();
                if (next.getState() != JobState.WAITING) {
                    continue;
                }
                lane.active++;
                next.start(clock.instant());
                started.add(next);
            }
        }
        started.forEach(job -> execute(lane, handler, job));
    }

    private void execute(Lane lane, SyncJobHandler handler, QueuedSyncJob job) {
        long timeoutMs = job.getOptions().timeoutMs();
        Disposable attempt = Mono.defer(() -> handler.process(job))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Processor returned no result")))
                .timeout(Duration.ofMillis(timeoutMs), Mono.defer(() -> {
                    TimeoutException timeout = new TimeoutException(timeoutReason(job));
                    return handler.onTimeout(job, timeout).then(Mono.<SyncJobResult>error(timeout));
                }))
                .subscribeOn(workerScheduler)
                .subscribe(
                        result -> onAttemptSucceeded(lane, job, result),
                        error -> onAttemptFailed(lane, job, error));
        job.setInFlight(attempt);
    }

    private void onAttemptSucceeded(Lane lane, QueuedSyncJob job, SyncJobResult result) {
        if (job.releaseSlot()) {
            lane.release();
        }
        if (!job.isRemoved()) {
            job.complete(result, clock.instant());
            completedCount.incrementAndGet();
            retain(completedJobIds, job.getId(), removeOnComplete);
            emit(QueueEvent.completed(job, result));
        }
        drain(lane);
    }

    private void onAttemptFailed(Lane lane, QueuedSyncJob job, Throwable error) {
        if (job.releaseSlot()) {
            lane.release();
        }
        if (job.isRemoved()) {
            drain(lane);
            return;
        }

        String reason = error instanceof TimeoutException
                ? timeoutReason(job)
                : String.valueOf(error.getMessage());
        boolean finalAttempt = job.getAttemptsMade() >= job.getOptions().attempts();

        if (finalAttempt) {
            job.fail(reason, clock.instant());
            failedCount.incrementAndGet();
            retain(failedJobIds, job.getId(), removeOnFail);
            logger.warn("Job {} failed after {} attempt(s): {}", job.getId(), job.getAttemptsMade(), reason);
        } else {
            job.recordFailedAttempt(reason);
            logger.info("Job {} attempt {} failed, retrying: {}", job.getId(), job.getAttemptsMade(), reason);
        }

        emit(QueueEvent.failed(job, error, reason, finalAttempt));

        if (!finalAttempt) {
            delay(job, backoffMs * (1L << Math.min(job.getAttemptsMade() - 1, 16)));
        }
        drain(lane);
    }

    private static String timeoutReason(QueuedSyncJob job) {
        return "Job timed out after " + job.getOptions().timeoutMs() + "ms";
    }

    private void retain(Deque<String> finished, String jobId, int limit) {
        finished.addLast(jobId);
        while (finished.size() > limit) {
            String evicted = finished.pollFirst();
            if (evicted != null) {
                jobs.computeIfPresent(evicted, (id, job) -> job.getState().isTerminal() ? null : job);
            }
        }
    }

    private void emit(QueueEvent event) {
        Sinks.EmitResult result;
        synchronized (events) {
            result = events.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.warn("Dropped {} event for job {}: {}", event.type(), event.job().getId(), result);
        }
    }

    private static final class Lane {
        private final SyncStrategy strategy;
        private final PriorityQueue<QueuedSyncJob> waiting = new PriorityQueue<>(LANE_ORDER);
        private SyncJobHandler handler;
        private int concurrency = 1;
        private int active;

        private Lane(SyncStrategy strategy) {
            this.strategy = strategy;
        }

        private synchronized void release() {
            active = Math.max(0, active - 1);
        }

        @Override
        public String toString() {
            return strategy.getJobName();
        }
    }
}
