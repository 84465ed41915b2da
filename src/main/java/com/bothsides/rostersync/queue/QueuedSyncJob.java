package com.bothsides.rostersync.queue;

import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncJobResult;
import com.bothsides.rostersync.model.SyncJobStatus;
import com.bothsides.rostersync.model.SyncStrategy;
import reactor.core.Disposable;

import java.time.Instant;

/**
 * A job held by the sync queue.
 * State transitions are driven by the queue; processors only report progress.
 */
public class QueuedSyncJob {

    private final String id;
    private final SyncJobConfig config;
    private final SyncContext context;
    private final JobOptions options;
    private final long sequence;
    private final Instant createdAt;

    private JobState state = JobState.WAITING;
    private int progress;
    private int attemptsMade;
    private SyncJobResult returnValue;
    private String failedReason;
    private Instant processedAt;
    private Instant finishedAt;
    private Instant lastHeartbeat;
    private boolean stalledReported;
    private boolean slotHeld;
    private Disposable pending;
    private Disposable inFlight;

    public QueuedSyncJob(String id, SyncJobConfig config, SyncContext context, JobOptions options,
                         long sequence, Instant createdAt) {
        this.id = id;
        this.config = config;
        this.context = context;
        this.options = options;
        this.sequence = sequence;
        this.createdAt = createdAt;
    }

    // Business methods
    public synchronized void reportProgress(int progress, Instant now) {
        this.progress = Math.max(0, Math.min(100, progress));
        this.lastHeartbeat = now;
        this.stalledReported = false;
    }

    synchronized boolean markDelayed() {
        if (state.isTerminal()) {
            return false;
        }
        this.state = JobState.DELAYED;
        return true;
    }

    synchronized boolean markWaiting() {
        if (state.isTerminal()) {
            return false;
        }
        this.state = JobState.WAITING;
        return true;
    }

    synchronized void start(Instant now) {
        this.state = JobState.ACTIVE;
        this.attemptsMade++;
        this.processedAt = now;
        this.lastHeartbeat = now;
        this.stalledReported = false;
        this.slotHeld = true;
    }

    synchronized void complete(SyncJobResult result, Instant now) {
        this.state = JobState.COMPLETED;
        this.returnValue = result;
        this.progress = 100;
        this.finishedAt = now;
        this.inFlight = null;
    }

    synchronized void recordFailedAttempt(String reason) {
        this.failedReason = reason;
        this.inFlight = null;
    }

    synchronized void fail(String reason, Instant now) {
        this.state = JobState.FAILED;
        this.failedReason = reason;
        this.finishedAt = now;
        this.inFlight = null;
    }

    /**
     * Marks the job removed and cancels any pending delay or running attempt.
     *
     * @return the state the job was in before removal
     */
    synchronized JobState remove(Instant now) {
        JobState previous = state;
        this.state = JobState.REMOVED;
        this.finishedAt = now;
        if (pending != null) {
            pending.dispose();
            pending = null;
        }
        if (inFlight != null) {
            inFlight.dispose();
            inFlight = null;
        }
        return previous;
    }

    /**
     * Releases the worker slot taken by the current attempt, at most once per attempt
     */
    synchronized boolean releaseSlot() {
        if (!slotHeld) {
            return false;
        }
        slotHeld = false;
        return true;
    }

    synchronized boolean markStalled(Instant threshold) {
        if (state != JobState.ACTIVE || stalledReported || lastHeartbeat == null || !lastHeartbeat.isBefore(threshold)) {
            return false;
        }
        stalledReported = true;
        return true;
    }

    synchronized void setPending(Disposable pending) {
        if (state == JobState.REMOVED) {
            pending.dispose();
            return;
        }
        this.pending = pending;
    }

    synchronized void setInFlight(Disposable inFlight) {
        if (state != JobState.ACTIVE) {
            return;
        }
        this.inFlight = inFlight;
    }

    public synchronized SyncJobStatus toStatus() {
        return new SyncJobStatus(id, state, progress, attemptsMade, config, returnValue, failedReason,
                processedAt, finishedAt);
    }

    // Getters
    public String getId() { return id; }
    public SyncJobConfig getConfig() { return config; }
    public SyncContext getContext() { return context; }
    public JobOptions getOptions() { return options; }
    public long getSequence() { return sequence; }
    public Instant getCreatedAt() { return createdAt; }
    public SyncStrategy getStrategy() { return config.getStrategy(); }

    public synchronized JobState getState() { return state; }
    public synchronized int getProgress() { return progress; }
    public synchronized int getAttemptsMade() { return attemptsMade; }
    public synchronized SyncJobResult getReturnValue() { return returnValue; }
    public synchronized String getFailedReason() { return failedReason; }
    public synchronized Instant getProcessedAt() { return processedAt; }
    public synchronized Instant getFinishedAt() { return finishedAt; }

    public synchronized boolean isRemoved() {
        return state == JobState.REMOVED;
    }

    @Override
    public String toString() {
        return "QueuedSyncJob{" +
                "id='" + id + '\'' +
                ", strategy=" + getStrategy() +
                ", state=" + getState() +
                ", attemptsMade=" + getAttemptsMade() +
                '}';
    }
}
