package com.bothsides.rostersync.queue;

import com.bothsides.rostersync.model.SyncJobResult;

/**
 * Job lifecycle signal published by the queue.
 *
 * @param type         which transition happened
 * @param job          the job concerned
 * @param result       the job's return value, COMPLETED only
 * @param error        the attempt's failure, FAILED only
 * @param failedReason the attempt's failure message as recorded on the job, FAILED only
 * @param finalAttempt for FAILED, whether no further attempt will be made
 */
public record QueueEvent(
        Type type,
        QueuedSyncJob job,
        SyncJobResult result,
        Throwable error,
        String failedReason,
        boolean finalAttempt) {

    public enum Type {
        COMPLETED,
        FAILED,
        STALLED
    }

    public static QueueEvent completed(QueuedSyncJob job, SyncJobResult result) {
        return new QueueEvent(Type.COMPLETED, job, result, null, null, true);
    }

    public static QueueEvent failed(QueuedSyncJob job, Throwable error, String failedReason, boolean finalAttempt) {
        return new QueueEvent(Type.FAILED, job, null, error, failedReason, finalAttempt);
    }

    public static QueueEvent stalled(QueuedSyncJob job) {
        return new QueueEvent(Type.STALLED, job, null, null, null, false);
    }
}
