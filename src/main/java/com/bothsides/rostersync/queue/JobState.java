package com.bothsides.rostersync.queue;

/**
 * Lifecycle state of a queued sync job
 */
public enum JobState {
    DELAYED,   // Waiting for its schedule delay or retry backoff to elapse
    WAITING,   // Ready, waiting for a free worker slot
    ACTIVE,    // Running on a worker
    COMPLETED,
    FAILED,    // Terminal failure, no attempts left
    REMOVED;   // Cancelled by a caller

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == REMOVED;
    }
}
