package com.bothsides.rostersync.queue;

/**
 * Submission options for a queued job.
 *
 * @param priority  queue weight, lower values are serviced first
 * @param delayMs   time to wait before the job becomes runnable
 * @param attempts  total attempts including the first one
 * @param timeoutMs per-attempt execution timeout
 */
public record JobOptions(int priority, long delayMs, int attempts, long timeoutMs) {

    public JobOptions {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        delayMs = Math.max(0, delayMs);
    }
}
