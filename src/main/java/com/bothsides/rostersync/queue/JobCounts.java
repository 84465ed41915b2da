package com.bothsides.rostersync.queue;

/**
 * Queue counts. {@code completed} and {@code failed} are lifetime totals;
 * the others reflect the jobs currently held.
 */
public record JobCounts(long waiting, long active, long delayed, long completed, long failed) {
}
