package com.bothsides.rostersync.model;

import java.time.Instant;

/**
 * Fixed-window admission counters for one integration.
 * Callers must hold the tracker's monitor while reading or mutating it.
 */
public class RateLimitTracker {

    private int minuteCount;
    private int hourCount;
    private long lastMinute;
    private long lastHour;
    private Instant nextAvailableTime;

    public RateLimitTracker(long currentMinute, long currentHour, Instant now) {
        this.lastMinute = currentMinute;
        this.lastHour = currentHour;
        this.nextAvailableTime = now;
    }

    /**
     * Resets whichever counter's bucket has advanced
     */
    public void roll(long currentMinute, long currentHour) {
        if (lastMinute != currentMinute) {
            minuteCount = 0;
            lastMinute = currentMinute;
        }
        if (lastHour != currentHour) {
            hourCount = 0;
            lastHour = currentHour;
        }
    }

    public void increment() {
        minuteCount++;
        hourCount++;
    }

    public RateLimitStatus snapshot(RateLimitConfig limits) {
        return new RateLimitStatus(minuteCount, hourCount, lastMinute, lastHour, nextAvailableTime,
                limits != null ? limits.requestsPerMinute() : null,
                limits != null ? limits.requestsPerHour() : null);
    }

    // Getters and Setters
    public int getMinuteCount() { return minuteCount; }
    public int getHourCount() { return hourCount; }
    public long getLastMinute() { return lastMinute; }
    public long getLastHour() { return lastHour; }

    public Instant getNextAvailableTime() { return nextAvailableTime; }
    public void setNextAvailableTime(Instant nextAvailableTime) { this.nextAvailableTime = nextAvailableTime; }
}
