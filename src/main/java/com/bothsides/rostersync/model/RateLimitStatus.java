package com.bothsides.rostersync.model;

import java.time.Instant;

/**
 * Point-in-time view of an integration's rate limit counters
 */
public class RateLimitStatus {

    private final int minuteCount;
    private final int hourCount;
    private final long lastMinute;
    private final long lastHour;
    private final Instant nextAvailableTime;
    private final Integer requestsPerMinute;
    private final Integer requestsPerHour;

    public RateLimitStatus(int minuteCount, int hourCount, long lastMinute, long lastHour,
                           Instant nextAvailableTime, Integer requestsPerMinute, Integer requestsPerHour) {
        this.minuteCount = minuteCount;
        this.hourCount = hourCount;
        this.lastMinute = lastMinute;
        this.lastHour = lastHour;
        this.nextAvailableTime = nextAvailableTime;
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerHour = requestsPerHour;
    }

    public boolean isExceeded() {
        return (requestsPerMinute != null && minuteCount >= requestsPerMinute)
                || (requestsPerHour != null && hourCount >= requestsPerHour);
    }

    // Getters
    public int getMinuteCount() { return minuteCount; }
    public int getHourCount() { return hourCount; }
    public long getLastMinute() { return lastMinute; }
    public long getLastHour() { return lastHour; }
    public Instant getNextAvailableTime() { return nextAvailableTime; }
    public Integer getRequestsPerMinute() { return requestsPerMinute; }
    public Integer getRequestsPerHour() { return requestsPerHour; }

    @Override
    public String toString() {
        return "RateLimitStatus{" +
                "minuteCount=" + minuteCount +
                ", hourCount=" + hourCount +
                ", nextAvailableTime=" + nextAvailableTime +
                ", requestsPerMinute=" + requestsPerMinute +
                ", requestsPerHour=" + requestsPerHour +
                '}';
    }
}
