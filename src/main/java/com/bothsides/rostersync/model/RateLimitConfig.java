package com.bothsides.rostersync.model;

/**
 * Admission limits applied to one integration
 */
public record RateLimitConfig(int requestsPerMinute, int requestsPerHour) {

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
    public static final int DEFAULT_REQUESTS_PER_HOUR = 3600;

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(DEFAULT_REQUESTS_PER_MINUTE, DEFAULT_REQUESTS_PER_HOUR);
    }
}
