package com.bothsides.rostersync.model;

import java.time.Instant;

/**
 * Outcome of a rate limit check. {@code nextAvailableTime} is only meaningful when rejected.
 */
public record RateLimitDecision(boolean allowed, Instant nextAvailableTime) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, null);
    }

    public static RateLimitDecision reject(Instant nextAvailableTime) {
        return new RateLimitDecision(false, nextAvailableTime);
    }
}
