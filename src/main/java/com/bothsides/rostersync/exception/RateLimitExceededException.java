package com.bothsides.rostersync.exception;

import java.time.Instant;

/**
 * Exception thrown when an integration has used up its admission window.
 *
 * <p>Carries the earliest instant at which a new job will be admitted.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class RateLimitExceededException extends SyncEngineException {

    private final String integrationId;
    private final Instant nextAvailableTime;

    /**
     * Constructs a new rate limit exception.
     *
     * @param integrationId the throttled integration
     * @param nextAvailableTime when the next job may be admitted
     */
    public RateLimitExceededException(String integrationId, Instant nextAvailableTime) {
        super(String.format("Rate limit exceeded for integration %s. Next available: %s",
                integrationId, nextAvailableTime));
        this.integrationId = integrationId;
        this.nextAvailableTime = nextAvailableTime;
    }

    public String getIntegrationId() {
        return integrationId;
    }

    public Instant getNextAvailableTime() {
        return nextAvailableTime;
    }
}
