package com.bothsides.rostersync.exception;

/**
 * Exception thrown when sync work targets an integration that is missing,
 * disabled, or not in ACTIVE status.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class IntegrationInactiveException extends SyncEngineException {

    private final String integrationId;

    /**
     * Constructs a new exception for the given integration.
     *
     * @param integrationId the integration that cannot accept sync work
     */
    public IntegrationInactiveException(String integrationId) {
        super(String.format("Integration %s is not active", integrationId));
        this.integrationId = integrationId;
    }

    /**
     * Gets the integration that was rejected.
     *
     * @return the integration ID
     */
    public String getIntegrationId() {
        return integrationId;
    }
}
