package com.bothsides.rostersync.exception;

/**
 * Exception thrown during job execution when no provider serves the
 * integration with the required capability.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class ProviderNotFoundException extends SyncEngineException {

    public ProviderNotFoundException(String integrationId, String capability) {
        super(String.format("No %s provider found for integration %s", capability, integrationId));
    }
}
