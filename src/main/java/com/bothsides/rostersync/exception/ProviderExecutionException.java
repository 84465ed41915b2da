package com.bothsides.rostersync.exception;

/**
 * Wraps a failure raised by a roster provider while a job executes.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class ProviderExecutionException extends SyncEngineException {

    public ProviderExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
