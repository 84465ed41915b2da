package com.bothsides.rostersync.exception;

/**
 * Exception thrown when a webhook event lacks a required field.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class InvalidWebhookEventException extends SyncEngineException {

    /**
     * Constructs a new invalid webhook event exception.
     *
     * @param message which field is missing or malformed
     */
    public InvalidWebhookEventException(String message) {
        super(message);
    }
}
