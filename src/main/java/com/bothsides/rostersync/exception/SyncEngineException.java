package com.bothsides.rostersync.exception;

/**
 * Base exception for sync engine operations.
 *
 * <p>Represents errors raised while scheduling, executing or receiving
 * roster synchronization work.
 *
 * @author BothSides Platform
 * @version 1.0
 */
public class SyncEngineException extends RuntimeException {

    /**
     * Constructs a new sync engine exception with the specified detail message.
     *
     * @param message the detail message
     */
    public SyncEngineException(String message) {
        super(message);
    }

    /**
     * Constructs a new sync engine exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public SyncEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
