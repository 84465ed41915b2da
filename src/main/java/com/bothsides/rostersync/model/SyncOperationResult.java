package com.bothsides.rostersync.model;

/**
 * Result of one provider operation against a single roster entity
 */
public record SyncOperationResult(
        String entityType,
        String entityId,
        SyncOperation operation,
        boolean success,
        String externalId,
        String error) {

    public static SyncOperationResult succeeded(String entityType, String entityId, SyncOperation operation) {
        return new SyncOperationResult(entityType, entityId, operation, true, entityId, null);
    }

    public static SyncOperationResult failed(String entityType, String entityId, SyncOperation operation, String error) {
        return new SyncOperationResult(entityType, entityId, operation, false, entityId, error);
    }
}
