package com.bothsides.rostersync.model;

/**
 * Aggregate counts for a sync run
 */
public record SyncSummary(
        int totalProcessed,
        int created,
        int updated,
        int deleted,
        int skipped,
        int errors) {

    public static SyncSummary empty() {
        return new SyncSummary(0, 0, 0, 0, 0, 0);
    }

    /**
     * Summary of a run that failed before producing any operation
     */
    public static SyncSummary singleError() {
        return new SyncSummary(0, 0, 0, 0, 0, 1);
    }

    /**
     * Summary derived from exactly one entity operation
     */
    public static SyncSummary ofOperation(SyncOperationResult operation) {
        SyncOperation kind = operation.operation();
        return new SyncSummary(
                1,
                kind == SyncOperation.CREATE ? 1 : 0,
                kind == SyncOperation.UPDATE ? 1 : 0,
                kind == SyncOperation.DELETE ? 1 : 0,
                kind == SyncOperation.SKIP ? 1 : 0,
                operation.success() ? 0 : 1);
    }
}
