package com.bothsides.rostersync.model;

import java.util.List;

/**
 * Value returned by a roster provider for a batch sync
 */
public record ProviderSyncResult(
        boolean success,
        List<SyncOperationResult> results,
        SyncSummary summary) {

    public ProviderSyncResult {
        results = results != null ? List.copyOf(results) : List.of();
        summary = summary != null ? summary : SyncSummary.empty();
    }
}
