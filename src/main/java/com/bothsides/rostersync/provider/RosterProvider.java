package com.bothsides.rostersync.provider;

import com.bothsides.rostersync.model.ProviderSyncResult;
import com.bothsides.rostersync.model.SyncContext;
import com.bothsides.rostersync.model.SyncOperationResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;

/**
 * Base interface for roster providers.
 * A provider bean serves one integration and advertises the capabilities it supports.
 */
public interface RosterProvider {

    String ROSTER_CAPABILITY = "roster";

    /**
     * Get the integration this provider serves
     */
    String getIntegrationId();

    /**
     * Get the capability names this provider supports
     */
    Set<String> getCapabilities();

    /**
     * Synchronize every roster entity the provider knows about
     */
    Mono<ProviderSyncResult> performFullSync(SyncContext context);

    /**
     * Synchronize entities changed since the given instant
     */
    Mono<ProviderSyncResult> performIncrementalSync(SyncContext context, Instant since);

    /**
     * Synchronize a single entity
     */
    Mono<SyncOperationResult> syncEntity(String entityType, String entityId, SyncContext context);

    default boolean supports(String capability) {
        return getCapabilities().contains(capability);
    }
}
