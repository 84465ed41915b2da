package com.bothsides.rostersync.repository;

import com.bothsides.rostersync.entity.Integration;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Repository for integration records and their sync health fields
 */
@Repository
public interface IntegrationRepository extends R2dbcRepository<Integration, Long> {

    Mono<Integration> findByIntegrationId(String integrationId);

    /**
     * Find the integration only if it is enabled and ACTIVE
     */
    @Query("SELECT * FROM integrations WHERE integration_id = :integrationId AND enabled = true AND status = 'ACTIVE'")
    Mono<Integration> findActiveByIntegrationId(@Param("integrationId") String integrationId);

    /**
     * Update the incremental sync watermark
     */
    @Modifying
    @Query("UPDATE integrations SET last_successful_sync = :syncTime, updated_at = :now WHERE integration_id = :integrationId")
    Mono<Integer> updateLastSuccessfulSync(@Param("integrationId") String integrationId,
                                           @Param("syncTime") LocalDateTime syncTime,
                                           @Param("now") LocalDateTime now);

    /**
     * Record a successful sync and clear the error counter
     */
    @Modifying
    @Query("UPDATE integrations SET last_successful_sync = :syncTime, error_count = 0, updated_at = :now WHERE integration_id = :integrationId")
    Mono<Integer> markSyncSucceeded(@Param("integrationId") String integrationId,
                                    @Param("syncTime") LocalDateTime syncTime,
                                    @Param("now") LocalDateTime now);

    /**
     * Increment the error counter and remember the latest error
     */
    @Modifying
    @Query("""
        UPDATE integrations
        SET error_count = COALESCE(error_count, 0) + 1,
            last_error = :error,
            last_error_time = :errorTime,
            updated_at = :errorTime
        WHERE integration_id = :integrationId
        """)
    Mono<Integer> recordFailure(@Param("integrationId") String integrationId,
                                @Param("error") String error,
                                @Param("errorTime") LocalDateTime errorTime);
}
