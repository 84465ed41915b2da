package com.bothsides.rostersync.controller;

import com.bothsides.rostersync.dto.ScheduleSyncJobRequest;
import com.bothsides.rostersync.model.ActiveSyncJob;
import com.bothsides.rostersync.model.SyncEngineStats;
import com.bothsides.rostersync.model.SyncJobStatus;
import com.bothsides.rostersync.service.SyncOrchestrationService;
import com.bothsides.rostersync.service.SyncStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for scheduling and monitoring roster sync jobs.
 *
 * <p>Scheduling is admission-controlled: inactive integrations are rejected with 409
 * and rate-limited integrations with 429. Execution failures are not surfaced here;
 * poll the job status instead.
 *
 * @author BothSides Platform
 * @version 1.0
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/sync", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Sync Jobs", description = "Roster sync scheduling and monitoring")
@SecurityRequirement(name = "bearerAuth")
public class SyncJobController {

    private final SyncOrchestrationService orchestrationService;
    private final SyncStatsService statsService;

    /**
     * Schedules a sync job for an active integration.
     *
     * @param request strategy, entity types and optional tuning
     * @return the id of the queued job
     */
    @Operation(summary = "Schedule sync job", description = "Queues a full, incremental, real-time or manual sync")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Job queued"),
            @ApiResponse(responseCode = "400", description = "Invalid request data"),
            @ApiResponse(responseCode = "401", description = "Authentication required"),
            @ApiResponse(responseCode = "409", description = "Integration missing, disabled or not active"),
            @ApiResponse(responseCode = "429", description = "Integration rate limit reached")
    })
    @PostMapping(value = "/jobs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, String>>> scheduleSyncJob(
            @Valid @RequestBody ScheduleSyncJobRequest request) {

        log.info("Scheduling {} sync for integration {}", request.getStrategy(), request.getIntegrationId());

        return orchestrationService.scheduleSyncJob(request.toConfig())
                .map(jobId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId)));
    }

    @Operation(summary = "Get sync job status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job found"),
            @ApiResponse(responseCode = "404", description = "Job unknown or already evicted")
    })
    @GetMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<SyncJobStatus>> getSyncJobStatus(
            @Parameter(description = "Sync job id", required = true) @PathVariable String jobId) {

        return orchestrationService.getSyncJobStatus(jobId)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Cancels a job whether it is delayed, waiting or running.
     */
    @Operation(summary = "Cancel sync job")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job cancelled"),
            @ApiResponse(responseCode = "404", description = "Job unknown or could not be removed")
    })
    @DeleteMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<Map<String, Boolean>>> cancelSyncJob(
            @Parameter(description = "Sync job id", required = true) @PathVariable String jobId) {

        log.info("Cancelling sync job {}", jobId);

        return orchestrationService.cancelSyncJob(jobId)
                .map(cancelled -> cancelled
                        ? ResponseEntity.ok(Map.of("cancelled", true))
                        : ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("cancelled", false)));
    }

    @Operation(summary = "List active sync jobs for an integration")
    @GetMapping("/integrations/{integrationId}/active-jobs")
    public Flux<ActiveSyncJob> getActiveSyncJobs(
            @Parameter(description = "Integration id", required = true) @PathVariable String integrationId) {
        return orchestrationService.getActiveSyncJobs(integrationId);
    }

    @Operation(summary = "List all active sync jobs")
    @GetMapping("/active-jobs")
    public Flux<ActiveSyncJob> getAllActiveSyncJobs() {
        return orchestrationService.getAllActiveSyncJobs();
    }

    @Operation(summary = "Get sync engine statistics",
            description = "Queue counters, success rate and per-integration rate limit state")
    @GetMapping("/stats")
    public Mono<SyncEngineStats> getSyncEngineStats() {
        return statsService.getSyncEngineStats()
                .doOnError(error -> log.error("Failed to collect sync engine stats: {}", error.getMessage()));
    }
}
