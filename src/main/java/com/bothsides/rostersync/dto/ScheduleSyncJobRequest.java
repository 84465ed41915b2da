package com.bothsides.rostersync.dto;

import com.bothsides.rostersync.model.SyncJobConfig;
import com.bothsides.rostersync.model.SyncPriority;
import com.bothsides.rostersync.model.SyncStrategy;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for scheduling a sync job.
 *
 * <p>Optional fields fall back to the engine defaults: normal priority,
 * three attempts, a five-minute timeout and no delay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for scheduling a roster sync job")
public class ScheduleSyncJobRequest {

    @NotBlank(message = "Integration ID is required")
    @Schema(description = "Integration to synchronize", example = "school-A", required = true)
    private String integrationId;

    @NotNull(message = "Strategy is required")
    @Schema(description = "Sync strategy", example = "incremental", required = true,
            allowableValues = {"full", "incremental", "real_time", "manual"})
    private SyncStrategy strategy;

    @NotEmpty(message = "At least one entity type is required")
    @Schema(description = "Entity types to synchronize", example = "[\"student\", \"class\"]", required = true)
    private List<String> entityTypes;

    @Schema(description = "Queue priority", example = "high", allowableValues = {"low", "normal", "high", "critical"})
    private SyncPriority priority;

    @Positive(message = "Batch size must be positive")
    @Schema(description = "Provider batch size hint", example = "100")
    private Integer batchSize;

    @Min(value = 1, message = "At least one attempt is required")
    @Max(value = 10, message = "No more than 10 attempts are allowed")
    @Schema(description = "Total attempts including the first one", example = "3")
    private Integer maxRetries;

    @Positive(message = "Timeout must be positive")
    @Schema(description = "Per-attempt timeout in milliseconds", example = "300000")
    private Long timeoutMs;

    @PositiveOrZero(message = "Delay cannot be negative")
    @Schema(description = "Delay before the job becomes runnable, in milliseconds", example = "0")
    private Long scheduleDelayMs;

    @Schema(description = "Free-form metadata passed to the provider")
    private Map<String, Object> metadata;

    public SyncJobConfig toConfig() {
        SyncJobConfig.Builder builder = SyncJobConfig.builder(integrationId, strategy)
                .entityTypes(entityTypes)
                .batchSize(batchSize)
                .maxRetries(maxRetries)
                .timeoutMs(timeoutMs)
                .scheduleDelayMs(scheduleDelayMs);
        if (priority != null) {
            builder.priority(priority);
        }
        if (metadata != null) {
            builder.metadata(metadata);
        }
        return builder.build();
    }
}
