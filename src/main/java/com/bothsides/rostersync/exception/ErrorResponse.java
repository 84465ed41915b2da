package com.bothsides.rostersync.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Standard error response structure for API errors.
 *
 * <p>Provides consistent error information across all endpoints including
 * timestamp, status code, error type, message, and request path.
 *
 * @author BothSides Platform
 * @version 1.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2025-01-15T10:30:00")
    LocalDateTime timestamp;

    @Schema(description = "HTTP status code", example = "429")
    int status;

    @Schema(description = "Error type", example = "Rate Limit Exceeded")
    String error;

    @Schema(description = "Detailed error message", example = "Rate limit exceeded for integration school-A. Next available: 2025-01-15T10:31:00Z")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/sync/jobs")
    String path;

    @Schema(description = "Unique trace ID for debugging", example = "a1b2c3d4")
    String traceId;

    @Schema(description = "Earliest time a new job will be admitted, rate limit errors only", example = "2025-01-15T10:31:00Z")
    Instant nextAvailableTime;
}
