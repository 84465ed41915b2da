package com.bothsides.rostersync.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the sync engine API.
 *
 * <p>Maps scheduling and intake failures to HTTP status codes with
 * structured error bodies. Execution-time failures never reach this layer;
 * they are reported through job status and the audit log.
 *
 * @author BothSides Platform
 * @version 1.0
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles scheduling against a missing, disabled or non-active integration.
     */
    @ExceptionHandler(IntegrationInactiveException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIntegrationInactive(
            IntegrationInactiveException ex, ServerWebExchange exchange) {

        log.warn("Integration not active: {}", ex.getIntegrationId());

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.CONFLICT.value())
                .error("Integration Not Active")
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(error));
    }

    /**
     * Handles rejected admissions, advertising when the caller may retry.
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRateLimitExceeded(
            RateLimitExceededException ex, ServerWebExchange exchange) {

        log.warn("Rate limit exceeded for integration {} until {}",
                ex.getIntegrationId(), ex.getNextAvailableTime());

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Rate Limit Exceeded")
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .nextAvailableTime(ex.getNextAvailableTime())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(ex.getNextAvailableTime())))
                .body(error));
    }

    /**
     * Handles webhook events missing a required field.
     */
    @ExceptionHandler(InvalidWebhookEventException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidWebhookEvent(
            InvalidWebhookEventException ex, ServerWebExchange exchange) {

        log.warn("Rejected webhook event: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Invalid Webhook Event")
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles validation exceptions.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> {
            String fieldName = error.getField();
            String errorMessage = error.getDefaultMessage();
            fieldErrors.put(fieldName, errorMessage);
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles unreadable request bodies, such as an unknown strategy or priority value.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        log.warn("Unreadable request: {}", ex.getReason());

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Bad Request")
                .message(ex.getReason())
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles access denied exceptions.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        log.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.FORBIDDEN.value())
                .error("Access Denied")
                .message("Insufficient privileges to access this resource")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body(error));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("Internal Server Error")
                .message("An unexpected error occurred. Please try again.")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error));
    }

    private long retryAfterSeconds(Instant nextAvailableTime) {
        if (nextAvailableTime == null) {
            return 1;
        }
        long millis = Duration.between(Instant.now(), nextAvailableTime).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
