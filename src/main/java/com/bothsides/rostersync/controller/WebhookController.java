package com.bothsides.rostersync.controller;

import com.bothsides.rostersync.dto.WebhookEventRequest;
import com.bothsides.rostersync.service.WebhookIntakeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives change notifications from roster providers and turns each into a
 * high-priority real-time sync of the affected entity.
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/webhooks", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Inbound provider change events")
@SecurityRequirement(name = "bearerAuth")
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WebhookIntakeService intakeService;

    @Operation(summary = "Receive provider webhook")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Real-time sync queued"),
            @ApiResponse(responseCode = "400", description = "Event missing a required field"),
            @ApiResponse(responseCode = "403", description = "Integration role required"),
            @ApiResponse(responseCode = "409", description = "Integration not active"),
            @ApiResponse(responseCode = "429", description = "Integration rate limit reached")
    })
    @PostMapping(value = "/{integrationId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, String>>> receiveWebhook(
            @Parameter(description = "Integration id", required = true) @PathVariable String integrationId,
            @Valid @RequestBody WebhookEventRequest request,
            @RequestHeader HttpHeaders headers) {

        log.debug("Received webhook {} for integration {}", request.getId(), integrationId);

        Map<String, String> headerValues = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                headerValues.put(name.toLowerCase(), values.get(0));
            }
        });

        return intakeService.processWebhook(request.toEvent(integrationId, headerValues, headers.getFirst(SIGNATURE_HEADER)))
                .map(jobId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId)));
    }
}
