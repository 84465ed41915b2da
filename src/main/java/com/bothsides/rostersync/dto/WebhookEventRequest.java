package com.bothsides.rostersync.dto;

import com.bothsides.rostersync.model.WebhookAction;
import com.bothsides.rostersync.model.WebhookEvent;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request DTO for an inbound provider webhook.
 * Required-field checks happen in webhook intake so that every rejection
 * reports the same error type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inbound webhook event from a roster provider")
public class WebhookEventRequest {

    @Size(max = 255)
    @Schema(description = "Provider event identifier", example = "evt-1")
    private String id;

    @Size(max = 100)
    @Schema(description = "Provider event type", example = "student.updated")
    private String eventType;

    @Size(max = 100)
    @Schema(description = "Type of the affected entity", example = "student")
    private String entityType;

    @Size(max = 255)
    @Schema(description = "Identifier of the affected entity", example = "s1")
    private String entityId;

    @Schema(description = "Change applied to the entity", example = "update",
            allowableValues = {"create", "update", "delete"})
    private String action;

    @Schema(description = "Raw event payload")
    private Map<String, Object> payload;

    @Schema(description = "Provider signature, if not sent as a header")
    private String signature;

    @Schema(description = "When the provider emitted the event; defaults to receipt time")
    private Instant receivedAt;

    public WebhookEvent toEvent(String integrationId, Map<String, String> headers, String headerSignature) {
        WebhookEvent.Builder builder = WebhookEvent.builder()
                .id(id)
                .integrationId(integrationId)
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .action(WebhookAction.fromValue(action))
                .payload(payload)
                .signature(headerSignature != null ? headerSignature : signature)
                .receivedAt(receivedAt);
        headers.forEach(builder::addHeader);
        return builder.build();
    }
}
