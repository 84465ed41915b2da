package com.bothsides.rostersync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Received webhook event, stored once per idempotency key
 */
@Table("integration_webhook_events")
public class IntegrationWebhookEvent {

    @Id
    private Long id;

    @Column("webhook_id")
    private String webhookId;

    @Column("integration_id")
    private String integrationId;

    @Column("event_id")
    private String eventId;

    @Column("event_type")
    private String eventType;

    @Column("entity_type")
    private String entityType;

    @Column("entity_id")
    private String entityId;

    private String action;

    // Serialized JSON documents
    private String payload;
    private String headers;

    private String signature;

    @Column("idempotency_key")
    private String idempotencyKey;

    @Column("sync_job_id")
    private String syncJobId;

    @Column("received_at")
    private LocalDateTime receivedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    public IntegrationWebhookEvent() {}

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getWebhookId() { return webhookId; }
    public void setWebhookId(String webhookId) { this.webhookId = webhookId; }

    public String getIntegrationId() { return integrationId; }
    public void setIntegrationId(String integrationId) { this.integrationId = integrationId; }

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }

    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }

    public String getEntityId() { return entityId; }
    public void setEntityId(String entityId) { this.entityId = entityId; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }

    public String getHeaders() { return headers; }
    public void setHeaders(String headers) { this.headers = headers; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public String getIdempotencyKey() { return idempotencyKey; }
    public void setIdempotencyKey(String idempotencyKey) { this.idempotencyKey = idempotencyKey; }

    public String getSyncJobId() { return syncJobId; }
    public void setSyncJobId(String syncJobId) { this.syncJobId = syncJobId; }

    public LocalDateTime getReceivedAt() { return receivedAt; }
    public void setReceivedAt(LocalDateTime receivedAt) { this.receivedAt = receivedAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "IntegrationWebhookEvent{" +
                "id=" + id +
                ", integrationId='" + integrationId + '\'' +
                ", eventId='" + eventId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", idempotencyKey='" + idempotencyKey + '\'' +
                ", syncJobId='" + syncJobId + '\'' +
                '}';
    }
}
