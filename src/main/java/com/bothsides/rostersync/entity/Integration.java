package com.bothsides.rostersync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Entity representing a configured external roster integration.
 * Holds its admission limits and the sync health fields maintained by the engine.
 * Timestamps are stored in UTC.
 */
@Table("integrations")
public class Integration {

    public static final String STATUS_ACTIVE = "ACTIVE";

    @Id
    private Long id;

    @Column("integration_id")
    private String integrationId;

    private String name;
    private Boolean enabled = false;
    private String status = STATUS_ACTIVE;

    @Column("requests_per_minute")
    private Integer requestsPerMinute;

    @Column("requests_per_hour")
    private Integer requestsPerHour;

    @Column("last_successful_sync")
    private LocalDateTime lastSuccessfulSync;

    @Column("error_count")
    private Integer errorCount = 0;

    @Column("last_error")
    private String lastError;

    @Column("last_error_time")
    private LocalDateTime lastErrorTime;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    // Constructors
    public Integration() {}

    public Integration(String integrationId, String name, boolean enabled) {
        this.integrationId = integrationId;
        this.name = name;
        this.enabled = enabled;
    }

    // Business methods
    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getIntegrationId() { return integrationId; }
    public void setIntegrationId(String integrationId) { this.integrationId = integrationId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Integer getRequestsPerMinute() { return requestsPerMinute; }
    public void setRequestsPerMinute(Integer requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

    public Integer getRequestsPerHour() { return requestsPerHour; }
    public void setRequestsPerHour(Integer requestsPerHour) { this.requestsPerHour = requestsPerHour; }

    public LocalDateTime getLastSuccessfulSync() { return lastSuccessfulSync; }
    public void setLastSuccessfulSync(LocalDateTime lastSuccessfulSync) { this.lastSuccessfulSync = lastSuccessfulSync; }

    public Integer getErrorCount() { return errorCount; }
    public void setErrorCount(Integer errorCount) { this.errorCount = errorCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public LocalDateTime getLastErrorTime() { return lastErrorTime; }
    public void setLastErrorTime(LocalDateTime lastErrorTime) { this.lastErrorTime = lastErrorTime; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Integration that = (Integration) o;
        return Objects.equals(id, that.id) && Objects.equals(integrationId, that.integrationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, integrationId);
    }

    @Override
    public String toString() {
        return "Integration{" +
                "id=" + id +
                ", integrationId='" + integrationId + '\'' +
                ", name='" + name + '\'' +
                ", enabled=" + enabled +
                ", status='" + status + '\'' +
                ", errorCount=" + errorCount +
                ", lastSuccessfulSync=" + lastSuccessfulSync +
                '}';
    }
}
