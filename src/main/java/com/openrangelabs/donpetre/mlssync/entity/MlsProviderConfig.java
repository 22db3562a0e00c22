package com.openrangelabs.donpetre.mlssync.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openrangelabs.donpetre.mlssync.model.ProviderFamily;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing an upstream MLS provider and its connection settings
 */
@Table("mls_provider_configs")
public class MlsProviderConfig {

    @Id
    private UUID id;

    @Column("provider_id")
    private String providerId;

    private String name;

    private String family;

    private String endpoint;

    private String username;

    @JsonIgnore
    private String password;

    @Column("client_id")
    private String clientId;

    @JsonIgnore
    @Column("client_secret")
    private String clientSecret;

    // Requests per minute allowed by the provider
    @Column("rate_limit_per_minute")
    private Integer rateLimitPerMinute = 100;

    @Column("sync_interval_minutes")
    private Integer syncIntervalMinutes = 60;

    private Boolean enabled = false;

    @Column("last_sync_at")
    private LocalDateTime lastSyncAt;

    @Column("consecutive_error_count")
    private Integer consecutiveErrorCount = 0;

    @Column("last_error_message")
    private String lastErrorMessage;

    @Column("last_error_at")
    private LocalDateTime lastErrorAt;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    // Constructors
    public MlsProviderConfig() {}

    public MlsProviderConfig(String providerId, ProviderFamily family, String endpoint) {
        this.providerId = providerId;
        this.name = providerId;
        this.family = family.name();
        this.endpoint = endpoint;
    }

    // Business methods
    public boolean isEnabled() {
        return enabled != null && enabled;
    }

    public ProviderFamily getProviderFamily() {
        return ProviderFamily.valueOf(family.toUpperCase());
    }

    public void recordSyncSuccess(LocalDateTime syncTime) {
        this.lastSyncAt = syncTime;
        this.consecutiveErrorCount = 0;
        this.lastErrorMessage = null;
        this.lastErrorAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    public void recordSyncError(String errorMessage) {
        this.consecutiveErrorCount = (this.consecutiveErrorCount != null) ?
                this.consecutiveErrorCount + 1 : 1;
        this.lastErrorMessage = errorMessage;
        this.lastErrorAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public int getEffectiveRateLimit() {
        return rateLimitPerMinute != null && rateLimitPerMinute > 0 ? rateLimitPerMinute : 100;
    }

    public int getEffectiveSyncIntervalMinutes() {
        return syncIntervalMinutes != null && syncIntervalMinutes > 0 ? syncIntervalMinutes : 60;
    }

    public boolean isHealthy() {
        // Unhealthy after more than 3 consecutive failed runs
        return consecutiveErrorCount == null || consecutiveErrorCount <= 3;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getFamily() { return family; }
    public void setFamily(String family) { this.family = family; }

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

    public Integer getRateLimitPerMinute() { return rateLimitPerMinute; }
    public void setRateLimitPerMinute(Integer rateLimitPerMinute) { this.rateLimitPerMinute = rateLimitPerMinute; }

    public Integer getSyncIntervalMinutes() { return syncIntervalMinutes; }
    public void setSyncIntervalMinutes(Integer syncIntervalMinutes) { this.syncIntervalMinutes = syncIntervalMinutes; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
        this.updatedAt = LocalDateTime.now();
    }

    public LocalDateTime getLastSyncAt() { return lastSyncAt; }
    public void setLastSyncAt(LocalDateTime lastSyncAt) { this.lastSyncAt = lastSyncAt; }

    public Integer getConsecutiveErrorCount() { return consecutiveErrorCount; }
    public void setConsecutiveErrorCount(Integer consecutiveErrorCount) { this.consecutiveErrorCount = consecutiveErrorCount; }

    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }

    public LocalDateTime getLastErrorAt() { return lastErrorAt; }
    public void setLastErrorAt(LocalDateTime lastErrorAt) { this.lastErrorAt = lastErrorAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MlsProviderConfig that = (MlsProviderConfig) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MlsProviderConfig{" +
                "id=" + id +
                ", providerId='" + providerId + '\'' +
                ", family='" + family + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", enabled=" + enabled +
                ", syncIntervalMinutes=" + syncIntervalMinutes +
                ", consecutiveErrorCount=" + consecutiveErrorCount +
                '}';
    }
}
