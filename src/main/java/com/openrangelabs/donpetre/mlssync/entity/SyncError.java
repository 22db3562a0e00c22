package com.openrangelabs.donpetre.mlssync.entity;

import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Error recorded while a sync run was executing. Errors are append-only;
 * only the resolution fields change afterwards.
 */
@Table("mls_sync_errors")
public class SyncError {

    @Id
    private UUID id;

    @Column("run_id")
    private String runId;

    @Column("provider_id")
    private String providerId;

    @Column("error_type")
    private String errorType;

    private String message;

    private Boolean retryable = false;

    private Boolean resolved = false;

    @Column("resolved_at")
    private LocalDateTime resolvedAt;

    @Column("mls_record_id")
    private String mlsRecordId;

    @Column("occurred_at")
    private LocalDateTime occurredAt = LocalDateTime.now();

    public SyncError() {}

    public SyncError(String runId, String providerId, SyncErrorType type, String message,
                     boolean retryable, String mlsRecordId) {
        this.runId = runId;
        this.providerId = providerId;
        this.errorType = type.name();
        this.message = message;
        this.retryable = retryable;
        this.mlsRecordId = mlsRecordId;
    }

    // Business methods
    public void resolve() {
        this.resolved = true;
        this.resolvedAt = LocalDateTime.now();
    }

    public boolean isResolved() {
        return resolved != null && resolved;
    }

    public boolean isRetryable() {
        return retryable != null && retryable;
    }

    public boolean hasRecordReference() {
        return mlsRecordId != null && !mlsRecordId.isBlank();
    }

    public SyncErrorType getType() {
        return SyncErrorType.valueOf(errorType);
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public Boolean getRetryable() { return retryable; }
    public void setRetryable(Boolean retryable) { this.retryable = retryable; }

    public Boolean getResolved() { return resolved; }
    public void setResolved(Boolean resolved) { this.resolved = resolved; }

    public LocalDateTime getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(LocalDateTime resolvedAt) { this.resolvedAt = resolvedAt; }

    public String getMlsRecordId() { return mlsRecordId; }
    public void setMlsRecordId(String mlsRecordId) { this.mlsRecordId = mlsRecordId; }

    public LocalDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(LocalDateTime occurredAt) { this.occurredAt = occurredAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncError that = (SyncError) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncError{" +
                "id=" + id +
                ", runId='" + runId + '\'' +
                ", errorType='" + errorType + '\'' +
                ", retryable=" + retryable +
                ", resolved=" + resolved +
                ", mlsRecordId='" + mlsRecordId + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
