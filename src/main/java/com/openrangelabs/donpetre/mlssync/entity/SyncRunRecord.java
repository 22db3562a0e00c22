package com.openrangelabs.donpetre.mlssync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted checkpoint of a sync run.
 * Written at start, after every page and on the terminal transition.
 */
@Table("mls_sync_runs")
public class SyncRunRecord {

    @Id
    private UUID id;

    @Column("run_id")
    private String runId;

    @Column("provider_id")
    private String providerId;

    private String status;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("ended_at")
    private LocalDateTime endedAt;

    @Column("records_processed")
    private Integer recordsProcessed = 0;

    @Column("records_updated")
    private Integer recordsUpdated = 0;

    @Column("records_created")
    private Integer recordsCreated = 0;

    @Column("records_failed")
    private Integer recordsFailed = 0;

    private Double progress = 0.0;

    @Column("estimated_total")
    private Integer estimatedTotal;

    // Serialized SyncOptions
    private String options;

    @Column("error_message")
    private String errorMessage;

    public SyncRunRecord() {}

    // Business methods
    public boolean isCompleted() {
        return "COMPLETED".equals(status);
    }

    public Duration getDuration() {
        if (startedAt == null) return Duration.ZERO;
        LocalDateTime endTime = endedAt != null ? endedAt : LocalDateTime.now();
        return Duration.between(startedAt, endTime);
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getEndedAt() { return endedAt; }
    public void setEndedAt(LocalDateTime endedAt) { this.endedAt = endedAt; }

    public Integer getRecordsProcessed() { return recordsProcessed; }
    public void setRecordsProcessed(Integer recordsProcessed) { this.recordsProcessed = recordsProcessed; }

    public Integer getRecordsUpdated() { return recordsUpdated; }
    public void setRecordsUpdated(Integer recordsUpdated) { this.recordsUpdated = recordsUpdated; }

    public Integer getRecordsCreated() { return recordsCreated; }
    public void setRecordsCreated(Integer recordsCreated) { this.recordsCreated = recordsCreated; }

    public Integer getRecordsFailed() { return recordsFailed; }
    public void setRecordsFailed(Integer recordsFailed) { this.recordsFailed = recordsFailed; }

    public Double getProgress() { return progress; }
    public void setProgress(Double progress) { this.progress = progress; }

    public Integer getEstimatedTotal() { return estimatedTotal; }
    public void setEstimatedTotal(Integer estimatedTotal) { this.estimatedTotal = estimatedTotal; }

    public String getOptions() { return options; }
    public void setOptions(String options) { this.options = options; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncRunRecord that = (SyncRunRecord) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncRunRecord{" +
                "runId='" + runId + '\'' +
                ", providerId='" + providerId + '\'' +
                ", status='" + status + '\'' +
                ", processed=" + recordsProcessed +
                ", created=" + recordsCreated +
                ", updated=" + recordsUpdated +
                ", failed=" + recordsFailed +
                ", progress=" + progress +
                ", duration=" + getDuration() +
                '}';
    }
}
