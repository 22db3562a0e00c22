package com.openrangelabs.donpetre.mlssync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted duplicate candidate awaiting (or after) resolution
 */
@Table("mls_duplicate_candidates")
public class DuplicateCandidateRecord {

    @Id
    private UUID id;

    @Column("provider_id")
    private String providerId;

    @Column("source_mls_id")
    private String sourceMlsId;

    @Column("target_mls_id")
    private String targetMlsId;

    private Double confidence;

    // Newline separated
    @Column("match_reasons")
    private String matchReasons;

    @Column("suggested_action")
    private String suggestedAction;

    // Serialized CanonicalPropertyRecord, only for merge suggestions
    @Column("merge_payload")
    private String mergePayload;

    private Boolean resolved = false;

    @Column("resolved_action")
    private String resolvedAction;

    @Column("resolved_at")
    private LocalDateTime resolvedAt;

    @Column("last_error")
    private String lastError;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    public DuplicateCandidateRecord() {}

    // Business methods
    public boolean isResolved() {
        return resolved != null && resolved;
    }

    public void markResolved(String action) {
        this.resolved = true;
        this.resolvedAction = action;
        this.resolvedAt = LocalDateTime.now();
        this.lastError = null;
    }

    public boolean involves(String mlsId) {
        return mlsId.equals(sourceMlsId) || mlsId.equals(targetMlsId);
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getSourceMlsId() { return sourceMlsId; }
    public void setSourceMlsId(String sourceMlsId) { this.sourceMlsId = sourceMlsId; }

    public String getTargetMlsId() { return targetMlsId; }
    public void setTargetMlsId(String targetMlsId) { this.targetMlsId = targetMlsId; }

    public Double getConfidence() { return confidence; }
    public void setConfidence(Double confidence) { this.confidence = confidence; }

    public String getMatchReasons() { return matchReasons; }
    public void setMatchReasons(String matchReasons) { this.matchReasons = matchReasons; }

    public String getSuggestedAction() { return suggestedAction; }
    public void setSuggestedAction(String suggestedAction) { this.suggestedAction = suggestedAction; }

    public String getMergePayload() { return mergePayload; }
    public void setMergePayload(String mergePayload) { this.mergePayload = mergePayload; }

    public Boolean getResolved() { return resolved; }
    public void setResolved(Boolean resolved) { this.resolved = resolved; }

    public String getResolvedAction() { return resolvedAction; }
    public void setResolvedAction(String resolvedAction) { this.resolvedAction = resolvedAction; }

    public LocalDateTime getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(LocalDateTime resolvedAt) { this.resolvedAt = resolvedAt; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DuplicateCandidateRecord that = (DuplicateCandidateRecord) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DuplicateCandidateRecord{" +
                "id=" + id +
                ", sourceMlsId='" + sourceMlsId + '\'' +
                ", targetMlsId='" + targetMlsId + '\'' +
                ", confidence=" + confidence +
                ", suggestedAction='" + suggestedAction + '\'' +
                ", resolved=" + resolved +
                ", resolvedAction='" + resolvedAction + '\'' +
                '}';
    }
}
