package com.openrangelabs.donpetre.mlssync.model;

import com.openrangelabs.donpetre.mlssync.entity.SyncError;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable view of a sync run, safe to hand to any reader.
 */
public record SyncRunSnapshot(
        String runId,
        String providerId,
        SyncRunStatus status,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        int processed,
        int updated,
        int created,
        int failed,
        double progress,
        Integer estimatedTotal,
        SyncOptions options,
        String errorMessage,
        List<SyncError> errors) {

    public SyncRunSnapshot {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isActive() {
        return !status.isTerminal();
    }
}
