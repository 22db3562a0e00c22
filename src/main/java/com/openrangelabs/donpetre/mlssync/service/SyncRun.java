package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.exception.SyncStateException;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.model.SyncRunStatus;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one sync run.
 *
 * <p>Only the orchestration pipeline that owns the run mutates it. Every
 * mutation republishes an immutable {@link SyncRunSnapshot}, which is what
 * readers see. Cancellation is the only signal that crosses the ownership
 * boundary and is carried by an atomic flag.
 */
public class SyncRun {

    private final String runId;
    private final String providerId;
    private final SyncOptions options;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final List<SyncError> errors = new ArrayList<>();

    private SyncRunStatus status = SyncRunStatus.IDLE;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private int processed;
    private int updated;
    private int created;
    private int failed;
    private double progress;
    private Integer estimatedTotal;
    private String errorMessage;
    private int nextPage = 1;
    private int observedPageSize;
    private int consecutiveMalformedPages;
    private UUID recordId;

    private volatile SyncRunSnapshot snapshot;
    private volatile Mono<SyncRunSnapshot> execution;

    public SyncRun(String providerId, SyncOptions options, Clock clock) {
        this(newRunId(clock), providerId, options, clock);
    }

    SyncRun(String runId, String providerId, SyncOptions options, Clock clock) {
        this.runId = runId;
        this.providerId = providerId;
        this.options = options != null ? options : SyncOptions.defaults();
        this.clock = clock;
        publish();
    }

    /**
     * {@code mls_sync_<epochMillis>_<random>}
     */
    static String newRunId(Clock clock) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "mls_sync_" + clock.millis() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    // State transitions
    public void start() {
        transitionTo(SyncRunStatus.RUNNING);
        startedAt = LocalDateTime.now(clock);
        publish();
    }

    public void complete() {
        transitionTo(SyncRunStatus.COMPLETED);
        progress = 100.0;
        endedAt = LocalDateTime.now(clock);
        publish();
    }

    public void fail(String message) {
        transitionTo(SyncRunStatus.FAILED);
        errorMessage = message;
        endedAt = LocalDateTime.now(clock);
        publish();
    }

    public void pause() {
        transitionTo(SyncRunStatus.PAUSED);
        publish();
    }

    public void resume() {
        transitionTo(SyncRunStatus.RUNNING);
        cancelRequested.set(false);
        publish();
    }

    private void transitionTo(SyncRunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new SyncStateException("Sync run " + runId + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    // Page bookkeeping
    public void recordCreated() {
        processed++;
        created++;
    }

    public void recordUpdated() {
        processed++;
        updated++;
    }

    public void recordFailed() {
        processed++;
        failed++;
    }

    public void addError(SyncError error) {
        errors.add(error);
        publish();
    }

    public void setEstimatedTotal(Integer estimatedTotal) {
        if (estimatedTotal != null && estimatedTotal > 0) {
            this.estimatedTotal = estimatedTotal;
        }
    }

    /**
     * Recompute progress from processed / estimated total. Progress only moves
     * forward; an estimate that shrinks mid-run never pulls it back.
     */
    public void updateProgress() {
        if (estimatedTotal != null && estimatedTotal > 0) {
            double computed = Math.min(100.0, processed * 100.0 / estimatedTotal);
            progress = Math.max(progress, computed);
        }
        publish();
    }

    public void advancePage() {
        nextPage++;
    }

    public void pageFetched(int size) {
        consecutiveMalformedPages = 0;
        observedPageSize = Math.max(observedPageSize, size);
    }

    /**
     * @return number of malformed pages seen in a row, including this one
     */
    public int pageMalformed() {
        return ++consecutiveMalformedPages;
    }

    /**
     * False once the pages fetched or skipped so far cover the provider's
     * estimated total. Without an estimate or a known page size more records
     * are assumed.
     */
    public boolean expectsMoreRecords() {
        if (estimatedTotal == null || observedPageSize == 0) {
            return true;
        }
        return (long) (nextPage - 1) * observedPageSize < estimatedTotal;
    }

    // Cancellation
    public void requestCancellation() {
        cancelRequested.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelRequested.get();
    }

    public SyncRunSnapshot snapshot() {
        return snapshot;
    }

    void attachExecution(Mono<SyncRunSnapshot> execution) {
        this.execution = execution;
    }

    /**
     * Completes with the snapshot taken when the current execution stops,
     * i.e. when the run completes, fails or pauses.
     */
    public Mono<SyncRunSnapshot> execution() {
        Mono<SyncRunSnapshot> current = execution;
        return current != null ? current : Mono.fromSupplier(this::snapshot);
    }

    private void publish() {
        snapshot = new SyncRunSnapshot(runId, providerId, status, startedAt, endedAt,
                processed, updated, created, failed, progress, estimatedTotal, options,
                errorMessage, errors);
    }

    // Getters
    public String getRunId() { return runId; }
    public String getProviderId() { return providerId; }
    public SyncOptions getOptions() { return options; }
    public SyncRunStatus getStatus() { return status; }
    public int getProcessed() { return processed; }
    public int getNextPage() { return nextPage; }
    public double getProgress() { return progress; }

    public LocalDateTime getStartedAt() { return startedAt; }

    public UUID getRecordId() { return recordId; }
    public void setRecordId(UUID recordId) { this.recordId = recordId; }

    @Override
    public String toString() {
        return "SyncRun{" +
                "runId='" + runId + '\'' +
                ", providerId='" + providerId + '\'' +
                ", status=" + status +
                ", processed=" + processed +
                ", progress=" + progress +
                '}';
    }
}
