package com.openrangelabs.donpetre.mlssync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.entity.SyncRunRecord;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.model.SyncRunStatus;
import com.openrangelabs.donpetre.mlssync.repository.SyncErrorRepository;
import com.openrangelabs.donpetre.mlssync.repository.SyncRunRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persistence of sync run checkpoints and their errors
 */
@Service
public class SyncRunService {

    private static final Logger logger = LoggerFactory.getLogger(SyncRunService.class);

    static final int DEFAULT_ERROR_LIMIT = 10;
    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int RECENT_ERROR_HOURS = 24;

    private final SyncRunRecordRepository runRepository;
    private final SyncErrorRepository errorRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SyncRunService(SyncRunRecordRepository runRepository,
                          SyncErrorRepository errorRepository,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.runRepository = runRepository;
        this.errorRepository = errorRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Write a checkpoint of the run. The first save inserts; the generated id
     * is kept on the run so later checkpoints update the same row.
     */
    public Mono<SyncRunRecord> saveRun(SyncRun run) {
        SyncRunSnapshot snapshot = run.snapshot();
        SyncRunRecord record = new SyncRunRecord();
        record.setId(run.getRecordId());
        record.setRunId(snapshot.runId());
        record.setProviderId(snapshot.providerId());
        record.setStatus(snapshot.status().name());
        record.setStartedAt(snapshot.startedAt());
        record.setEndedAt(snapshot.endedAt());
        record.setRecordsProcessed(snapshot.processed());
        record.setRecordsUpdated(snapshot.updated());
        record.setRecordsCreated(snapshot.created());
        record.setRecordsFailed(snapshot.failed());
        record.setProgress(snapshot.progress());
        record.setEstimatedTotal(snapshot.estimatedTotal());
        record.setOptions(writeOptions(snapshot.options()));
        record.setErrorMessage(snapshot.errorMessage());

        return runRepository.save(record)
                .doOnNext(saved -> run.setRecordId(saved.getId()))
                .doOnSuccess(saved -> logger.debug("Checkpointed sync run {} ({})", snapshot.runId(), snapshot.status()));
    }

    /**
     * Append an error to the log
     */
    public Mono<SyncError> recordError(SyncError error) {
        return errorRepository.save(error)
                .doOnSuccess(saved -> logger.debug("Recorded {} error for run {}: {}",
                        error.getErrorType(), error.getRunId(), error.getMessage()));
    }

    public Mono<SyncRunRecord> findRun(String runId) {
        return runRepository.findByRunId(runId);
    }

    public Mono<SyncRunRecord> findLatestRun(String providerId) {
        return runRepository.findLatestByProviderId(providerId);
    }

    public Flux<SyncRunRecord> getRunHistory(String providerId, int limit) {
        return runRepository.findHistory(providerId, limit > 0 ? limit : DEFAULT_HISTORY_LIMIT);
    }

    public Flux<SyncError> getRunErrors(String runId) {
        return errorRepository.findByRunIdOrderByOccurredAtAsc(runId);
    }

    /**
     * Errors from the last 24 hours, newest first, optionally for one provider
     */
    public Flux<SyncError> getRecentErrors(String providerId, int limit) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(RECENT_ERROR_HOURS);
        int effectiveLimit = limit > 0 ? limit : DEFAULT_ERROR_LIMIT;
        if (providerId == null || providerId.isBlank()) {
            return errorRepository.findRecent(since, effectiveLimit);
        }
        return errorRepository.findRecentByProviderId(providerId, since, effectiveLimit);
    }

    public Mono<SyncError> findError(UUID errorId) {
        return errorRepository.findById(errorId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Sync error", errorId.toString())));
    }

    /**
     * Mark an error resolved. Resolving twice leaves the first resolution in place.
     */
    public Mono<SyncError> resolveError(UUID errorId) {
        return findError(errorId)
                .flatMap(error -> {
                    if (error.isResolved()) {
                        return Mono.just(error);
                    }
                    error.resolve();
                    return errorRepository.save(error)
                            .doOnSuccess(saved -> logger.info("Resolved sync error {}", errorId));
                });
    }

    /**
     * Delete finished runs and errors older than the retention period
     */
    public Mono<Integer> cleanupOldRuns(int retentionDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
        return runRepository.deleteFinishedBefore(cutoff)
                .zipWith(errorRepository.deleteOlderThan(cutoff), Integer::sum)
                .doOnSuccess(count -> logger.info("Cleaned up {} sync runs and errors older than {} days", count, retentionDays));
    }

    /**
     * Rebuild a snapshot from a persisted checkpoint and its errors
     */
    public Mono<SyncRunSnapshot> toSnapshot(SyncRunRecord record) {
        return getRunErrors(record.getRunId())
                .collectList()
                .map(errors -> toSnapshot(record, errors));
    }

    SyncRunSnapshot toSnapshot(SyncRunRecord record, List<SyncError> errors) {
        return new SyncRunSnapshot(
                record.getRunId(),
                record.getProviderId(),
                SyncRunStatus.valueOf(record.getStatus()),
                record.getStartedAt(),
                record.getEndedAt(),
                valueOf(record.getRecordsProcessed()),
                valueOf(record.getRecordsUpdated()),
                valueOf(record.getRecordsCreated()),
                valueOf(record.getRecordsFailed()),
                record.getProgress() != null ? record.getProgress() : 0.0,
                record.getEstimatedTotal(),
                readOptions(record.getOptions()),
                record.getErrorMessage(),
                errors);
    }

    private String writeOptions(SyncOptions options) {
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sync options", e);
        }
    }

    private SyncOptions readOptions(String json) {
        if (json == null || json.isBlank()) {
            return SyncOptions.defaults();
        }
        try {
            return objectMapper.readValue(json, SyncOptions.class);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable sync options {}, using defaults", json, e);
            return SyncOptions.defaults();
        }
    }

    private static int valueOf(Integer value) {
        return value != null ? value : 0;
    }
}
