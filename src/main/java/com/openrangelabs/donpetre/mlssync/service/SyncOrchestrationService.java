package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.duplicate.DuplicateDetector;
import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.exception.MlsProviderException;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.exception.SyncStateException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.DuplicateCandidate;
import com.openrangelabs.donpetre.mlssync.model.PropertyPage;
import com.openrangelabs.donpetre.mlssync.model.QualityScore;
import com.openrangelabs.donpetre.mlssync.model.RateLimitStatus;
import com.openrangelabs.donpetre.mlssync.model.StartSyncResult;
import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.model.SyncRunStatus;
import com.openrangelabs.donpetre.mlssync.model.UpsertOutcome;
import com.openrangelabs.donpetre.mlssync.provider.MlsProviderAdapter;
import com.openrangelabs.donpetre.mlssync.provider.ProviderAdapterRegistry;
import com.openrangelabs.donpetre.mlssync.quality.DataQualityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the fetch, validate, reconcile and persist loop, with at most one
 * live run per provider.
 *
 * <p>A run moves {@code IDLE -> RUNNING -> COMPLETED | FAILED | PAUSED}, and
 * a paused run may be resumed or abandoned. Pages are fetched sequentially.
 * Retryable fetch failures are retried with exponential backoff; a failure
 * scoped to a single record is logged as a {@link SyncError} and the run
 * carries on, as does a malformed page. Only an authentication failure or an
 * exhausted retry budget fails the run.
 */
@Service
public class SyncOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrationService.class);

    private final ProviderConfigService configService;
    private final ProviderAdapterRegistry adapterRegistry;
    private final DataQualityValidator validator;
    private final DuplicateDetector duplicateDetector;
    private final DuplicateResolutionService duplicateService;
    private final PropertyCatalogService catalogService;
    private final SyncRunService runService;
    private final SyncRunRegistry runRegistry;
    private final Clock clock;

    @Value("${mls.sync.retry.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${mls.sync.retry.initial-backoff:1s}")
    private Duration initialBackoff = Duration.ofSeconds(1);

    @Value("${mls.sync.retry.max-backoff:60s}")
    private Duration maxBackoff = Duration.ofSeconds(60);

    @Value("${mls.sync.max-malformed-pages:3}")
    private int maxMalformedPages = 3;

    @Value("${mls.sync.duplicate-window-size:200}")
    private int duplicateWindowSize = 200;

    @Value("${mls.validation.min-quality-score:60}")
    private int minQualityScore = 60;

    @Value("${mls.validation.exclude-below-threshold:false}")
    private boolean excludeBelowThreshold = false;

    @Autowired
    public SyncOrchestrationService(ProviderConfigService configService,
                                    ProviderAdapterRegistry adapterRegistry,
                                    DataQualityValidator validator,
                                    DuplicateDetector duplicateDetector,
                                    DuplicateResolutionService duplicateService,
                                    PropertyCatalogService catalogService,
                                    SyncRunService runService,
                                    SyncRunRegistry runRegistry,
                                    Clock clock) {
        this.configService = configService;
        this.adapterRegistry = adapterRegistry;
        this.validator = validator;
        this.duplicateDetector = duplicateDetector;
        this.duplicateService = duplicateService;
        this.catalogService = catalogService;
        this.runService = runService;
        this.runRegistry = runRegistry;
        this.clock = clock;
    }

    /**
     * Start a sync run for the provider. When a run is already active the
     * result is a conflict carrying that run, and nothing new is created.
     * The run itself continues in the background after the result is emitted.
     */
    public Mono<StartSyncResult> start(String providerId, SyncOptions options) {
        return configService.getProvider(providerId)
                .flatMap(config -> {
                    if (!config.isEnabled()) {
                        return Mono.error(new SyncStateException("Provider is disabled: " + providerId));
                    }
                    MlsProviderAdapter adapter = adapterRegistry.adapterFor(config);
                    SyncRun run = new SyncRun(providerId, effectiveOptions(config, options), clock);
                    Optional<SyncRun> active = runRegistry.register(run);
                    if (active.isPresent()) {
                        logger.warn("Sync already in progress for provider {}: {}", providerId, active.get().getRunId());
                        return Mono.just(StartSyncResult.conflict(active.get().snapshot()));
                    }

                    return Mono.defer(() -> {
                                run.start();
                                logger.info("Starting sync run {} for provider {} (fullSync={})",
                                        run.getRunId(), providerId, run.getOptions().isFullSync());
                                return runService.saveRun(run);
                            })
                            .map(saved -> {
                                SyncRunSnapshot started = run.snapshot();
                                launch(run, adapter);
                                return StartSyncResult.started(started);
                            })
                            .onErrorResume(error -> {
                                releaseSlot(run, error);
                                return Mono.error(error);
                            });
                });
    }

    /**
     * A run that could not be launched must not keep holding its provider slot
     */
    private void releaseSlot(SyncRun run, Throwable error) {
        logger.warn("Could not launch sync run {} for provider {}: {}",
                run.getRunId(), run.getProviderId(), error.getMessage());
        if (run.getStatus().canTransitionTo(SyncRunStatus.FAILED)) {
            run.fail("Could not start sync run: " + error.getMessage());
        } else {
            runRegistry.release(run);
        }
    }

    /**
     * Request cooperative cancellation. The run pauses before its next page
     * fetch, or completes if the page in flight is the last one.
     */
    public Mono<SyncRunSnapshot> stop(String runId) {
        return Mono.defer(() -> {
            SyncRun run = liveRun(runId);
            SyncRunSnapshot snapshot = run.snapshot();
            if (snapshot.status() != SyncRunStatus.RUNNING) {
                return Mono.error(new SyncStateException("Sync run " + runId + " is not running (" + snapshot.status() + ")"));
            }
            run.requestCancellation();
            logger.info("Stop requested for sync run {}", runId);
            return Mono.just(run.snapshot());
        });
    }

    /**
     * Resume a paused run from its next unfetched page
     */
    public Mono<SyncRunSnapshot> resume(String runId) {
        return Mono.defer(() -> {
            SyncRun run = liveRun(runId);
            return configService.getProvider(run.getProviderId())
                    .map(config -> {
                        synchronized (run) {
                            if (run.snapshot().status() != SyncRunStatus.PAUSED) {
                                throw new SyncStateException("Sync run " + runId + " is not paused (" + run.snapshot().status() + ")");
                            }
                            run.resume();
                        }
                        logger.info("Resuming sync run {} at page {}", runId, run.getNextPage());
                        SyncRunSnapshot resumed = run.snapshot();
                        launch(run, adapterRegistry.adapterFor(config));
                        return resumed;
                    });
        });
    }

    /**
     * Give up on a paused run, moving it to FAILED
     */
    public Mono<SyncRunSnapshot> abandon(String runId) {
        return Mono.defer(() -> {
            SyncRun run = liveRun(runId);
            synchronized (run) {
                if (run.snapshot().status() != SyncRunStatus.PAUSED) {
                    return Mono.error(new SyncStateException("Sync run " + runId + " is not paused (" + run.snapshot().status() + ")"));
                }
                run.fail("Abandoned while paused");
            }
            logger.info("Abandoned sync run {}", runId);
            return runService.saveRun(run).thenReturn(run.snapshot());
        });
    }

    /**
     * Latest run of the provider: the live snapshot when it is still in
     * memory, otherwise the last persisted checkpoint. Empty if the provider
     * never synced.
     */
    public Mono<SyncRunSnapshot> getStatus(String providerId) {
        return Mono.justOrEmpty(runRegistry.latest(providerId))
                .switchIfEmpty(Mono.defer(() -> runService.findLatestRun(providerId)
                        .flatMap(runService::toSnapshot)));
    }

    public Mono<SyncRunSnapshot> getProgress(String runId) {
        return Mono.justOrEmpty(runRegistry.findByRunId(runId).map(SyncRun::snapshot))
                .switchIfEmpty(Mono.defer(() -> runService.findRun(runId)
                        .flatMap(runService::toSnapshot)))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Sync run", runId)));
    }

    /**
     * Completes once the run's current execution completes, fails or pauses
     */
    public Mono<SyncRunSnapshot> awaitRun(String runId) {
        return Mono.defer(() -> liveRun(runId).execution());
    }

    public List<SyncRunSnapshot> getActiveRuns() {
        return runRegistry.activeRuns();
    }

    public boolean hasActiveRun(String providerId) {
        return runRegistry.hasActiveRun(providerId);
    }

    /**
     * Re-fetch the listing referenced by an error, store it and resolve the error
     */
    public Mono<SyncError> retryError(UUID errorId) {
        return runService.findError(errorId)
                .flatMap(error -> {
                    if (error.isResolved()) {
                        return Mono.just(error);
                    }
                    if (!error.hasRecordReference()) {
                        return Mono.error(new SyncStateException("Sync error " + errorId + " does not reference a listing"));
                    }
                    return getPropertyById(error.getProviderId(), error.getMlsRecordId())
                            .flatMap(record -> catalogService.upsert(record, validator.validateRecord(record)))
                            .then(Mono.defer(() -> runService.resolveError(errorId)))
                            .doOnSuccess(resolved -> logger.info("Retried sync error {} for listing {}",
                                    errorId, error.getMlsRecordId()));
                });
    }

    public Mono<SyncError> resolveError(UUID errorId) {
        return runService.resolveError(errorId);
    }

    public Mono<Boolean> testConnection(String providerId) {
        return configService.getProvider(providerId)
                .flatMap(config -> adapterRegistry.adapterFor(config).testConnection());
    }

    public Mono<RateLimitStatus> getRateLimitStatus(String providerId) {
        return configService.getProvider(providerId)
                .flatMap(config -> adapterRegistry.adapterFor(config).getRateLimitStatus());
    }

    public Mono<CanonicalPropertyRecord> getPropertyById(String providerId, String mlsId) {
        return configService.getProvider(providerId)
                .flatMap(config -> adapterRegistry.adapterFor(config).getPropertyById(mlsId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Listing", providerId + "/" + mlsId)));
    }

    // Run execution

    private void launch(SyncRun run, MlsProviderAdapter adapter) {
        Mono<SyncRunSnapshot> execution = execute(run, adapter).cache();
        run.attachExecution(execution);
        execution.subscribe(
                snapshot -> logger.debug("Sync run {} stopped executing in status {}", snapshot.runId(), snapshot.status()),
                error -> logger.error("Sync run {} terminated unexpectedly", run.getRunId(), error));
    }

    Mono<SyncRunSnapshot> execute(SyncRun run, MlsProviderAdapter adapter) {
        return authenticate(run, adapter)
                .then(Mono.defer(() -> processPages(run, adapter)))
                .flatMap(exhausted -> finish(run, exhausted))
                .onErrorResume(error -> failRun(run, error));
    }

    private Mono<Void> authenticate(SyncRun run, MlsProviderAdapter adapter) {
        return adapter.authenticate()
                .flatMap(authenticated -> authenticated
                        ? Mono.<Void>empty()
                        : Mono.error(MlsProviderException.auth("Authentication failed for provider " + run.getProviderId())));
    }

    /**
     * Fetch and process pages until the provider is exhausted (emits true) or
     * cancellation was requested before the next fetch (emits false).
     */
    private Mono<Boolean> processPages(SyncRun run, MlsProviderAdapter adapter) {
        return Mono.defer(() -> {
            if (run.isCancellationRequested()) {
                return Mono.just(false);
            }
            int pageNumber = run.getNextPage();
            return fetchPage(run, adapter, pageNumber)
                    .flatMap(page -> processPage(run, page).thenReturn(page))
                    .flatMap(page -> {
                        run.pageFetched(page.size());
                        run.advancePage();
                        return runService.saveRun(run).thenReturn(hasMorePages(run, page));
                    })
                    .switchIfEmpty(Mono.defer(() -> skipMalformedPage(run, pageNumber)))
                    .flatMap(more -> more
                            ? processPages(run, adapter)
                            : Mono.just(true));
        });
    }

    /**
     * Move past a page the provider returned malformed. Fetching continues
     * until the estimated total is covered or {@code maxMalformedPages} pages
     * in a row were malformed.
     */
    private Mono<Boolean> skipMalformedPage(SyncRun run, int pageNumber) {
        int malformedInRow = run.pageMalformed();
        run.advancePage();
        boolean more = run.expectsMoreRecords() && !recordCapReached(run);
        if (more && malformedInRow >= maxMalformedPages) {
            logger.warn("Sync run {} giving up after {} malformed pages in a row (last: page {})",
                    run.getRunId(), malformedInRow, pageNumber);
            more = false;
        }
        return runService.saveRun(run).thenReturn(more);
    }

    private Mono<PropertyPage> fetchPage(SyncRun run, MlsProviderAdapter adapter, int pageNumber) {
        return Mono.defer(() -> adapter.fetchPage(run.getOptions(), pageNumber))
                .retryWhen(retryPolicy(run, pageNumber))
                .onErrorResume(error -> error instanceof MlsProviderException
                                && ((MlsProviderException) error).getType() == SyncErrorType.DATA,
                        error -> {
                            logger.warn("Skipping malformed page {} of sync run {}: {}", pageNumber, run.getRunId(), error.getMessage());
                            return appendError(run, SyncErrorType.DATA, error.getMessage(), false, null)
                                    .then(Mono.empty());
                        });
    }

    /**
     * Retry retryable provider failures up to {@code maxAttempts} fetches in
     * total. Waits {@code initialBackoff * 2^(n-1)}, capped at
     * {@code maxBackoff}, or until the provider-reported reset instant for
     * rate-limited responses.
     */
    Retry retryPolicy(SyncRun run, int pageNumber) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (!isRetryable(failure) || attempt >= maxAttempts) {
                return Mono.<Long>error(failure);
            }
            Duration delay = backoffFor(failure, attempt);
            logger.warn("Fetching page {} for sync run {} failed (attempt {}/{}): {}; retrying in {} ms",
                    pageNumber, run.getRunId(), attempt, maxAttempts, failure.getMessage(), delay.toMillis());
            return Mono.delay(delay).thenReturn(attempt);
        }));
    }

    Duration backoffFor(Throwable failure, long attempt) {
        if (failure instanceof MlsProviderException && ((MlsProviderException) failure).getRetryAfter() != null) {
            Duration untilReset = Duration.between(LocalDateTime.now(clock), ((MlsProviderException) failure).getRetryAfter());
            if (untilReset.isNegative()) {
                return Duration.ZERO;
            }
            return untilReset.compareTo(maxBackoff) > 0 ? maxBackoff : untilReset;
        }
        Duration delay = initialBackoff.multipliedBy(1L << Math.min(attempt - 1, 20));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof MlsProviderException
                && ((MlsProviderException) failure).isRetryable()
                && ((MlsProviderException) failure).getType() != SyncErrorType.AUTH;
    }

    private Mono<Void> processPage(SyncRun run, PropertyPage page) {
        run.setEstimatedTotal(page.totalRecords());
        List<CanonicalPropertyRecord> records = withinRecordCap(run, page.records());

        Mono<Void> failures = Flux.fromIterable(page.failures())
                .concatMap(failure -> {
                    run.recordFailed();
                    return appendError(run, SyncErrorType.DATA, failure.message(), false, failure.mlsRecordId());
                })
                .then();

        Map<String, QualityScore> scores = new HashMap<>();
        List<CanonicalPropertyRecord> accepted = new ArrayList<>();
        List<SyncError> validationErrors = new ArrayList<>();
        if (run.getOptions().isValidateData()) {
            for (QualityScore score : validator.validateBatch(records)) {
                scores.put(score.getMlsId(), score);
            }
        }
        for (CanonicalPropertyRecord record : records) {
            QualityScore score = scores.get(record.getMlsId());
            if (score != null && score.isBelow(minQualityScore)) {
                validationErrors.add(newError(run, SyncErrorType.VALIDATION,
                        "Quality score " + score.getOverall() + " below " + minQualityScore + ": "
                                + String.join("; ", score.getIssues()),
                        false, record.getMlsId()));
                if (excludeBelowThreshold) {
                    run.recordFailed();
                    continue;
                }
            }
            accepted.add(record);
        }
        Mono<Void> validation = Flux.fromIterable(validationErrors)
                .concatMap(error -> appendError(run, error))
                .then();

        return failures
                .then(validation)
                .then(Mono.defer(() -> detectDuplicates(run, accepted)))
                .then(Mono.defer(() -> upsertAll(run, accepted, scores)))
                .doOnSuccess(done -> {
                    run.updateProgress();
                    logger.debug("Processed page {} of sync run {}: {} records, progress {}%",
                            page.pageNumber(), run.getRunId(), page.size(), Math.round(run.getProgress()));
                });
    }

    /**
     * Compare the page with itself and with the most recent catalog window;
     * only pairs touching the page are recorded.
     */
    private Mono<Void> detectDuplicates(SyncRun run, List<CanonicalPropertyRecord> pageRecords) {
        if (run.getOptions().isSkipDuplicates() || pageRecords.isEmpty()) {
            return Mono.empty();
        }
        Set<String> pageIds = pageRecords.stream()
                .map(CanonicalPropertyRecord::getMlsId)
                .collect(Collectors.toSet());
        return catalogService.findRecentRecords(run.getProviderId(), duplicateWindowSize)
                .filter(record -> !pageIds.contains(record.getMlsId()))
                .collectList()
                .flatMap(window -> {
                    List<CanonicalPropertyRecord> combined = new ArrayList<>(pageRecords);
                    combined.addAll(window);
                    return duplicateDetector.findDuplicates(combined, run::isCancellationRequested);
                })
                .map(candidates -> candidates.stream()
                        .filter(candidate -> pageIds.contains(candidate.getSource().getMlsId())
                                || pageIds.contains(candidate.getTarget().getMlsId()))
                        .collect(Collectors.<DuplicateCandidate>toList()))
                .flatMap(candidates -> candidates.isEmpty()
                        ? Mono.empty()
                        : duplicateService.recordCandidates(run.getProviderId(), candidates).then());
    }

    private Mono<Void> upsertAll(SyncRun run, List<CanonicalPropertyRecord> records, Map<String, QualityScore> scores) {
        return Flux.fromIterable(records)
                .concatMap(record -> catalogService.upsert(record, scores.get(record.getMlsId()))
                        .doOnNext(outcome -> {
                            if (outcome == UpsertOutcome.CREATED) {
                                run.recordCreated();
                            } else {
                                run.recordUpdated();
                            }
                        })
                        .then()
                        .onErrorResume(error -> {
                            logger.warn("Failed to store listing {} in sync run {}: {}",
                                    record.getMlsId(), run.getRunId(), error.getMessage());
                            run.recordFailed();
                            return appendError(run, SyncErrorType.DATA,
                                    "Failed to store listing: " + error.getMessage(), true, record.getMlsId());
                        }))
                .then();
    }

    private Mono<SyncRunSnapshot> finish(SyncRun run, boolean exhausted) {
        if (!exhausted) {
            run.pause();
            logger.info("Paused sync run {} before page {}: processed={}",
                    run.getRunId(), run.getNextPage(), run.getProcessed());
            return runService.saveRun(run).thenReturn(run.snapshot());
        }
        run.complete();
        SyncRunSnapshot snapshot = run.snapshot();
        logger.info("Sync run {} completed for provider {}: processed={}, created={}, updated={}, failed={}",
                run.getRunId(), run.getProviderId(), snapshot.processed(), snapshot.created(),
                snapshot.updated(), snapshot.failed());
        return runService.saveRun(run)
                .then(configService.recordSyncSuccess(run.getProviderId(), run.getStartedAt())
                        .onErrorResume(error -> {
                            logger.warn("Could not record sync success for provider {}: {}",
                                    run.getProviderId(), error.getMessage());
                            return Mono.empty();
                        }))
                .thenReturn(snapshot);
    }

    private Mono<SyncRunSnapshot> failRun(SyncRun run, Throwable error) {
        SyncErrorType type = SyncErrorType.API;
        boolean retryable = false;
        if (error instanceof MlsProviderException) {
            type = ((MlsProviderException) error).getType();
            retryable = ((MlsProviderException) error).isRetryable();
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof MlsProviderException) {
            logger.error("Sync run {} for provider {} failed: {}", run.getRunId(), run.getProviderId(), message);
        } else {
            logger.error("Sync run {} for provider {} failed unexpectedly", run.getRunId(), run.getProviderId(), error);
        }

        if (!run.getStatus().canTransitionTo(SyncRunStatus.FAILED)) {
            return Mono.just(run.snapshot());
        }
        SyncError syncError = newError(run, type, message, retryable, null);
        run.addError(syncError);
        run.fail(message);
        return runService.recordError(syncError)
                .then(runService.saveRun(run))
                .then(configService.recordSyncError(run.getProviderId(), message))
                .thenReturn(run.snapshot());
    }

    private Mono<Void> appendError(SyncRun run, SyncErrorType type, String message, boolean retryable, String mlsRecordId) {
        return appendError(run, newError(run, type, message, retryable, mlsRecordId));
    }

    private Mono<Void> appendError(SyncRun run, SyncError error) {
        run.addError(error);
        return runService.recordError(error).then();
    }

    private static SyncError newError(SyncRun run, SyncErrorType type, String message, boolean retryable, String mlsRecordId) {
        return new SyncError(run.getRunId(), run.getProviderId(), type, message, retryable, mlsRecordId);
    }

    private boolean hasMorePages(SyncRun run, PropertyPage page) {
        if (!page.hasMore() || page.size() == 0) {
            return false;
        }
        return !recordCapReached(run);
    }

    private static boolean recordCapReached(SyncRun run) {
        SyncOptions options = run.getOptions();
        return options.hasRecordCap() && run.getProcessed() >= options.getMaxRecords();
    }

    private static List<CanonicalPropertyRecord> withinRecordCap(SyncRun run, List<CanonicalPropertyRecord> records) {
        SyncOptions options = run.getOptions();
        if (!options.hasRecordCap()) {
            return records;
        }
        int remaining = Math.max(0, options.getMaxRecords() - run.getProcessed());
        return records.size() > remaining ? records.subList(0, remaining) : records;
    }

    /**
     * Incremental runs without an explicit window start from the provider's last successful sync
     */
    SyncOptions effectiveOptions(MlsProviderConfig config, SyncOptions requested) {
        SyncOptions options = requested != null ? requested : SyncOptions.defaults();
        if (!options.isFullSync() && options.getDateRange() == null && config.getLastSyncAt() != null) {
            return options.toBuilder()
                    .dateRange(SyncOptions.DateRange.builder().start(config.getLastSyncAt()).build())
                    .build();
        }
        return options;
    }

    private SyncRun liveRun(String runId) {
        return runRegistry.findByRunId(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Active sync run", runId));
    }
}
