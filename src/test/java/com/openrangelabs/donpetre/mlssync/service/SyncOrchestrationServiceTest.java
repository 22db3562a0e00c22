package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.MutableClock;
import com.openrangelabs.donpetre.mlssync.TestRecords;
import com.openrangelabs.donpetre.mlssync.duplicate.DuplicateDetector;
import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.entity.SyncRunRecord;
import com.openrangelabs.donpetre.mlssync.exception.MlsProviderException;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.exception.SyncStateException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.PropertyPage;
import com.openrangelabs.donpetre.mlssync.model.ProviderFamily;
import com.openrangelabs.donpetre.mlssync.model.StartSyncResult;
import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.model.SyncRunStatus;
import com.openrangelabs.donpetre.mlssync.model.UpsertOutcome;
import com.openrangelabs.donpetre.mlssync.provider.MlsProviderAdapter;
import com.openrangelabs.donpetre.mlssync.provider.ProviderAdapterRegistry;
import com.openrangelabs.donpetre.mlssync.quality.DataQualityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncOrchestrationServiceTest {

    private static final String PROVIDER_ID = "crmls";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private ProviderConfigService configService;

    @Mock
    private ProviderAdapterRegistry adapterRegistry;

    @Mock
    private MlsProviderAdapter adapter;

    @Mock
    private DuplicateResolutionService duplicateService;

    @Mock
    private PropertyCatalogService catalogService;

    @Mock
    private SyncRunService runService;

    private MutableClock clock;
    private MlsProviderConfig config;
    private SyncRunRegistry runRegistry;
    private SyncOrchestrationService orchestrationService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        runRegistry = new SyncRunRegistry();
        config = TestRecords.provider(PROVIDER_ID, ProviderFamily.CUSTOM, "http://mls.example.com");

        orchestrationService = new SyncOrchestrationService(
                configService,
                adapterRegistry,
                new DataQualityValidator(clock),
                new DuplicateDetector(),
                duplicateService,
                catalogService,
                runService,
                runRegistry,
                clock);

        ReflectionTestUtils.setField(orchestrationService, "initialBackoff", Duration.ofMillis(1));

        lenient().when(configService.getProvider(PROVIDER_ID)).thenReturn(Mono.just(config));
        lenient().when(configService.recordSyncSuccess(eq(PROVIDER_ID), any())).thenReturn(Mono.just(config));
        lenient().when(configService.recordSyncError(eq(PROVIDER_ID), any())).thenReturn(Mono.just(config));
        lenient().when(adapterRegistry.adapterFor(config)).thenReturn(adapter);
        lenient().when(adapter.authenticate()).thenReturn(Mono.just(true));
        lenient().when(runService.saveRun(any(SyncRun.class))).thenReturn(Mono.just(new SyncRunRecord()));
        lenient().when(runService.recordError(any(SyncError.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(catalogService.upsert(any(CanonicalPropertyRecord.class), any()))
                .thenReturn(Mono.just(UpsertOutcome.CREATED));
        lenient().when(catalogService.findRecentRecords(eq(PROVIDER_ID), anyInt())).thenReturn(Flux.empty());
        lenient().when(duplicateService.recordCandidates(eq(PROVIDER_ID), anyList())).thenReturn(Mono.just(1));
    }

    @Test
    void start_ProcessesAllPagesAndCompletes() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, true, 3,
                TestRecords.listing("A-1"), TestRecords.listing("A-2"))));
        when(adapter.fetchPage(any(SyncOptions.class), eq(2))).thenReturn(Mono.just(page(2, false, 3,
                TestRecords.listing("A-3"))));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, SyncOptions.defaults()).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(result.isStarted()).isTrue();
        assertThat(result.run().status()).isEqualTo(SyncRunStatus.RUNNING);
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(3);
        assertThat(finished.created()).isEqualTo(3);
        assertThat(finished.failed()).isZero();
        assertThat(finished.progress()).isEqualTo(100.0);
        assertThat(finished.errors()).isEmpty();

        verify(catalogService, times(3)).upsert(any(CanonicalPropertyRecord.class), any());
        verify(duplicateService).recordCandidates(eq(PROVIDER_ID), argThat(candidates -> candidates.size() == 1));
        verify(configService).recordSyncSuccess(PROVIDER_ID, LocalDateTime.of(2025, 6, 1, 12, 0));
        verify(configService, never()).recordSyncError(any(), any());
    }

    @Test
    void start_WhileRunActive_ReturnsConflictWithActiveRun() {
        // Arrange
        when(adapter.authenticate()).thenReturn(Mono.never());
        StartSyncResult first = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);

        // Act & Assert
        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .assertNext(second -> {
                    assertThat(second.isStarted()).isFalse();
                    assertThat(second.outcome()).isEqualTo(StartSyncResult.Outcome.CONFLICT);
                    assertThat(second.activeRunId()).isEqualTo(first.activeRunId());
                })
                .verifyComplete();

        verify(runService, times(1)).saveRun(any(SyncRun.class));
        assertThat(orchestrationService.getActiveRuns()).hasSize(1);
        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isTrue();
    }

    @Test
    void start_AdapterUnavailable_DoesNotHoldProviderSlot() {
        // Arrange
        when(adapterRegistry.adapterFor(config))
                .thenThrow(new IllegalArgumentException("Provider endpoint is required"))
                .thenReturn(adapter);
        when(adapter.authenticate()).thenReturn(Mono.never());

        // Act & Assert
        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .expectErrorMatches(error -> error instanceof IllegalArgumentException
                        && error.getMessage().equals("Provider endpoint is required"))
                .verify();

        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isFalse();
        assertThat(orchestrationService.getActiveRuns()).isEmpty();
        verify(runService, never()).saveRun(any(SyncRun.class));

        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .assertNext(second -> assertThat(second.isStarted()).isTrue())
                .verifyComplete();
    }

    @Test
    void start_RunNotPersisted_ReleasesProviderSlot() {
        // Arrange
        when(runService.saveRun(any(SyncRun.class)))
                .thenReturn(Mono.error(new IllegalStateException("database unavailable")))
                .thenReturn(Mono.just(new SyncRunRecord()));
        when(adapter.authenticate()).thenReturn(Mono.never());

        // Act & Assert
        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .expectErrorMessage("database unavailable")
                .verify();

        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isFalse();

        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .assertNext(second -> assertThat(second.isStarted()).isTrue())
                .verifyComplete();
    }

    @Test
    void start_DisabledProvider_IsRejected() {
        // Arrange
        config.setEnabled(false);

        // Act & Assert
        StepVerifier.create(orchestrationService.start(PROVIDER_ID, null))
                .expectErrorMatches(error -> error instanceof SyncStateException
                        && error.getMessage().contains("disabled"))
                .verify();

        verifyNoInteractions(adapterRegistry);
    }

    @Test
    void start_NetworkFailuresExhaustRetries_FailsRunWithRetryableError() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1)))
                .thenReturn(Mono.error(MlsProviderException.network("Connection reset", null)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.FAILED);
        assertThat(finished.errorMessage()).isEqualTo("Connection reset");
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.NETWORK);
            assertThat(error.isRetryable()).isTrue();
        });
        verify(adapter, times(3)).fetchPage(any(SyncOptions.class), eq(1));
        verify(configService).recordSyncError(PROVIDER_ID, "Connection reset");
        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isFalse();
    }

    @Test
    void start_RateLimitedOnce_RetriesAndCompletes() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(
                Mono.error(MlsProviderException.rateLimited("HTTP 429", LocalDateTime.now(clock))),
                Mono.just(page(1, false, 1, TestRecords.listing("RL-1"))));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(1);
        verify(adapter, times(2)).fetchPage(any(SyncOptions.class), eq(1));
    }

    @Test
    void start_AuthenticationRejected_FailsWithoutFetching() {
        // Arrange
        when(adapter.authenticate()).thenReturn(Mono.just(false));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.FAILED);
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.AUTH);
            assertThat(error.isRetryable()).isFalse();
        });
        verify(adapter, never()).fetchPage(any(SyncOptions.class), anyInt());
    }

    @Test
    void start_MalformedPage_RecordsDataErrorAndContinuesWithNextPage() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1)))
                .thenReturn(Mono.just(page(1, true, 3, TestRecords.listing("D-1"))));
        when(adapter.fetchPage(any(SyncOptions.class), eq(2)))
                .thenReturn(Mono.error(MlsProviderException.data("Unexpected response body", null)));
        when(adapter.fetchPage(any(SyncOptions.class), eq(3)))
                .thenReturn(Mono.just(page(3, false, 3, TestRecords.listing("D-3"))));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(2);
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.DATA);
            assertThat(error.getMessage()).isEqualTo("Unexpected response body");
        });
        verify(adapter, times(1)).fetchPage(any(SyncOptions.class), eq(2));
        verify(adapter, times(1)).fetchPage(any(SyncOptions.class), eq(3));
        verify(catalogService).upsert(argThat(record -> record != null && "D-3".equals(record.getMlsId())), any());
    }

    @Test
    void start_MalformedPageCoveringEstimatedTotal_Completes() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, true, 4,
                TestRecords.listing("E-1"), TestRecords.listing("E-2"))));
        when(adapter.fetchPage(any(SyncOptions.class), eq(2)))
                .thenReturn(Mono.error(MlsProviderException.data("Unexpected response body", null)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(2);
        verify(adapter, never()).fetchPage(any(SyncOptions.class), eq(3));
    }

    @Test
    void start_RepeatedMalformedPages_StopsAfterLimit() {
        // Arrange
        when(adapter.fetchPage(any(SyncOptions.class), eq(1)))
                .thenReturn(Mono.just(page(1, true, null, TestRecords.listing("G-1"))));
        when(adapter.fetchPage(any(SyncOptions.class), intThat(pageNumber -> pageNumber > 1)))
                .thenReturn(Mono.error(MlsProviderException.data("Unexpected response body", null)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.errors()).hasSize(3)
                .allSatisfy(error -> assertThat(error.getType()).isEqualTo(SyncErrorType.DATA));
        verify(adapter, times(4)).fetchPage(any(SyncOptions.class), anyInt());
        verify(adapter, never()).fetchPage(any(SyncOptions.class), eq(5));
    }

    @Test
    void start_UntransformableItems_CountAsFailedRecords() {
        // Arrange
        PropertyPage page = new PropertyPage(1, List.of(TestRecords.listing("F-1")),
                List.of(new PropertyPage.RecordFailure("F-2", "Unparseable price: call agent")), false, 2);
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(2);
        assertThat(finished.failed()).isEqualTo(1);
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.DATA);
            assertThat(error.getMlsRecordId()).isEqualTo("F-2");
        });
    }

    @Test
    void start_StoreFailure_IsRecordedAndRunContinues() {
        // Arrange
        CanonicalPropertyRecord broken = TestRecords.listing("S-1");
        CanonicalPropertyRecord fine = TestRecords.listing("S-2").toBuilder().price(new BigDecimal("900000")).build();
        when(catalogService.upsert(eq(broken), any())).thenReturn(Mono.error(new IllegalStateException("constraint violated")));
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, false, 2, broken, fine)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.created()).isEqualTo(1);
        assertThat(finished.failed()).isEqualTo(1);
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getMlsRecordId()).isEqualTo("S-1");
            assertThat(error.isRetryable()).isTrue();
            assertThat(error.getMessage()).contains("constraint violated");
        });
    }

    @Test
    void start_LowQualityRecord_LogsValidationErrorButStoresRecord() {
        // Arrange
        ReflectionTestUtils.setField(orchestrationService, "minQualityScore", 70);
        CanonicalPropertyRecord sparse = CanonicalPropertyRecord.builder().mlsId("LOW").providerId(PROVIDER_ID).build();
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, false, 1, sparse)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.created()).isEqualTo(1);
        assertThat(finished.errors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.VALIDATION);
            assertThat(error.getMessage()).startsWith("Quality score 62 below 70");
            assertThat(error.getMlsRecordId()).isEqualTo("LOW");
        });
        verify(catalogService).upsert(eq(sparse), argThat(score -> score != null && score.getOverall() == 62));
    }

    @Test
    void start_LowQualityRecordWithExclusion_IsNotStored() {
        // Arrange
        ReflectionTestUtils.setField(orchestrationService, "minQualityScore", 70);
        ReflectionTestUtils.setField(orchestrationService, "excludeBelowThreshold", true);
        CanonicalPropertyRecord sparse = CanonicalPropertyRecord.builder().mlsId("LOW").providerId(PROVIDER_ID).build();
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, false, 1, sparse)));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.processed()).isEqualTo(1);
        assertThat(finished.failed()).isEqualTo(1);
        verify(catalogService, never()).upsert(any(CanonicalPropertyRecord.class), any());
    }

    @Test
    void start_RecordCap_StopsFetchingOnceReached() {
        // Arrange
        SyncOptions options = SyncOptions.builder().maxRecords(2).skipDuplicates(true).build();
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(Mono.just(page(1, true, 10,
                TestRecords.listing("C-1"), TestRecords.listing("C-2"), TestRecords.listing("C-3"))));

        // Act
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, options).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(result.activeRunId()).block(TIMEOUT);

        // Assert
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(2);
        verify(adapter, never()).fetchPage(any(SyncOptions.class), eq(2));
        verifyNoInteractions(duplicateService);
    }

    @Test
    void stop_PausesBeforeNextPage_AndResumeContinuesFromThere() {
        // Arrange
        Sinks.One<PropertyPage> firstPage = Sinks.one();
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(firstPage.asMono());
        StartSyncResult result = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT);
        String runId = result.activeRunId();

        // Act: stop while page 1 is in flight
        SyncRunSnapshot stopping = orchestrationService.stop(runId).block(TIMEOUT);
        firstPage.tryEmitValue(page(1, true, 2, TestRecords.listing("P-1")));
        SyncRunSnapshot paused = orchestrationService.awaitRun(runId).block(TIMEOUT);

        // Assert
        assertThat(stopping.status()).isEqualTo(SyncRunStatus.RUNNING);
        assertThat(paused.status()).isEqualTo(SyncRunStatus.PAUSED);
        assertThat(paused.processed()).isEqualTo(1);
        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isTrue();

        // Act: resume picks up at page 2
        when(adapter.fetchPage(any(SyncOptions.class), eq(2)))
                .thenReturn(Mono.just(page(2, false, 2, TestRecords.listing("P-2").toBuilder()
                        .price(new BigDecimal("150000")).build())));
        SyncRunSnapshot resumed = orchestrationService.resume(runId).block(TIMEOUT);
        SyncRunSnapshot finished = orchestrationService.awaitRun(runId).block(TIMEOUT);

        // Assert
        assertThat(resumed.status()).isEqualTo(SyncRunStatus.RUNNING);
        assertThat(finished.status()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(finished.processed()).isEqualTo(2);
        verify(adapter, times(1)).fetchPage(any(SyncOptions.class), eq(1));
    }

    @Test
    void abandon_PausedRun_MovesToFailed() {
        // Arrange
        Sinks.One<PropertyPage> firstPage = Sinks.one();
        when(adapter.fetchPage(any(SyncOptions.class), eq(1))).thenReturn(firstPage.asMono());
        String runId = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT).activeRunId();
        orchestrationService.stop(runId).block(TIMEOUT);
        firstPage.tryEmitValue(page(1, true, 5, TestRecords.listing("AB-1")));
        orchestrationService.awaitRun(runId).block(TIMEOUT);

        // Act & Assert
        StepVerifier.create(orchestrationService.abandon(runId))
                .assertNext(snapshot -> {
                    assertThat(snapshot.status()).isEqualTo(SyncRunStatus.FAILED);
                    assertThat(snapshot.errorMessage()).isEqualTo("Abandoned while paused");
                })
                .verifyComplete();
        assertThat(orchestrationService.hasActiveRun(PROVIDER_ID)).isFalse();
    }

    @Test
    void stop_RunNotRunning_IsRejected() {
        // Arrange
        when(adapter.authenticate()).thenReturn(Mono.just(false));
        String runId = orchestrationService.start(PROVIDER_ID, null).block(TIMEOUT).activeRunId();
        orchestrationService.awaitRun(runId).block(TIMEOUT);

        // Act & Assert
        StepVerifier.create(orchestrationService.stop(runId))
                .expectError(SyncStateException.class)
                .verify();
        StepVerifier.create(orchestrationService.resume(runId))
                .expectError(SyncStateException.class)
                .verify();
    }

    @Test
    void stop_UnknownRun_IsNotFound() {
        StepVerifier.create(orchestrationService.stop("mls_sync_0_missing"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void getProgress_FallsBackToPersistedRun() {
        // Arrange
        SyncRunRecord record = new SyncRunRecord();
        record.setRunId("mls_sync_1_old");
        SyncRunSnapshot persisted = new SyncRunSnapshot("mls_sync_1_old", PROVIDER_ID, SyncRunStatus.COMPLETED,
                null, null, 10, 4, 6, 0, 100.0, 10, SyncOptions.defaults(), null, List.of());
        when(runService.findRun("mls_sync_1_old")).thenReturn(Mono.just(record));
        when(runService.toSnapshot(record)).thenReturn(Mono.just(persisted));
        when(runService.findRun("unknown")).thenReturn(Mono.empty());

        // Act & Assert
        StepVerifier.create(orchestrationService.getProgress("mls_sync_1_old"))
                .expectNext(persisted)
                .verifyComplete();
        StepVerifier.create(orchestrationService.getProgress("unknown"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void retryError_RefetchesListingAndResolvesError() {
        // Arrange
        UUID errorId = UUID.randomUUID();
        SyncError error = new SyncError("mls_sync_1_x", PROVIDER_ID, SyncErrorType.DATA, "store failed", true, "R-7");
        error.setId(errorId);
        SyncError resolved = new SyncError("mls_sync_1_x", PROVIDER_ID, SyncErrorType.DATA, "store failed", true, "R-7");
        resolved.setId(errorId);
        resolved.resolve();
        when(runService.findError(errorId)).thenReturn(Mono.just(error));
        when(adapter.getPropertyById("R-7")).thenReturn(Mono.just(TestRecords.listing("R-7")));
        when(runService.resolveError(errorId)).thenReturn(Mono.just(resolved));

        // Act & Assert
        StepVerifier.create(orchestrationService.retryError(errorId))
                .assertNext(result -> assertThat(result.isResolved()).isTrue())
                .verifyComplete();
        verify(catalogService).upsert(argThat(record -> "R-7".equals(record.getMlsId())), any());
    }

    @Test
    void retryError_WithoutListingReference_IsRejected() {
        // Arrange
        UUID errorId = UUID.randomUUID();
        SyncError error = new SyncError("mls_sync_1_x", PROVIDER_ID, SyncErrorType.NETWORK, "timeout", true, null);
        when(runService.findError(errorId)).thenReturn(Mono.just(error));

        // Act & Assert
        StepVerifier.create(orchestrationService.retryError(errorId))
                .expectError(SyncStateException.class)
                .verify();
    }

    @Test
    void effectiveOptions_IncrementalSyncStartsAtLastSuccess() {
        // Arrange
        LocalDateTime lastSync = LocalDateTime.of(2025, 5, 31, 8, 0);
        config.setLastSyncAt(lastSync);

        // Act
        SyncOptions incremental = orchestrationService.effectiveOptions(config, SyncOptions.defaults());
        SyncOptions full = orchestrationService.effectiveOptions(config, SyncOptions.builder().fullSync(true).build());

        // Assert
        assertThat(incremental.getDateRange().getStart()).isEqualTo(lastSync);
        assertThat(incremental.getDateRange().getEnd()).isNull();
        assertThat(full.getDateRange()).isNull();
    }

    @Test
    void backoffFor_DoublesUpToCapAndHonoursRetryAfter() {
        // Arrange
        ReflectionTestUtils.setField(orchestrationService, "initialBackoff", Duration.ofSeconds(1));
        MlsProviderException network = MlsProviderException.network("reset", null);
        LocalDateTime now = LocalDateTime.now(clock);

        // Assert
        assertThat(orchestrationService.backoffFor(network, 1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(orchestrationService.backoffFor(network, 3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(orchestrationService.backoffFor(network, 10)).isEqualTo(Duration.ofSeconds(60));
        assertThat(orchestrationService.backoffFor(MlsProviderException.rateLimited("429", now.plusSeconds(10)), 1))
                .isEqualTo(Duration.ofSeconds(10));
        assertThat(orchestrationService.backoffFor(MlsProviderException.rateLimited("429", now.plusMinutes(5)), 1))
                .isEqualTo(Duration.ofSeconds(60));
        assertThat(orchestrationService.backoffFor(MlsProviderException.rateLimited("429", now.minusSeconds(5)), 1))
                .isEqualTo(Duration.ZERO);
    }

    private static PropertyPage page(int pageNumber, boolean hasMore, Integer total, CanonicalPropertyRecord... records) {
        return new PropertyPage(pageNumber, List.of(records), List.of(), hasMore, total);
    }
}
