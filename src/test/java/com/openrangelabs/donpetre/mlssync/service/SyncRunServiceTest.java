package com.openrangelabs.donpetre.mlssync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.MutableClock;
import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.entity.SyncRunRecord;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.model.SyncRunStatus;
import com.openrangelabs.donpetre.mlssync.repository.SyncErrorRepository;
import com.openrangelabs.donpetre.mlssync.repository.SyncRunRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncRunServiceTest {

    @Mock
    private SyncRunRecordRepository runRepository;

    @Mock
    private SyncErrorRepository errorRepository;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private SyncRunService runService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        runService = new SyncRunService(runRepository, errorRepository, objectMapper, clock);
    }

    @Test
    void saveRun_FirstCheckpointInsertsAndLaterOnesUpdateSameRow() {
        // Arrange
        UUID generatedId = UUID.randomUUID();
        SyncRun run = new SyncRun("crmls", SyncOptions.builder().fullSync(true).maxRecords(500).build(), clock);
        run.start();
        when(runRepository.save(any(SyncRunRecord.class))).thenAnswer(invocation -> {
            SyncRunRecord record = invocation.getArgument(0);
            if (record.getId() == null) {
                record.setId(generatedId);
            }
            return Mono.just(record);
        });

        // Act
        runService.saveRun(run).block();
        run.recordCreated();
        runService.saveRun(run).block();

        // Assert
        ArgumentCaptor<SyncRunRecord> saved = ArgumentCaptor.forClass(SyncRunRecord.class);
        verify(runRepository, times(2)).save(saved.capture());
        SyncRunRecord second = saved.getAllValues().get(1);
        assertThat(run.getRecordId()).isEqualTo(generatedId);
        assertThat(second.getId()).isEqualTo(generatedId);
        assertThat(second.getRunId()).isEqualTo(run.getRunId());
        assertThat(second.getStatus()).isEqualTo("RUNNING");
        assertThat(second.getRecordsProcessed()).isEqualTo(1);
        assertThat(second.getRecordsCreated()).isEqualTo(1);
        assertThat(second.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 6, 1, 12, 0));
        assertThat(second.getOptions()).contains("\"fullSync\":true").contains("\"maxRecords\":500");
    }

    @Test
    void toSnapshot_RestoresCheckpointWithErrors() {
        // Arrange
        SyncRunRecord record = new SyncRunRecord();
        record.setRunId("mls_sync_1_abc");
        record.setProviderId("crmls");
        record.setStatus("PAUSED");
        record.setRecordsProcessed(40);
        record.setRecordsCreated(30);
        record.setRecordsUpdated(10);
        record.setProgress(40.0);
        record.setEstimatedTotal(100);
        record.setOptions("{\"fullSync\":true,\"skipDuplicates\":true}");
        SyncError error = new SyncError("mls_sync_1_abc", "crmls", SyncErrorType.DATA, "bad listing", false, "X-1");
        when(errorRepository.findByRunIdOrderByOccurredAtAsc("mls_sync_1_abc")).thenReturn(Flux.just(error));

        // Act & Assert
        StepVerifier.create(runService.toSnapshot(record))
                .assertNext(snapshot -> {
                    assertThat(snapshot.status()).isEqualTo(SyncRunStatus.PAUSED);
                    assertThat(snapshot.processed()).isEqualTo(40);
                    assertThat(snapshot.failed()).isZero();
                    assertThat(snapshot.options().isFullSync()).isTrue();
                    assertThat(snapshot.options().isSkipDuplicates()).isTrue();
                    assertThat(snapshot.options().isValidateData()).isTrue();
                    assertThat(snapshot.errors()).containsExactly(error);
                })
                .verifyComplete();
    }

    @Test
    void toSnapshot_UnreadableOptions_FallBackToDefaults() {
        SyncRunRecord record = new SyncRunRecord();
        record.setRunId("mls_sync_2_abc");
        record.setProviderId("crmls");
        record.setStatus("COMPLETED");
        record.setOptions("not json");

        SyncRunSnapshot snapshot = runService.toSnapshot(record, List.of());

        assertThat(snapshot.options()).isEqualTo(SyncOptions.defaults());
        assertThat(snapshot.progress()).isZero();
    }

    @Test
    void resolveError_AlreadyResolved_DoesNotWriteAgain() {
        // Arrange
        UUID errorId = UUID.randomUUID();
        SyncError error = new SyncError("run", "crmls", SyncErrorType.NETWORK, "timeout", true, null);
        error.resolve();
        when(errorRepository.findById(errorId)).thenReturn(Mono.just(error));

        // Act & Assert
        StepVerifier.create(runService.resolveError(errorId))
                .expectNext(error)
                .verifyComplete();
        verify(errorRepository, never()).save(any());
    }

    @Test
    void resolveError_Pending_MarksResolved() {
        // Arrange
        UUID errorId = UUID.randomUUID();
        SyncError error = new SyncError("run", "crmls", SyncErrorType.NETWORK, "timeout", true, null);
        when(errorRepository.findById(errorId)).thenReturn(Mono.just(error));
        when(errorRepository.save(error)).thenReturn(Mono.just(error));

        // Act & Assert
        StepVerifier.create(runService.resolveError(errorId))
                .assertNext(resolved -> {
                    assertThat(resolved.isResolved()).isTrue();
                    assertThat(resolved.getResolvedAt()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    void findError_Unknown_IsNotFound() {
        UUID errorId = UUID.randomUUID();
        when(errorRepository.findById(errorId)).thenReturn(Mono.empty());

        StepVerifier.create(runService.findError(errorId))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void getRecentErrors_LooksBackOneDay() {
        // Arrange
        LocalDateTime since = LocalDateTime.of(2025, 5, 31, 12, 0);
        when(errorRepository.findRecent(since, 10)).thenReturn(Flux.empty());
        when(errorRepository.findRecentByProviderId("crmls", since, 5)).thenReturn(Flux.empty());

        // Act
        runService.getRecentErrors(null, 0).collectList().block();
        runService.getRecentErrors("crmls", 5).collectList().block();

        // Assert
        verify(errorRepository).findRecent(since, 10);
        verify(errorRepository).findRecentByProviderId("crmls", since, 5);
    }

    @Test
    void cleanupOldRuns_SumsDeletedRunsAndErrors() {
        // Arrange
        LocalDateTime cutoff = LocalDateTime.of(2025, 5, 2, 12, 0);
        when(runRepository.deleteFinishedBefore(cutoff)).thenReturn(Mono.just(3));
        when(errorRepository.deleteOlderThan(cutoff)).thenReturn(Mono.just(7));

        // Act & Assert
        StepVerifier.create(runService.cleanupOldRuns(30))
                .expectNext(10)
                .verifyComplete();
    }
}
