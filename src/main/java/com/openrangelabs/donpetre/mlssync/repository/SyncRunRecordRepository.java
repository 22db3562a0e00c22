package com.openrangelabs.donpetre.mlssync.repository;

import com.openrangelabs.donpetre.mlssync.entity.SyncRunRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for persisted sync run checkpoints
 */
@Repository
public interface SyncRunRecordRepository extends R2dbcRepository<SyncRunRecord, UUID> {

    Mono<SyncRunRecord> findByRunId(String runId);

    /**
     * Most recent run for a provider
     */
    @Query("""
        SELECT * FROM mls_sync_runs
        WHERE provider_id = :providerId
        ORDER BY started_at DESC
        LIMIT 1
        """)
    Mono<SyncRunRecord> findLatestByProviderId(@Param("providerId") String providerId);

    @Query("""
        SELECT * FROM mls_sync_runs
        WHERE provider_id = :providerId
        ORDER BY started_at DESC
        LIMIT :limit
        """)
    Flux<SyncRunRecord> findHistory(@Param("providerId") String providerId, @Param("limit") int limit);

    /**
     * Runs left non-terminal by a previous process, e.g. after a crash
     */
    @Query("SELECT * FROM mls_sync_runs WHERE status IN ('RUNNING', 'PAUSED', 'IDLE')")
    Flux<SyncRunRecord> findUnfinished();

    @Modifying
    @Query("""
        DELETE FROM mls_sync_runs
        WHERE status IN ('COMPLETED', 'FAILED')
        AND ended_at < :cutoff
        """)
    Mono<Integer> deleteFinishedBefore(@Param("cutoff") LocalDateTime cutoff);
}
