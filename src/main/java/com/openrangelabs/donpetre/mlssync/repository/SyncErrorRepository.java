package com.openrangelabs.donpetre.mlssync.repository;

import com.openrangelabs.donpetre.mlssync.entity.SyncError;
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
 * Append-only log of sync errors
 */
@Repository
public interface SyncErrorRepository extends R2dbcRepository<SyncError, UUID> {

    Flux<SyncError> findByRunIdOrderByOccurredAtAsc(String runId);

    @Query("""
        SELECT * FROM mls_sync_errors
        WHERE occurred_at > :since
        ORDER BY occurred_at DESC
        LIMIT :limit
        """)
    Flux<SyncError> findRecent(@Param("since") LocalDateTime since, @Param("limit") int limit);

    @Query("""
        SELECT * FROM mls_sync_errors
        WHERE provider_id = :providerId
        AND occurred_at > :since
        ORDER BY occurred_at DESC
        LIMIT :limit
        """)
    Flux<SyncError> findRecentByProviderId(@Param("providerId") String providerId,
                                           @Param("since") LocalDateTime since,
                                           @Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM mls_sync_errors WHERE occurred_at < :cutoff")
    Mono<Integer> deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
