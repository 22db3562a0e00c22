package com.openrangelabs.donpetre.mlssync.repository;

import com.openrangelabs.donpetre.mlssync.entity.DuplicateCandidateRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for duplicate candidates
 */
@Repository
public interface DuplicateCandidateRecordRepository extends R2dbcRepository<DuplicateCandidateRecord, UUID> {

    @Query("""
        SELECT * FROM mls_duplicate_candidates
        WHERE resolved = false
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<DuplicateCandidateRecord> findPending(@Param("limit") int limit);

    /**
     * Whether the pair is already awaiting resolution, in either direction
     */
    @Query("""
        SELECT COUNT(*) > 0 FROM mls_duplicate_candidates
        WHERE provider_id = :providerId
        AND resolved = false
        AND ((source_mls_id = :first AND target_mls_id = :second)
          OR (source_mls_id = :second AND target_mls_id = :first))
        """)
    Mono<Boolean> existsPendingPair(@Param("providerId") String providerId,
                                    @Param("first") String firstMlsId,
                                    @Param("second") String secondMlsId);

    Mono<Long> countByResolved(Boolean resolved);
}
