package com.openrangelabs.donpetre.mlssync.repository;

import com.openrangelabs.donpetre.mlssync.entity.PropertyListing;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for the local property catalog
 */
@Repository
public interface PropertyListingRepository extends R2dbcRepository<PropertyListing, UUID> {

    Mono<PropertyListing> findByProviderIdAndMlsId(String providerId, String mlsId);

    /**
     * Most recently updated listings that have not been merged away
     */
    @Query("""
        SELECT * FROM mls_properties
        WHERE provider_id = :providerId
        AND merged_into_mls_id IS NULL
        ORDER BY last_synced_at DESC
        LIMIT :limit
        """)
    Flux<PropertyListing> findRecentActive(@Param("providerId") String providerId, @Param("limit") int limit);

    Mono<Long> countByProviderId(String providerId);
}
