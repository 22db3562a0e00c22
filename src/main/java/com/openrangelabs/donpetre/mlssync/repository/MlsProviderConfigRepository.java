package com.openrangelabs.donpetre.mlssync.repository;

import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for MLS provider configurations
 */
@Repository
public interface MlsProviderConfigRepository extends R2dbcRepository<MlsProviderConfig, UUID> {

    Mono<MlsProviderConfig> findByProviderId(String providerId);

    @Query("SELECT * FROM mls_provider_configs WHERE enabled = true ORDER BY provider_id")
    Flux<MlsProviderConfig> findEnabled();

    @Query("SELECT * FROM mls_provider_configs ORDER BY provider_id")
    Flux<MlsProviderConfig> findAllOrdered();

    Mono<Boolean> existsByProviderId(String providerId);
}
