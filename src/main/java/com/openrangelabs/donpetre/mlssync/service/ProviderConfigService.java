package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.provider.ProviderAdapterRegistry;
import com.openrangelabs.donpetre.mlssync.repository.MlsProviderConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service for managing MLS provider configurations
 */
@Service
public class ProviderConfigService {

    private static final Logger logger = LoggerFactory.getLogger(ProviderConfigService.class);

    private final MlsProviderConfigRepository repository;
    private final ProviderAdapterRegistry adapterRegistry;
    private final Clock clock;

    @Autowired
    public ProviderConfigService(MlsProviderConfigRepository repository,
                                 ProviderAdapterRegistry adapterRegistry,
                                 Clock clock) {
        this.repository = repository;
        this.adapterRegistry = adapterRegistry;
        this.clock = clock;
    }

    /**
     * Get provider by id, failing when it does not exist
     */
    public Mono<MlsProviderConfig> getProvider(String providerId) {
        return repository.findByProviderId(providerId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("MLS provider", providerId)));
    }

    /**
     * Get all enabled providers
     */
    public Flux<MlsProviderConfig> getEnabledProviders() {
        return repository.findEnabled();
    }

    /**
     * Get all providers
     */
    public Flux<MlsProviderConfig> getAllProviders() {
        return repository.findAllOrdered();
    }

    /**
     * Enable or disable a provider. The cached adapter is dropped so the next
     * run starts with a fresh session.
     */
    public Mono<MlsProviderConfig> setEnabled(String providerId, boolean enabled) {
        return getProvider(providerId)
                .flatMap(config -> {
                    config.setEnabled(enabled);
                    config.setUpdatedAt(LocalDateTime.now(clock));
                    return repository.save(config);
                })
                .doOnSuccess(config -> {
                    adapterRegistry.evict(providerId);
                    logger.info("Set provider {} enabled status to: {}", providerId, enabled);
                });
    }

    /**
     * Record a successful sync; {@code syncTime} becomes the lower bound of
     * the next incremental sync
     */
    public Mono<MlsProviderConfig> recordSyncSuccess(String providerId, LocalDateTime syncTime) {
        return getProvider(providerId)
                .flatMap(config -> {
                    config.recordSyncSuccess(syncTime);
                    return repository.save(config);
                });
    }

    /**
     * Record a failed sync
     */
    public Mono<MlsProviderConfig> recordSyncError(String providerId, String errorMessage) {
        return getProvider(providerId)
                .flatMap(config -> {
                    config.recordSyncError(errorMessage);
                    return repository.save(config);
                })
                .doOnSuccess(config -> {
                    if (!config.isHealthy()) {
                        logger.warn("Provider {} has failed {} consecutive syncs", providerId, config.getConsecutiveErrorCount());
                    }
                });
    }
}
