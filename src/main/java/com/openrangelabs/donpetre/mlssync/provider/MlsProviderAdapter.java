package com.openrangelabs.donpetre.mlssync.provider;

import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.PropertyPage;
import com.openrangelabs.donpetre.mlssync.model.ProviderFamily;
import com.openrangelabs.donpetre.mlssync.model.RateLimitStatus;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Client for one configured MLS provider.
 * One instance per provider; it owns that provider's token and rate-limit budget.
 */
public interface MlsProviderAdapter {

    /**
     * Get the provider id this adapter is bound to
     */
    String getProviderId();

    /**
     * Get the protocol family implemented by this adapter
     */
    ProviderFamily getFamily();

    /**
     * Obtain or reuse a token. Emits false when the provider rejects the credentials.
     */
    Mono<Boolean> authenticate();

    /**
     * Fetch one page of listings matching the options (1-based page number)
     */
    Mono<PropertyPage> fetchPage(SyncOptions options, int pageNumber);

    /**
     * Fetch all pages until exhausted or the record cap is reached
     */
    Flux<CanonicalPropertyRecord> getProperties(SyncOptions options);

    /**
     * Fetch a single listing, empty when the provider does not know it
     */
    Mono<CanonicalPropertyRecord> getPropertyById(String mlsId);

    /**
     * Get the rate limit status reported by the last response
     */
    Mono<RateLimitStatus> getRateLimitStatus();

    /**
     * Test the connection to the provider
     */
    Mono<Boolean> testConnection();
}
