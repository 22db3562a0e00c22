package com.openrangelabs.donpetre.mlssync.controller;

import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.RateLimitStatus;
import com.openrangelabs.donpetre.mlssync.service.ProviderConfigService;
import com.openrangelabs.donpetre.mlssync.service.SyncOrchestrationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * REST controller for MLS provider configurations and direct provider calls
 */
@RestController
@RequestMapping("/api/mls/providers")
@CrossOrigin(origins = "${mls.security.cors.allowed-origins:*}")
public class ProviderController {

    private final ProviderConfigService configService;
    private final SyncOrchestrationService orchestrationService;

    @Autowired
    public ProviderController(ProviderConfigService configService,
                              SyncOrchestrationService orchestrationService) {
        this.configService = configService;
        this.orchestrationService = orchestrationService;
    }

    /**
     * Get all configured providers. Credentials are never serialized.
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getProviders() {
        return configService.getAllProviders()
                .collectList()
                .map(providers -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providers", providers);
                    response.put("count", providers.size());
                    response.put("enabled", providers.stream().filter(MlsProviderConfig::isEnabled).count());
                    response.put("unhealthy", providers.stream().filter(p -> !p.isHealthy()).count());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @GetMapping("/{providerId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<MlsProviderConfig>> getProvider(@PathVariable String providerId) {
        return configService.getProvider(providerId).map(ResponseEntity::ok);
    }

    @PostMapping("/{providerId}/enable")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<MlsProviderConfig>> enableProvider(@PathVariable String providerId) {
        return configService.setEnabled(providerId, true).map(ResponseEntity::ok);
    }

    @PostMapping("/{providerId}/disable")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<MlsProviderConfig>> disableProvider(@PathVariable String providerId) {
        return configService.setEnabled(providerId, false).map(ResponseEntity::ok);
    }

    /**
     * Test connection to the provider
     *
     * Authenticates against the provider. A failed login is reported in the
     * body, never as an error status.
     *
     * @param providerId The provider to test
     * @return Connection test result
     */
    @PostMapping("/{providerId}/test-connection")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> testConnection(@PathVariable String providerId) {
        return orchestrationService.testConnection(providerId)
                .map(connected -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", providerId);
                    response.put("connected", connected);
                    response.put("status", connected ? "SUCCESS" : "FAILED");
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @GetMapping("/{providerId}/rate-limit")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<RateLimitStatus>> getRateLimitStatus(@PathVariable String providerId) {
        return orchestrationService.getRateLimitStatus(providerId).map(ResponseEntity::ok);
    }

    /**
     * Fetch one listing straight from the provider, bypassing the catalog
     */
    @GetMapping("/{providerId}/properties/{mlsId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<CanonicalPropertyRecord>> getProperty(@PathVariable String providerId,
                                                                     @PathVariable String mlsId) {
        return orchestrationService.getPropertyById(providerId, mlsId).map(ResponseEntity::ok);
    }
}
