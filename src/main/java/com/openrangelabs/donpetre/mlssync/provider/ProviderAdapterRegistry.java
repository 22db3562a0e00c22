package com.openrangelabs.donpetre.mlssync.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.provider.custom.CustomProviderAdapter;
import com.openrangelabs.donpetre.mlssync.provider.reso.ResoProviderAdapter;
import com.openrangelabs.donpetre.mlssync.provider.rets.RetsProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches one adapter per provider. The implementation is chosen
 * by provider family when the adapter is first requested; cached adapters
 * keep their token and rate-limit state between runs.
 */
@Component
public class ProviderAdapterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderAdapterRegistry.class);

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, MlsProviderAdapter> adapters = new ConcurrentHashMap<>();

    @Value("${mls.sync.page-size:50}")
    private int pageSize = 50;

    @Value("${mls.http.user-agent:DonPetreMlsSync/1.0}")
    private String userAgent = "DonPetreMlsSync/1.0";

    public ProviderAdapterRegistry(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public MlsProviderAdapter adapterFor(MlsProviderConfig config) {
        return adapters.computeIfAbsent(config.getProviderId(), id -> create(config));
    }

    /**
     * Forget the cached adapter, e.g. after credentials or endpoint changed
     */
    public void evict(String providerId) {
        if (adapters.remove(providerId) != null) {
            logger.info("Evicted cached adapter for provider {}", providerId);
        }
    }

    MlsProviderAdapter create(MlsProviderConfig config) {
        WebClient client = webClientBuilder.clone()
                .baseUrl(stripTrailingSlash(config.getEndpoint()))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();

        logger.info("Creating {} adapter for provider {}", config.getProviderFamily(), config.getProviderId());
        switch (config.getProviderFamily()) {
            case RETS:
                return new RetsProviderAdapter(config, client, objectMapper, clock, pageSize);
            case RESO:
                return new ResoProviderAdapter(config, client, objectMapper, clock, pageSize);
            case CUSTOM:
                return new CustomProviderAdapter(config, client, objectMapper, clock, pageSize);
            default:
                throw new IllegalArgumentException("Unsupported provider family: " + config.getFamily());
        }
    }

    private static String stripTrailingSlash(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Provider endpoint is required");
        }
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
