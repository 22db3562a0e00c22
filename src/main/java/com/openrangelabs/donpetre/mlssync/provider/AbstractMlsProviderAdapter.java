package com.openrangelabs.donpetre.mlssync.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.exception.MlsProviderException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.PropertyPage;
import com.openrangelabs.donpetre.mlssync.model.RateLimitStatus;
import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Abstract base class for MLS provider adapters.
 *
 * <p>Handles token caching, client-side throttling, rate-limit header
 * tracking, HTTP error classification and pagination. Subclasses supply the
 * family-specific login, search request and payload transform.
 */
public abstract class AbstractMlsProviderAdapter implements MlsProviderAdapter {

    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    // Tokens are refreshed slightly before the provider-reported expiry
    private static final Duration TOKEN_EXPIRY_SKEW = Duration.ofSeconds(30);

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final MlsProviderConfig config;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    protected final int pageSize;

    private final Duration minRequestInterval;
    private final AtomicReference<AccessToken> token = new AtomicReference<>();
    private volatile RateLimitStatus rateLimitStatus;
    private volatile LocalDateTime lastRequestAt;

    protected AbstractMlsProviderAdapter(MlsProviderConfig config, WebClient webClient,
                                         ObjectMapper objectMapper, Clock clock, int pageSize) {
        this.config = config;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pageSize = pageSize;
        this.minRequestInterval = Duration.ofMillis(60_000L / config.getEffectiveRateLimit());
        this.rateLimitStatus = RateLimitStatus.unknown(config.getProviderId(), config.getEffectiveRateLimit(), now());
    }

    @Override
    public String getProviderId() {
        return config.getProviderId();
    }

    @Override
    public Mono<Boolean> authenticate() {
        return Mono.defer(() -> {
            AccessToken current = token.get();
            if (current != null && current.isValidAt(now().plus(TOKEN_EXPIRY_SKEW))) {
                logger.debug("Reusing cached token for provider {}", getProviderId());
                return Mono.just(true);
            }
            return throttle()
                    .then(Mono.defer(this::requestToken))
                    .map(issued -> {
                        token.set(issued);
                        logger.info("Authenticated with provider {} ({}), token valid until {}",
                                getProviderId(), getFamily(), issued.expiresAt());
                        return true;
                    })
                    .onErrorResume(error -> {
                        token.set(null);
                        logger.error("Authentication failed for provider {}: {}", getProviderId(), error.getMessage());
                        return Mono.just(false);
                    });
        });
    }

    @Override
    public Mono<PropertyPage> fetchPage(SyncOptions options, int pageNumber) {
        return ensureAuthenticated()
                .then(Mono.defer(() -> exchangeJson(searchRequest(options, pageNumber), false)))
                .map(body -> {
                    logger.debug("Fetched page {} from provider {}", pageNumber, getProviderId());
                    try {
                        return toPage(body, pageNumber);
                    } catch (RuntimeException e) {
                        throw MlsProviderException.data(
                                "Malformed page " + pageNumber + " from provider " + getProviderId() + ": " + e.getMessage(), e);
                    }
                });
    }

    @Override
    public Flux<CanonicalPropertyRecord> getProperties(SyncOptions options) {
        Flux<CanonicalPropertyRecord> records = fetchPage(options, 1)
                .expand(page -> hasNextPage(page, options)
                        ? fetchPage(options, page.pageNumber() + 1)
                        : Mono.empty())
                .concatMapIterable(PropertyPage::records);
        return options.hasRecordCap() ? records.take(options.getMaxRecords()) : records;
    }

    @Override
    public Mono<CanonicalPropertyRecord> getPropertyById(String mlsId) {
        return ensureAuthenticated()
                .then(Mono.defer(() -> exchangeJson(propertyRequest(mlsId), true)))
                .map(body -> {
                    try {
                        return transform(unwrapSingle(body));
                    } catch (RuntimeException e) {
                        throw MlsProviderException.data("Unmappable listing " + mlsId + ": " + e.getMessage(), e);
                    }
                });
    }

    @Override
    public Mono<RateLimitStatus> getRateLimitStatus() {
        return Mono.fromSupplier(() -> rateLimitStatus);
    }

    @Override
    public Mono<Boolean> testConnection() {
        return authenticate()
                .doOnNext(connected -> logger.info("Connection test for provider {}: {}",
                        getProviderId(), connected ? "SUCCESS" : "FAILED"));
    }

    /**
     * Drop the cached token so the next request logs in again
     */
    public void invalidateToken() {
        token.set(null);
    }

    /**
     * Issue the family-specific login request
     */
    protected abstract Mono<AccessToken> requestToken();

    /**
     * Attach the current token to a data request
     */
    protected abstract void applyCredentials(HttpHeaders headers, AccessToken accessToken);

    /**
     * Build the search request for one page
     */
    protected abstract WebClient.RequestHeadersSpec<?> searchRequest(SyncOptions options, int pageNumber);

    /**
     * Build the single-listing request
     */
    protected abstract WebClient.RequestHeadersSpec<?> propertyRequest(String mlsId);

    /**
     * Split a search response into records and paging metadata
     */
    protected abstract PropertyPage toPage(JsonNode body, int pageNumber);

    /**
     * Map one raw listing onto the canonical schema
     */
    protected abstract CanonicalPropertyRecord transform(JsonNode raw);

    /**
     * Best-effort listing id of a raw item, used for error reporting
     */
    protected abstract String recordIdOf(JsonNode raw);

    protected JsonNode unwrapSingle(JsonNode body) {
        return body;
    }

    protected Consumer<HttpHeaders> credentials() {
        return headers -> applyCredentials(headers, token.get());
    }

    /**
     * Transform every item of a page, collecting per-item failures instead of
     * failing the page.
     */
    protected PropertyPage buildPage(JsonNode items, int pageNumber, boolean hasMore, Integer totalRecords) {
        if (items == null || !items.isArray()) {
            throw new IllegalArgumentException("listing array missing from response");
        }
        List<CanonicalPropertyRecord> records = new ArrayList<>();
        List<PropertyPage.RecordFailure> failures = new ArrayList<>();
        for (JsonNode item : items) {
            String recordId = recordIdOf(item);
            try {
                CanonicalPropertyRecord record = transform(item);
                if (record.getMlsId() == null || record.getMlsId().isBlank()) {
                    failures.add(new PropertyPage.RecordFailure(null, "Listing without identifier"));
                } else {
                    records.add(record);
                }
            } catch (RuntimeException e) {
                logger.warn("Skipping unmappable listing {} from provider {}: {}", recordId, getProviderId(), e.getMessage());
                failures.add(new PropertyPage.RecordFailure(recordId, e.getMessage()));
            }
        }
        return new PropertyPage(pageNumber, records, failures, hasMore, totalRecords);
    }

    protected boolean hasNextPage(PropertyPage page, SyncOptions options) {
        if (!page.hasMore()) {
            return false;
        }
        return !options.hasRecordCap() || (long) page.pageNumber() * pageSize < options.getMaxRecords();
    }

    protected int offsetFor(int pageNumber) {
        return (pageNumber - 1) * pageSize;
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Execute a request, track rate-limit headers and classify failures.
     *
     * @param notFoundAsEmpty complete empty on 404 instead of failing
     */
    protected Mono<JsonNode> exchangeJson(WebClient.RequestHeadersSpec<?> request, boolean notFoundAsEmpty) {
        return throttle()
                .then(request.exchangeToMono(response -> {
                    updateRateLimit(response.headers().asHttpHeaders());
                    HttpStatusCode status = response.statusCode();
                    if (status.is2xxSuccessful()) {
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(this::parseJson);
                    }
                    if (notFoundAsEmpty && status.value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.empty());
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(classifyHttpFailure(status, response.headers().asHttpHeaders())));
                }))
                .onErrorMap(AbstractMlsProviderAdapter::isTransportFailure,
                        error -> MlsProviderException.network(
                                "Network failure calling provider " + getProviderId() + ": " + error.getMessage(), error));
    }

    protected JsonNode parseJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw MlsProviderException.data("Malformed JSON from provider " + getProviderId(), e);
        }
    }

    private Mono<Void> ensureAuthenticated() {
        return authenticate()
                .flatMap(authenticated -> authenticated
                        ? Mono.<Void>empty()
                        : Mono.error(MlsProviderException.auth("Authentication failed for provider " + getProviderId())));
    }

    private MlsProviderException classifyHttpFailure(HttpStatusCode status, HttpHeaders headers) {
        int code = status.value();
        if (code == HttpStatus.TOO_MANY_REQUESTS.value()) {
            LocalDateTime retryAfter = retryAfter(headers);
            logger.warn("Provider {} rate limit exceeded, retry after {}", getProviderId(), retryAfter);
            return MlsProviderException.rateLimited("Rate limit exceeded for provider " + getProviderId(), retryAfter);
        }
        if (code == HttpStatus.UNAUTHORIZED.value() || code == HttpStatus.FORBIDDEN.value()) {
            // next attempt logs in again
            invalidateToken();
            return new MlsProviderException(SyncErrorType.API, true,
                    "Provider " + getProviderId() + " rejected the token (HTTP " + code + ")");
        }
        boolean retryable = status.is5xxServerError();
        return new MlsProviderException(SyncErrorType.API, retryable,
                "Provider " + getProviderId() + " responded with HTTP " + code);
    }

    private LocalDateTime retryAfter(HttpHeaders headers) {
        if (headers.getFirst(RATE_LIMIT_RESET) != null) {
            return rateLimitStatus.getResetTime();
        }
        String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter != null) {
            try {
                return now().plusSeconds(Long.parseLong(retryAfter.trim()));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After header: {}", retryAfter);
            }
        }
        return now().plusSeconds(60);
    }

    private void updateRateLimit(HttpHeaders headers) {
        String remaining = headers.getFirst(RATE_LIMIT_REMAINING);
        if (remaining == null) {
            return;
        }
        try {
            String reset = headers.getFirst(RATE_LIMIT_RESET);
            LocalDateTime resetTime = reset != null
                    ? LocalDateTime.ofInstant(Instant.ofEpochSecond(Long.parseLong(reset.trim())), clock.getZone())
                    : now().plusSeconds(60);
            String limit = headers.getFirst(RATE_LIMIT_LIMIT);
            int effectiveLimit = limit != null ? Integer.parseInt(limit.trim()) : rateLimitStatus.getLimit();
            rateLimitStatus = new RateLimitStatus(getProviderId(), effectiveLimit,
                    Integer.parseInt(remaining.trim()), resetTime);
            logger.debug("Rate limit for provider {}: {}", getProviderId(), rateLimitStatus);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed rate limit headers from provider {}: {}", getProviderId(), e.getMessage());
        }
    }

    /**
     * Space requests by the configured per-minute budget and hold back
     * entirely while the provider reports an exhausted budget.
     */
    private Mono<Void> throttle() {
        return Mono.defer(() -> {
            LocalDateTime current = now();
            LocalDateTime readyAt = current;
            RateLimitStatus status = rateLimitStatus;
            if (status.isExceeded() && status.getResetTime().isAfter(readyAt)) {
                readyAt = status.getResetTime();
            }
            synchronized (this) {
                LocalDateTime last = lastRequestAt;
                if (last != null && last.plus(minRequestInterval).isAfter(readyAt)) {
                    readyAt = last.plus(minRequestInterval);
                }
                lastRequestAt = readyAt;
            }
            Duration wait = Duration.between(current, readyAt);
            if (wait.isZero() || wait.isNegative()) {
                return Mono.empty();
            }
            logger.debug("Throttling provider {} for {} ms", getProviderId(), wait.toMillis());
            return Mono.delay(wait).then();
        });
    }

    private static boolean isTransportFailure(Throwable error) {
        return error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException;
    }
}
