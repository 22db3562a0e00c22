package com.openrangelabs.donpetre.mlssync.provider.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.exception.MlsProviderException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.PropertyPage;
import com.openrangelabs.donpetre.mlssync.model.ProviderFamily;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.provider.AbstractMlsProviderAdapter;
import com.openrangelabs.donpetre.mlssync.provider.AccessToken;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.openrangelabs.donpetre.mlssync.provider.ProviderPayloads.*;

/**
 * Adapter for providers speaking the simple JSON API: JSON login returning
 * {@code {token, expiresIn}} and snake_case listing payloads.
 */
public class CustomProviderAdapter extends AbstractMlsProviderAdapter {

    private static final long DEFAULT_TOKEN_SECONDS = 3600;
    private static final DateTimeFormatter QUERY_DATE = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    public CustomProviderAdapter(MlsProviderConfig config, WebClient webClient,
                                 ObjectMapper objectMapper, Clock clock, int pageSize) {
        super(config, webClient, objectMapper, clock, pageSize);
    }

    @Override
    public ProviderFamily getFamily() {
        return ProviderFamily.CUSTOM;
    }

    @Override
    protected Mono<AccessToken> requestToken() {
        if (config.getUsername() == null || config.getPassword() == null) {
            return Mono.error(MlsProviderException.auth("Provider " + getProviderId() + " requires username and password"));
        }
        Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("username", config.getUsername());
        credentials.put("password", config.getPassword());
        credentials.put("clientId", config.getClientId());

        return webClient.post()
                .uri("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(credentials)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().then(Mono.error(MlsProviderException.auth(
                                "Login rejected with HTTP " + response.statusCode().value())));
                    }
                    return response.bodyToMono(String.class)
                            .map(this::parseJson)
                            .flatMap(body -> {
                                String token = text(body, "token");
                                if (token.isEmpty()) {
                                    return Mono.error(MlsProviderException.auth("Login response carried no token"));
                                }
                                JsonNode expiresIn = at(body, "expiresIn");
                                long seconds = expiresIn != null ? expiresIn.asLong(DEFAULT_TOKEN_SECONDS) : DEFAULT_TOKEN_SECONDS;
                                return Mono.just(new AccessToken(token, now().plusSeconds(seconds)));
                            });
                });
    }

    @Override
    protected void applyCredentials(HttpHeaders headers, AccessToken accessToken) {
        if (accessToken != null) {
            headers.setBearerAuth(accessToken.value());
        }
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> searchRequest(SyncOptions options, int pageNumber) {
        return webClient.get()
                .uri(builder -> {
                    builder.path("/properties")
                            .queryParam("limit", pageSize)
                            .queryParam("page", pageNumber);
                    if (options.getDateRange() != null && options.getDateRange().getStart() != null) {
                        builder.queryParam("updated_after", QUERY_DATE.format(options.getDateRange().getStart()));
                    }
                    if (options.getDateRange() != null && options.getDateRange().getEnd() != null) {
                        builder.queryParam("updated_before", QUERY_DATE.format(options.getDateRange().getEnd()));
                    }
                    if (!options.getPropertyTypes().isEmpty()) {
                        builder.queryParam("property_types", String.join(",", options.getPropertyTypes()));
                    }
                    if (!options.getStatusFilter().isEmpty()) {
                        builder.queryParam("statuses", String.join(",", options.getStatusFilter()));
                    }
                    return builder.build();
                })
                .headers(credentials());
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> propertyRequest(String mlsId) {
        return webClient.get()
                .uri("/properties/{id}", mlsId)
                .headers(credentials());
    }

    @Override
    protected PropertyPage toPage(JsonNode body, int pageNumber) {
        JsonNode items = at(body, "data");
        int count = items != null ? items.size() : 0;
        JsonNode total = at(body, "pagination", "total");
        JsonNode more = at(body, "pagination", "hasMore");
        boolean hasMore;
        if (more != null) {
            hasMore = more.asBoolean();
        } else if (total != null) {
            hasMore = offsetFor(pageNumber) + count < total.asInt();
        } else {
            hasMore = count >= pageSize;
        }
        return buildPage(items, pageNumber, hasMore, total != null ? total.asInt() : null);
    }

    @Override
    protected JsonNode unwrapSingle(JsonNode body) {
        JsonNode wrapped = at(body, "data");
        return wrapped != null && wrapped.isObject() ? wrapped : body;
    }

    @Override
    protected String recordIdOf(JsonNode raw) {
        String id = text(raw, "id");
        return id.isEmpty() ? text(raw, "listing_id") : id;
    }

    @Override
    protected CanonicalPropertyRecord transform(JsonNode raw) {
        String country = text(raw, "address", "country");
        return CanonicalPropertyRecord.builder()
                .mlsId(recordIdOf(raw))
                .providerId(getProviderId())
                .listingId(text(raw, "listing_id"))
                .propertyType(normalizePropertyType(text(raw, "property_type")))
                .status(normalizeStatus(text(raw, "status")))
                .price(price(raw, "price"))
                .address(CanonicalPropertyRecord.Address.builder()
                        .streetNumber(text(raw, "address", "street_number"))
                        .streetName(text(raw, "address", "street_name"))
                        .unitNumber(text(raw, "address", "unit_number"))
                        .city(text(raw, "address", "city"))
                        .state(text(raw, "address", "state"))
                        .zipCode(text(raw, "address", "zip_code"))
                        .country(country.isEmpty() ? "US" : country)
                        .latitude(optionalDecimal(raw, "address", "latitude"))
                        .longitude(optionalDecimal(raw, "address", "longitude"))
                        .build())
                .details(CanonicalPropertyRecord.Details.builder()
                        .bedrooms(integer(raw, "bedrooms"))
                        .bathrooms(decimal(raw, "bathrooms"))
                        .squareFeet(integer(raw, "square_feet"))
                        .lotSize(decimal(raw, "lot_size"))
                        .yearBuilt(integer(raw, "year_built"))
                        .stories(integer(raw, "stories"))
                        .garageSpaces(integer(raw, "garage_spaces"))
                        .build())
                .description(text(raw, "description"))
                .media(media(at(raw, "media"), "url", "caption", "order", "is_primary"))
                .agent(CanonicalPropertyRecord.Agent.builder()
                        .id(text(raw, "agent", "id"))
                        .name(text(raw, "agent", "name"))
                        .email(text(raw, "agent", "email"))
                        .phone(text(raw, "agent", "phone"))
                        .build())
                .office(CanonicalPropertyRecord.Office.builder()
                        .id(text(raw, "office", "id"))
                        .name(text(raw, "office", "name"))
                        .phone(text(raw, "office", "phone"))
                        .build())
                .dates(CanonicalPropertyRecord.Dates.builder()
                        .listed(dateTime(raw, "listed_date"))
                        .updated(dateTime(raw, "updated_date"))
                        .sold(dateTime(raw, "sold_date"))
                        .expires(dateTime(raw, "expiration_date"))
                        .build())
                .build();
    }
}
