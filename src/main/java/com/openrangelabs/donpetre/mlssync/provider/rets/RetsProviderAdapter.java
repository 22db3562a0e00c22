package com.openrangelabs.donpetre.mlssync.provider.rets;

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
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

import static com.openrangelabs.donpetre.mlssync.provider.ProviderPayloads.*;

/**
 * Adapter for RETS servers exposing a JSON search endpoint.
 *
 * <p>Login is a form POST that answers with a session cookie; the session is
 * assumed valid for 30 minutes and is sent back as {@code RETS-Session}.
 */
public class RetsProviderAdapter extends AbstractMlsProviderAdapter {

    static final String RETS_VERSION_HEADER = "RETS-Version";
    static final String RETS_VERSION = "RETS/1.8";
    static final String SESSION_COOKIE = "RETS-Session";
    static final Duration SESSION_LIFETIME = Duration.ofMinutes(30);

    private static final DateTimeFormatter QUERY_DATE = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    public RetsProviderAdapter(MlsProviderConfig config, WebClient webClient,
                               ObjectMapper objectMapper, Clock clock, int pageSize) {
        super(config, webClient, objectMapper, clock, pageSize);
    }

    @Override
    public ProviderFamily getFamily() {
        return ProviderFamily.RETS;
    }

    @Override
    protected Mono<AccessToken> requestToken() {
        if (isBlank(config.getUsername()) || isBlank(config.getPassword())) {
            return Mono.error(MlsProviderException.auth("RETS provider " + getProviderId() + " requires username and password"));
        }
        return webClient.post()
                .uri("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .header(RETS_VERSION_HEADER, RETS_VERSION)
                .body(BodyInserters.fromFormData("username", config.getUsername())
                        .with("password", config.getPassword()))
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().then(Mono.error(MlsProviderException.auth(
                                "RETS login rejected with HTTP " + response.statusCode().value())));
                    }
                    String session = sessionToken(response.headers().asHttpHeaders().getFirst(HttpHeaders.SET_COOKIE));
                    if (session.isEmpty()) {
                        return response.releaseBody().then(Mono.error(MlsProviderException.auth(
                                "RETS login response carried no session cookie")));
                    }
                    return response.releaseBody().thenReturn(new AccessToken(session, now().plus(SESSION_LIFETIME)));
                });
    }

    @Override
    protected void applyCredentials(HttpHeaders headers, AccessToken accessToken) {
        headers.set(RETS_VERSION_HEADER, RETS_VERSION);
        if (accessToken != null) {
            headers.set(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + accessToken.value());
        }
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> searchRequest(SyncOptions options, int pageNumber) {
        return webClient.get()
                .uri(builder -> {
                    builder.path("/properties")
                            .queryParam("limit", pageSize)
                            .queryParam("offset", offsetFor(pageNumber));
                    if (options.getDateRange() != null && options.getDateRange().getStart() != null) {
                        builder.queryParam("modifiedAfter", QUERY_DATE.format(options.getDateRange().getStart()));
                    }
                    if (options.getDateRange() != null && options.getDateRange().getEnd() != null) {
                        builder.queryParam("modifiedBefore", QUERY_DATE.format(options.getDateRange().getEnd()));
                    }
                    if (!options.getPropertyTypes().isEmpty()) {
                        builder.queryParam("propertyType", String.join(",", options.getPropertyTypes()));
                    }
                    if (!options.getStatusFilter().isEmpty()) {
                        builder.queryParam("status", String.join(",", options.getStatusFilter()));
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
        JsonNode items = at(body, "properties");
        int count = items != null ? items.size() : 0;
        JsonNode total = at(body, "totalCount");
        boolean hasMore = total != null
                ? offsetFor(pageNumber) + count < total.asInt()
                : count >= pageSize;
        return buildPage(items, pageNumber, hasMore, total != null ? total.asInt() : null);
    }

    @Override
    protected JsonNode unwrapSingle(JsonNode body) {
        JsonNode wrapped = at(body, "property");
        return wrapped != null ? wrapped : body;
    }

    @Override
    protected String recordIdOf(JsonNode raw) {
        String id = text(raw, "ListingID");
        return id.isEmpty() ? text(raw, "ListingKey") : id;
    }

    @Override
    protected CanonicalPropertyRecord transform(JsonNode raw) {
        String listingId = recordIdOf(raw);
        return CanonicalPropertyRecord.builder()
                .mlsId(listingId)
                .providerId(getProviderId())
                .listingId(listingId)
                .propertyType(normalizePropertyType(text(raw, "PropertyType")))
                .status(normalizeStatus(text(raw, "StandardStatus")))
                .price(price(raw, "ListPrice"))
                .address(CanonicalPropertyRecord.Address.builder()
                        .streetNumber(text(raw, "StreetNumber"))
                        .streetName(text(raw, "StreetName"))
                        .unitNumber(text(raw, "UnitNumber"))
                        .city(text(raw, "City"))
                        .state(text(raw, "StateOrProvince"))
                        .zipCode(text(raw, "PostalCode"))
                        .country(text(raw, "Country").isEmpty() ? "US" : text(raw, "Country"))
                        .latitude(optionalDecimal(raw, "Latitude"))
                        .longitude(optionalDecimal(raw, "Longitude"))
                        .build())
                .details(CanonicalPropertyRecord.Details.builder()
                        .bedrooms(integer(raw, "BedroomsTotal"))
                        .bathrooms(decimal(raw, "BathroomsTotal"))
                        .squareFeet(integer(raw, "LivingArea"))
                        .lotSize(decimal(raw, "LotSizeArea"))
                        .yearBuilt(integer(raw, "YearBuilt"))
                        .stories(integer(raw, "Stories"))
                        .garageSpaces(integer(raw, "GarageSpaces"))
                        .build())
                .description(text(raw, "PublicRemarks"))
                .media(media(at(raw, "Media"), "MediaURL", "ShortDescription", "Order", "PreferredPhotoYN"))
                .agent(CanonicalPropertyRecord.Agent.builder()
                        .id(text(raw, "ListAgentKey"))
                        .name(text(raw, "ListAgentFullName"))
                        .email(text(raw, "ListAgentEmail"))
                        .phone(text(raw, "ListAgentPreferredPhone"))
                        .build())
                .office(CanonicalPropertyRecord.Office.builder()
                        .id(text(raw, "ListOfficeKey"))
                        .name(text(raw, "ListOfficeName"))
                        .phone(text(raw, "ListOfficePhone"))
                        .build())
                .dates(CanonicalPropertyRecord.Dates.builder()
                        .listed(dateTime(raw, "ListingContractDate"))
                        .updated(dateTime(raw, "ModificationTimestamp"))
                        .sold(dateTime(raw, "CloseDate"))
                        .expires(dateTime(raw, "ExpirationDate"))
                        .build())
                .build();
    }

    /**
     * Value of the first cookie segment, e.g. {@code RETS-Session=abc; Path=/} yields {@code abc}.
     */
    static String sessionToken(String setCookie) {
        if (setCookie == null || setCookie.isBlank()) {
            return "";
        }
        String first = setCookie.split(";", 2)[0];
        int separator = first.indexOf('=');
        return separator >= 0 ? first.substring(separator + 1).trim() : "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
