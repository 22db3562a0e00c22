package com.openrangelabs.donpetre.mlssync.provider.reso;

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

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.openrangelabs.donpetre.mlssync.provider.ProviderPayloads.*;

/**
 * Adapter for RESO Web API (OData) providers using the OAuth2
 * client-credentials grant.
 */
public class ResoProviderAdapter extends AbstractMlsProviderAdapter {

    private static final long DEFAULT_TOKEN_SECONDS = 3600;
    private static final DateTimeFormatter ODATA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    public ResoProviderAdapter(MlsProviderConfig config, WebClient webClient,
                               ObjectMapper objectMapper, Clock clock, int pageSize) {
        super(config, webClient, objectMapper, clock, pageSize);
    }

    @Override
    public ProviderFamily getFamily() {
        return ProviderFamily.RESO;
    }

    @Override
    protected Mono<AccessToken> requestToken() {
        if (config.getClientId() == null || config.getClientSecret() == null) {
            return Mono.error(MlsProviderException.auth("RESO provider " + getProviderId() + " requires client id and secret"));
        }
        return webClient.post()
                .uri("/oauth/token")
                .headers(headers -> headers.setBasicAuth(config.getClientId(), config.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials").with("scope", "read"))
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().then(Mono.error(MlsProviderException.auth(
                                "RESO token request rejected with HTTP " + response.statusCode().value())));
                    }
                    return response.bodyToMono(String.class)
                            .map(this::parseJson)
                            .flatMap(body -> {
                                String accessToken = text(body, "access_token");
                                if (accessToken.isEmpty()) {
                                    return Mono.error(MlsProviderException.auth("RESO token response carried no access_token"));
                                }
                                JsonNode expiresIn = at(body, "expires_in");
                                long seconds = expiresIn != null ? expiresIn.asLong(DEFAULT_TOKEN_SECONDS) : DEFAULT_TOKEN_SECONDS;
                                return Mono.just(new AccessToken(accessToken, now().plusSeconds(seconds)));
                            });
                });
    }

    @Override
    protected void applyCredentials(HttpHeaders headers, AccessToken accessToken) {
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (accessToken != null) {
            headers.setBearerAuth(accessToken.value());
        }
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> searchRequest(SyncOptions options, int pageNumber) {
        String filter = buildFilter(options);
        return webClient.get()
                .uri(builder -> {
                    builder.path("/Property")
                            .queryParam("$top", pageSize)
                            .queryParam("$skip", offsetFor(pageNumber))
                            .queryParam("$count", true);
                    if (!filter.isEmpty()) {
                        builder.queryParam("$filter", "{filter}");
                        return builder.build(filter);
                    }
                    return builder.build();
                })
                .headers(credentials());
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> propertyRequest(String mlsId) {
        return webClient.get()
                .uri("/Property('{id}')", mlsId)
                .headers(credentials());
    }

    @Override
    protected PropertyPage toPage(JsonNode body, int pageNumber) {
        JsonNode items = at(body, "value");
        int count = items != null ? items.size() : 0;
        JsonNode total = at(body, "@odata.count");
        boolean hasMore;
        if (at(body, "@odata.nextLink") != null) {
            hasMore = true;
        } else if (total != null) {
            hasMore = offsetFor(pageNumber) + count < total.asInt();
        } else {
            hasMore = count >= pageSize;
        }
        return buildPage(items, pageNumber, hasMore, total != null ? total.asInt() : null);
    }

    @Override
    protected String recordIdOf(JsonNode raw) {
        String id = text(raw, "ListingId");
        return id.isEmpty() ? text(raw, "ListingKey") : id;
    }

    @Override
    protected CanonicalPropertyRecord transform(JsonNode raw) {
        String listingId = recordIdOf(raw);
        return CanonicalPropertyRecord.builder()
                .mlsId(listingId)
                .providerId(getProviderId())
                .listingId(text(raw, "ListingKey").isEmpty() ? listingId : text(raw, "ListingKey"))
                .propertyType(normalizePropertyType(text(raw, "PropertyType")))
                .status(normalizeStatus(text(raw, "StandardStatus")))
                .price(listPrice(raw))
                .address(CanonicalPropertyRecord.Address.builder()
                        .streetNumber(text(raw, "PropertyAddress", "StreetNumber"))
                        .streetName(text(raw, "PropertyAddress", "StreetName"))
                        .unitNumber(text(raw, "PropertyAddress", "UnitNumber"))
                        .city(text(raw, "PropertyAddress", "City"))
                        .state(text(raw, "PropertyAddress", "StateOrProvince"))
                        .zipCode(text(raw, "PropertyAddress", "PostalCode"))
                        .country(text(raw, "PropertyAddress", "Country").isEmpty()
                                ? "US" : text(raw, "PropertyAddress", "Country"))
                        .latitude(optionalDecimal(raw, "PropertyAddress", "Latitude"))
                        .longitude(optionalDecimal(raw, "PropertyAddress", "Longitude"))
                        .build())
                .details(CanonicalPropertyRecord.Details.builder()
                        .bedrooms(integer(raw, "Rooms", "BedroomsTotal"))
                        .bathrooms(decimal(raw, "Rooms", "BathroomsTotal"))
                        .squareFeet(integer(raw, "Building", "BuildingAreaTotal"))
                        .yearBuilt(integer(raw, "Building", "YearBuilt"))
                        .stories(integer(raw, "Building", "Stories"))
                        .garageSpaces(integer(raw, "Building", "GarageSpaces"))
                        .lotSize(decimal(raw, "Lot", "LotSizeArea"))
                        .build())
                .description(text(raw, "PublicRemarks"))
                .media(media(at(raw, "Media"), "MediaURL", "ShortDescription", "Order", "PreferredPhotoYN"))
                .agent(CanonicalPropertyRecord.Agent.builder()
                        .id(text(raw, "ListAgent", "ListAgentKey"))
                        .name(text(raw, "ListAgent", "ListAgentFullName"))
                        .email(text(raw, "ListAgent", "ListAgentEmail"))
                        .phone(text(raw, "ListAgent", "ListAgentPreferredPhone"))
                        .build())
                .office(CanonicalPropertyRecord.Office.builder()
                        .id(text(raw, "ListOffice", "ListOfficeKey"))
                        .name(text(raw, "ListOffice", "ListOfficeName"))
                        .phone(text(raw, "ListOffice", "ListOfficePhone"))
                        .build())
                .dates(CanonicalPropertyRecord.Dates.builder()
                        .listed(dateTime(raw, "ListingContractDate"))
                        .updated(dateTime(raw, "ModificationTimestamp"))
                        .sold(dateTime(raw, "CloseDate"))
                        .expires(dateTime(raw, "ExpirationDate"))
                        .build())
                .build();
    }

    // ListPrice is either a plain number or an object with a Price member
    private BigDecimal listPrice(JsonNode raw) {
        JsonNode listPrice = at(raw, "ListPrice");
        if (listPrice != null && listPrice.isObject()) {
            return price(listPrice, "Price");
        }
        return price(raw, "ListPrice");
    }

    String buildFilter(SyncOptions options) {
        List<String> clauses = new ArrayList<>();
        if (options.getDateRange() != null && options.getDateRange().getStart() != null) {
            clauses.add("ModificationTimestamp gt " + ODATA_TIMESTAMP.format(options.getDateRange().getStart().atOffset(ZoneOffset.UTC)));
        }
        if (options.getDateRange() != null && options.getDateRange().getEnd() != null) {
            clauses.add("ModificationTimestamp lt " + ODATA_TIMESTAMP.format(options.getDateRange().getEnd().atOffset(ZoneOffset.UTC)));
        }
        if (!options.getPropertyTypes().isEmpty()) {
            clauses.add(anyOf("PropertyType", options.getPropertyTypes()));
        }
        if (!options.getStatusFilter().isEmpty()) {
            clauses.add(anyOf("StandardStatus", options.getStatusFilter()));
        }
        return String.join(" and ", clauses);
    }

    private static String anyOf(String field, List<String> values) {
        return values.stream()
                .map(value -> field + " eq '" + value.replace("'", "''") + "'")
                .collect(Collectors.joining(" or ", "(", ")"));
    }
}
