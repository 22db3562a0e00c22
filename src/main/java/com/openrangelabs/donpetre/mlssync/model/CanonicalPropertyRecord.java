package com.openrangelabs.donpetre.mlssync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Provider-agnostic representation of a single listing.
 *
 * <p>Every provider adapter maps its raw payload onto this shape. Missing
 * optional values are represented as empty strings, zero or empty lists so
 * downstream scoring never has to deal with nulls; only lifecycle dates may
 * be absent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CanonicalPropertyRecord {

    /** Unique within a provider. */
    String mlsId;

    @Builder.Default
    String providerId = "";

    @Builder.Default
    String listingId = "";

    @Builder.Default
    String propertyType = "";

    @Builder.Default
    String status = "active";

    @Builder.Default
    BigDecimal price = BigDecimal.ZERO;

    @Builder.Default
    Address address = Address.builder().build();

    @Builder.Default
    Details details = Details.builder().build();

    @Builder.Default
    String description = "";

    @Builder.Default
    List<Media> media = List.of();

    @Builder.Default
    Agent agent = Agent.builder().build();

    @Builder.Default
    Office office = Office.builder().build();

    @Builder.Default
    Dates dates = Dates.builder().build();

    public boolean hasPrice() {
        return price != null && price.signum() > 0;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Address {
        @Builder.Default String streetNumber = "";
        @Builder.Default String streetName = "";
        @Builder.Default String unitNumber = "";
        @Builder.Default String city = "";
        @Builder.Default String state = "";
        @Builder.Default String zipCode = "";
        @Builder.Default String country = "US";
        Double latitude;
        Double longitude;

        @JsonIgnore
        public String getStreetLine() {
            return (streetNumber + " " + streetName).trim();
        }
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Details {
        int bedrooms;
        double bathrooms;
        int squareFeet;
        double lotSize;
        int yearBuilt;
        int stories;
        int garageSpaces;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Media {
        String url;
        @Builder.Default String type = "photo";
        @Builder.Default String caption = "";
        int order;
        boolean primary;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Agent {
        @Builder.Default String id = "";
        @Builder.Default String name = "";
        @Builder.Default String email = "";
        @Builder.Default String phone = "";
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Office {
        @Builder.Default String id = "";
        @Builder.Default String name = "";
        @Builder.Default String phone = "";
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Dates {
        LocalDateTime listed;
        LocalDateTime updated;
        LocalDateTime sold;
        LocalDateTime expires;
    }
}
