package com.openrangelabs.donpetre.mlssync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.entity.PropertyListing;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps canonical records onto flat catalog rows and back
 */
@Component
public class PropertyListingMapper {

    private static final TypeReference<List<CanonicalPropertyRecord.Media>> MEDIA_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PropertyListingMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Copy every canonical field onto {@code listing}; identity, merge marker
     * and sync bookkeeping columns are left untouched.
     */
    public PropertyListing apply(CanonicalPropertyRecord record, PropertyListing listing) {
        CanonicalPropertyRecord.Address address = record.getAddress();
        CanonicalPropertyRecord.Details details = record.getDetails();

        listing.setProviderId(record.getProviderId());
        listing.setMlsId(record.getMlsId());
        listing.setListingId(record.getListingId());
        listing.setPropertyType(record.getPropertyType());
        listing.setStatus(record.getStatus());
        listing.setPrice(record.getPrice());

        listing.setStreetNumber(address.getStreetNumber());
        listing.setStreetName(address.getStreetName());
        listing.setUnitNumber(address.getUnitNumber());
        listing.setCity(address.getCity());
        listing.setState(address.getState());
        listing.setZipCode(address.getZipCode());
        listing.setCountry(address.getCountry());
        listing.setLatitude(address.getLatitude());
        listing.setLongitude(address.getLongitude());

        listing.setBedrooms(details.getBedrooms());
        listing.setBathrooms(details.getBathrooms());
        listing.setSquareFeet(details.getSquareFeet());
        listing.setLotSize(details.getLotSize());
        listing.setYearBuilt(details.getYearBuilt());
        listing.setStories(details.getStories());
        listing.setGarageSpaces(details.getGarageSpaces());

        listing.setDescription(record.getDescription());
        listing.setAgentId(record.getAgent().getId());
        listing.setAgentName(record.getAgent().getName());
        listing.setAgentEmail(record.getAgent().getEmail());
        listing.setAgentPhone(record.getAgent().getPhone());
        listing.setOfficeId(record.getOffice().getId());
        listing.setOfficeName(record.getOffice().getName());
        listing.setOfficePhone(record.getOffice().getPhone());
        listing.setMedia(writeMedia(record.getMedia()));

        listing.setListedAt(record.getDates().getListed());
        listing.setUpdatedAt(record.getDates().getUpdated());
        listing.setSoldAt(record.getDates().getSold());
        listing.setExpiresAt(record.getDates().getExpires());
        return listing;
    }

    public CanonicalPropertyRecord toRecord(PropertyListing listing) {
        return CanonicalPropertyRecord.builder()
                .mlsId(listing.getMlsId())
                .providerId(orEmpty(listing.getProviderId()))
                .listingId(orEmpty(listing.getListingId()))
                .propertyType(orEmpty(listing.getPropertyType()))
                .status(listing.getStatus() != null ? listing.getStatus() : "active")
                .price(listing.getPrice() != null ? listing.getPrice() : BigDecimal.ZERO)
                .address(CanonicalPropertyRecord.Address.builder()
                        .streetNumber(orEmpty(listing.getStreetNumber()))
                        .streetName(orEmpty(listing.getStreetName()))
                        .unitNumber(orEmpty(listing.getUnitNumber()))
                        .city(orEmpty(listing.getCity()))
                        .state(orEmpty(listing.getState()))
                        .zipCode(orEmpty(listing.getZipCode()))
                        .country(listing.getCountry() != null ? listing.getCountry() : "US")
                        .latitude(listing.getLatitude())
                        .longitude(listing.getLongitude())
                        .build())
                .details(CanonicalPropertyRecord.Details.builder()
                        .bedrooms(orZero(listing.getBedrooms()))
                        .bathrooms(orZero(listing.getBathrooms()))
                        .squareFeet(orZero(listing.getSquareFeet()))
                        .lotSize(orZero(listing.getLotSize()))
                        .yearBuilt(orZero(listing.getYearBuilt()))
                        .stories(orZero(listing.getStories()))
                        .garageSpaces(orZero(listing.getGarageSpaces()))
                        .build())
                .description(orEmpty(listing.getDescription()))
                .media(readMedia(listing.getMedia()))
                .agent(CanonicalPropertyRecord.Agent.builder()
                        .id(orEmpty(listing.getAgentId()))
                        .name(orEmpty(listing.getAgentName()))
                        .email(orEmpty(listing.getAgentEmail()))
                        .phone(orEmpty(listing.getAgentPhone()))
                        .build())
                .office(CanonicalPropertyRecord.Office.builder()
                        .id(orEmpty(listing.getOfficeId()))
                        .name(orEmpty(listing.getOfficeName()))
                        .phone(orEmpty(listing.getOfficePhone()))
                        .build())
                .dates(CanonicalPropertyRecord.Dates.builder()
                        .listed(listing.getListedAt())
                        .updated(listing.getUpdatedAt())
                        .sold(listing.getSoldAt())
                        .expires(listing.getExpiresAt())
                        .build())
                .build();
    }

    private String writeMedia(List<CanonicalPropertyRecord.Media> media) {
        try {
            return objectMapper.writeValueAsString(media);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize listing media", e);
        }
    }

    private List<CanonicalPropertyRecord.Media> readMedia(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, MEDIA_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored listing media is not valid JSON", e);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
