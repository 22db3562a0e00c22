package com.openrangelabs.donpetre.mlssync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Local catalog row for one listing, unique by (provider_id, mls_id)
 */
@Table("mls_properties")
public class PropertyListing {

    @Id
    private UUID id;

    @Column("provider_id")
    private String providerId;

    @Column("mls_id")
    private String mlsId;

    @Column("listing_id")
    private String listingId;

    @Column("property_type")
    private String propertyType;

    private String status;

    private BigDecimal price;

    @Column("street_number")
    private String streetNumber;

    @Column("street_name")
    private String streetName;

    @Column("unit_number")
    private String unitNumber;

    private String city;

    private String state;

    @Column("zip_code")
    private String zipCode;

    private String country;

    private Double latitude;

    private Double longitude;

    private Integer bedrooms;

    private Double bathrooms;

    @Column("square_feet")
    private Integer squareFeet;

    @Column("lot_size")
    private Double lotSize;

    @Column("year_built")
    private Integer yearBuilt;

    private Integer stories;

    @Column("garage_spaces")
    private Integer garageSpaces;

    private String description;

    @Column("agent_id")
    private String agentId;

    @Column("agent_name")
    private String agentName;

    @Column("agent_email")
    private String agentEmail;

    @Column("agent_phone")
    private String agentPhone;

    @Column("office_id")
    private String officeId;

    @Column("office_name")
    private String officeName;

    @Column("office_phone")
    private String officePhone;

    // JSON array of media items
    private String media;

    @Column("listed_at")
    private LocalDateTime listedAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("sold_at")
    private LocalDateTime soldAt;

    @Column("expires_at")
    private LocalDateTime expiresAt;

    @Column("quality_score")
    private Integer qualityScore;

    @Column("merged_into_mls_id")
    private String mergedIntoMlsId;

    @Column("last_synced_at")
    private LocalDateTime lastSyncedAt;

    public PropertyListing() {}

    public boolean isMerged() {
        return mergedIntoMlsId != null;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getMlsId() { return mlsId; }
    public void setMlsId(String mlsId) { this.mlsId = mlsId; }

    public String getListingId() { return listingId; }
    public void setListingId(String listingId) { this.listingId = listingId; }

    public String getPropertyType() { return propertyType; }
    public void setPropertyType(String propertyType) { this.propertyType = propertyType; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }

    public String getStreetNumber() { return streetNumber; }
    public void setStreetNumber(String streetNumber) { this.streetNumber = streetNumber; }

    public String getStreetName() { return streetName; }
    public void setStreetName(String streetName) { this.streetName = streetName; }

    public String getUnitNumber() { return unitNumber; }
    public void setUnitNumber(String unitNumber) { this.unitNumber = unitNumber; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getZipCode() { return zipCode; }
    public void setZipCode(String zipCode) { this.zipCode = zipCode; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }

    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }

    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }

    public Integer getBedrooms() { return bedrooms; }
    public void setBedrooms(Integer bedrooms) { this.bedrooms = bedrooms; }

    public Double getBathrooms() { return bathrooms; }
    public void setBathrooms(Double bathrooms) { this.bathrooms = bathrooms; }

    public Integer getSquareFeet() { return squareFeet; }
    public void setSquareFeet(Integer squareFeet) { this.squareFeet = squareFeet; }

    public Double getLotSize() { return lotSize; }
    public void setLotSize(Double lotSize) { this.lotSize = lotSize; }

    public Integer getYearBuilt() { return yearBuilt; }
    public void setYearBuilt(Integer yearBuilt) { this.yearBuilt = yearBuilt; }

    public Integer getStories() { return stories; }
    public void setStories(Integer stories) { this.stories = stories; }

    public Integer getGarageSpaces() { return garageSpaces; }
    public void setGarageSpaces(Integer garageSpaces) { this.garageSpaces = garageSpaces; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public String getAgentEmail() { return agentEmail; }
    public void setAgentEmail(String agentEmail) { this.agentEmail = agentEmail; }

    public String getAgentPhone() { return agentPhone; }
    public void setAgentPhone(String agentPhone) { this.agentPhone = agentPhone; }

    public String getOfficeId() { return officeId; }
    public void setOfficeId(String officeId) { this.officeId = officeId; }

    public String getOfficeName() { return officeName; }
    public void setOfficeName(String officeName) { this.officeName = officeName; }

    public String getOfficePhone() { return officePhone; }
    public void setOfficePhone(String officePhone) { this.officePhone = officePhone; }

    public String getMedia() { return media; }
    public void setMedia(String media) { this.media = media; }

    public LocalDateTime getListedAt() { return listedAt; }
    public void setListedAt(LocalDateTime listedAt) { this.listedAt = listedAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public LocalDateTime getSoldAt() { return soldAt; }
    public void setSoldAt(LocalDateTime soldAt) { this.soldAt = soldAt; }

    public LocalDateTime getExpiresAt() { return expiresAt; }
    public void setExpiresAt(LocalDateTime expiresAt) { this.expiresAt = expiresAt; }

    public Integer getQualityScore() { return qualityScore; }
    public void setQualityScore(Integer qualityScore) { this.qualityScore = qualityScore; }

    public String getMergedIntoMlsId() { return mergedIntoMlsId; }
    public void setMergedIntoMlsId(String mergedIntoMlsId) { this.mergedIntoMlsId = mergedIntoMlsId; }

    public LocalDateTime getLastSyncedAt() { return lastSyncedAt; }
    public void setLastSyncedAt(LocalDateTime lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyListing that = (PropertyListing) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PropertyListing{" +
                "providerId='" + providerId + '\'' +
                ", mlsId='" + mlsId + '\'' +
                ", status='" + status + '\'' +
                ", price=" + price +
                ", city='" + city + '\'' +
                ", state='" + state + '\'' +
                ", mergedIntoMlsId='" + mergedIntoMlsId + '\'' +
                '}';
    }
}
