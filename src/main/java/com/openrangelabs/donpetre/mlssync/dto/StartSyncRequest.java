package com.openrangelabs.donpetre.mlssync.dto;

import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for starting a sync run against one provider
 */
@Schema(description = "Request for starting a sync run")
public class StartSyncRequest {

    @NotBlank(message = "Provider id is required")
    @Size(max = 100, message = "Provider id must be at most 100 characters")
    @Schema(description = "Configured MLS provider identifier", example = "crmls", required = true)
    private String providerId;

    @Schema(description = "Sync options; defaults to an incremental sync with validation enabled")
    private SyncOptions options;

    // Constructors
    public StartSyncRequest() {}

    public StartSyncRequest(String providerId, SyncOptions options) {
        this.providerId = providerId;
        this.options = options;
    }

    /**
     * Options as sent, or the defaults when the body carried none
     */
    public SyncOptions resolvedOptions() {
        return options != null ? options : SyncOptions.defaults();
    }

    // Getters and Setters
    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public SyncOptions getOptions() { return options; }
    public void setOptions(SyncOptions options) { this.options = options; }

    @Override
    public String toString() {
        return "StartSyncRequest{" +
                "providerId='" + providerId + '\'' +
                ", options=" + options +
                '}';
    }
}
