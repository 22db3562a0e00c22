package com.openrangelabs.donpetre.mlssync.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for resolving several duplicate candidates in one call
 */
public class BatchResolveRequest {

    @NotEmpty(message = "At least one candidate id is required")
    @Size(max = 500, message = "At most 500 candidates can be resolved per request")
    private List<UUID> candidateIds;

    public BatchResolveRequest() {}

    public BatchResolveRequest(List<UUID> candidateIds) {
        this.candidateIds = candidateIds;
    }

    public List<UUID> getCandidateIds() { return candidateIds; }
    public void setCandidateIds(List<UUID> candidateIds) { this.candidateIds = candidateIds; }
}
