package com.openrangelabs.donpetre.mlssync.model;

import java.util.UUID;

/**
 * Per-candidate result of a batch duplicate resolution.
 */
public record ResolutionOutcome(UUID candidateId, boolean success, String resolvedAction, String error) {

    public static ResolutionOutcome resolved(UUID candidateId, String resolvedAction) {
        return new ResolutionOutcome(candidateId, true, resolvedAction, null);
    }

    public static ResolutionOutcome failed(UUID candidateId, String error) {
        return new ResolutionOutcome(candidateId, false, null, error);
    }
}
