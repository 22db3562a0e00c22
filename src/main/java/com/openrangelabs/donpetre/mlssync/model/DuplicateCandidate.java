package com.openrangelabs.donpetre.mlssync.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A pair of records suspected to describe the same physical listing.
 */
@Value
@Builder
public class DuplicateCandidate {
    String id;
    double confidence;
    CanonicalPropertyRecord source;
    CanonicalPropertyRecord target;
    double addressSimilarity;
    double priceSimilarity;
    double detailsSimilarity;
    @Builder.Default
    List<String> matchReasons = List.of();
    SuggestedAction suggestedAction;
    /** Present only when the suggested action is a merge. */
    CanonicalPropertyRecord mergePayload;
}
