package com.openrangelabs.donpetre.mlssync.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Quality assessment of one canonical record. All scores are within 0..100.
 */
@Value
@Builder
public class QualityScore {
    String mlsId;
    int overall;
    int completeness;
    int accuracy;
    int consistency;
    @Builder.Default
    List<String> issues = List.of();
    @Builder.Default
    List<String> recommendations = List.of();

    public boolean isBelow(int threshold) {
        return overall < threshold;
    }
}
