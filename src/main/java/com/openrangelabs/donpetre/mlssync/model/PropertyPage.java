package com.openrangelabs.donpetre.mlssync.model;

import java.util.List;

/**
 * One page of a provider search, already transformed to canonical records.
 *
 * @param pageNumber     1-based page index
 * @param records        records in fetch order
 * @param failures       raw items that could not be transformed
 * @param hasMore        whether the provider reports further pages
 * @param totalRecords   provider-reported total, or null when unknown
 */
public record PropertyPage(
        int pageNumber,
        List<CanonicalPropertyRecord> records,
        List<RecordFailure> failures,
        boolean hasMore,
        Integer totalRecords) {

    public PropertyPage {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public int size() {
        return records.size() + failures.size();
    }

    /**
     * A raw item that failed transformation.
     */
    public record RecordFailure(String mlsRecordId, String message) {
    }
}
