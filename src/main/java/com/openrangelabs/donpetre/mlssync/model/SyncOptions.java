package com.openrangelabs.donpetre.mlssync.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Options controlling a single sync run.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SyncOptions {

    boolean fullSync;

    DateRange dateRange;

    @Builder.Default
    List<String> propertyTypes = List.of();

    @Builder.Default
    List<String> statusFilter = List.of();

    Integer maxRecords;

    boolean skipDuplicates;

    @Builder.Default
    boolean validateData = true;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }

    public boolean hasRecordCap() {
        return maxRecords != null && maxRecords > 0;
    }

    @Value
    @Builder
    @Jacksonized
    public static class DateRange {
        LocalDateTime start;
        LocalDateTime end;
    }
}
