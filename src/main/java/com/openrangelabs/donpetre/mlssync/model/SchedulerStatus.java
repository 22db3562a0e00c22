package com.openrangelabs.donpetre.mlssync.model;

import java.time.LocalDateTime;

public record SchedulerStatus(
        String providerId,
        boolean enabled,
        long intervalSeconds,
        String lastRunId,
        LocalDateTime nextRunEta) {
}
