package com.openrangelabs.donpetre.mlssync.model;

/**
 * Outcome of a start request: either a new run or a conflict with the run
 * already active for the provider.
 */
public record StartSyncResult(Outcome outcome, SyncRunSnapshot run, String activeRunId) {

    public enum Outcome { STARTED, CONFLICT }

    public static StartSyncResult started(SyncRunSnapshot run) {
        return new StartSyncResult(Outcome.STARTED, run, run.runId());
    }

    public static StartSyncResult conflict(SyncRunSnapshot activeRun) {
        return new StartSyncResult(Outcome.CONFLICT, activeRun, activeRun.runId());
    }

    public boolean isStarted() {
        return outcome == Outcome.STARTED;
    }
}
