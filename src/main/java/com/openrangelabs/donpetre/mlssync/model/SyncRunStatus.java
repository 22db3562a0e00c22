package com.openrangelabs.donpetre.mlssync.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a sync run.
 */
public enum SyncRunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    PAUSED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(SyncRunStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<SyncRunStatus> allowedTransitions() {
        switch (this) {
            case IDLE:
                return EnumSet.of(RUNNING);
            case RUNNING:
                return EnumSet.of(COMPLETED, FAILED, PAUSED);
            case PAUSED:
                // resume or abandon
                return EnumSet.of(RUNNING, FAILED);
            default:
                return EnumSet.noneOf(SyncRunStatus.class);
        }
    }
}
