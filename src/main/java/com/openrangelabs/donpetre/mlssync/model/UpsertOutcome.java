package com.openrangelabs.donpetre.mlssync.model;

public enum UpsertOutcome {
    CREATED,
    UPDATED
}
