package com.openrangelabs.donpetre.mlssync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resolution proposed for a duplicate candidate.
 */
public enum SuggestedAction {
    MERGE("merge", "merged"),
    KEEP_BOTH("keep_both", "kept_both"),
    SKIP("skip", "skipped");

    private final String value;
    private final String resolvedValue;

    SuggestedAction(String value, String resolvedValue) {
        this.value = value;
        this.resolvedValue = resolvedValue;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Value stored once the action has been applied.
     */
    public String getResolvedValue() {
        return resolvedValue;
    }

    @JsonCreator
    public static SuggestedAction fromValue(String value) {
        for (SuggestedAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown duplicate action: " + value);
    }
}
