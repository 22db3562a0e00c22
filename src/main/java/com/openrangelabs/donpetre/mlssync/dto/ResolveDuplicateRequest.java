package com.openrangelabs.donpetre.mlssync.dto;

import com.openrangelabs.donpetre.mlssync.model.SuggestedAction;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Optional body for resolving a single duplicate candidate. A missing action
 * applies the candidate's suggested action.
 */
public class ResolveDuplicateRequest {

    @Schema(description = "Action to apply instead of the suggested one", example = "keep_both",
            allowableValues = {"merge", "keep_both", "skip"})
    private SuggestedAction action;

    public ResolveDuplicateRequest() {}

    public ResolveDuplicateRequest(SuggestedAction action) {
        this.action = action;
    }

    public SuggestedAction getAction() { return action; }
    public void setAction(SuggestedAction action) { this.action = action; }
}
