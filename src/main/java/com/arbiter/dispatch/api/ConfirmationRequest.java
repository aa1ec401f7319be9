package com.arbiter.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/claims/{claimId}/confirmation.
 *
 * @param confirmed       the reviewer's verdict; required, never defaulted
 * @param overrideReason  the reviewer's rationale
 * @param decisionMakerId the accountable reviewer
 */
public record ConfirmationRequest(
    Boolean confirmed,
    @JsonProperty("override_reason") String overrideReason,
    @JsonProperty("decision_maker_id") String decisionMakerId
) {}
