package com.arbiter.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/claims.
 *
 * @param claimId optional claim id; generated when absent
 * @param fields  raw claim fields, e.g. {@code claim_type}, {@code damage_amount}
 */
public record ClaimRequest(
    @JsonProperty("claim_id") String claimId,
    Map<String, Object> fields
) {}
