package com.arbiter.dispatch.api;

/**
 * Optional JSON body for POST /api/v1/claims/{claimId}/abandon.
 */
public record AbandonRequest(String reason) {}
