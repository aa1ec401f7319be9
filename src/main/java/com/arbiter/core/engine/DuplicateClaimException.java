package com.arbiter.core.engine;

/**
 * Thrown when a submission reuses a claim id that already has an audit chain.
 * Resubmissions must use a fresh id so each chain stays a single forward pass.
 */
public class DuplicateClaimException extends DecisionEngineException {

    public DuplicateClaimException(String claimId) {
        super(claimId, "Claim " + claimId + " already has an audit chain; resubmit under a new claim id");
    }

    @Override
    public String getErrorCode() {
        return "DUPLICATE_CLAIM";
    }
}
