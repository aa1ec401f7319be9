package com.arbiter.core.gate;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * The claim is not awaiting review: its context was already consumed, or its
 * audit chain does not end in ADVISED.
 */
public class ClaimNotPendingException extends DecisionEngineException {

    public ClaimNotPendingException(String claimId, String message) {
        super(claimId, message);
    }

    @Override
    public String getErrorCode() {
        return "CLAIM_NOT_PENDING";
    }
}
