package com.arbiter.core.ledger;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * The ledger could not durably accept a record, or did not within its timeout.
 * Always fatal to the in-flight claim: nothing is finalized without a complete trail.
 */
public class LedgerUnavailableException extends DecisionEngineException {

    public LedgerUnavailableException(String claimId, String message) {
        super(claimId, message);
    }

    public LedgerUnavailableException(String claimId, String message, Throwable cause) {
        super(claimId, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "LEDGER_UNAVAILABLE";
    }
}
