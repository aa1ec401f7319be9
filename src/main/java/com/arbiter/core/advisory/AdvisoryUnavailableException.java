package com.arbiter.core.advisory;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * The advisory model failed, timed out or returned nothing. The claim stops and
 * requires human handling; no default suggestion is substituted.
 */
public class AdvisoryUnavailableException extends DecisionEngineException {

    public AdvisoryUnavailableException(String claimId, String message) {
        super(claimId, message);
    }

    public AdvisoryUnavailableException(String claimId, String message, Throwable cause) {
        super(claimId, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "ADVISORY_UNAVAILABLE";
    }
}
