package com.arbiter.core.gate;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * A confirmation arrived without a rationale or without an accountable reviewer.
 * Nothing is recorded and the context stays pending.
 */
public class MissingRationaleException extends DecisionEngineException {

    public MissingRationaleException(String claimId, String message) {
        super(claimId, message);
    }

    @Override
    public String getErrorCode() {
        return "MISSING_RATIONALE";
    }
}
