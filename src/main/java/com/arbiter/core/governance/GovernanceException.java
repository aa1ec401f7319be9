package com.arbiter.core.governance;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * Input or proposed advisory action rejected by capability governance.
 * Terminal for the claim; never downgraded to a default decision.
 */
public abstract class GovernanceException extends DecisionEngineException {

    private final String field;

    protected GovernanceException(String claimId, String field, String message) {
        super(claimId, message);
        this.field = field;
    }

    /** The offending field or advisory attribute, or {@code null} when the failure is not field-specific. */
    public String getField() {
        return field;
    }
}
