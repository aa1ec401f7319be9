package com.arbiter.core.governance;

/**
 * A claim or an advisory suggestion falls outside the decision boundaries or
 * uses an advisory action the capability dictionary does not permit.
 */
public class BoundaryViolationException extends GovernanceException {

    public BoundaryViolationException(String claimId, String field, String message) {
        super(claimId, field, message);
    }

    @Override
    public String getErrorCode() {
        return "BOUNDARY_VIOLATION";
    }
}
