package com.arbiter.core.governance;

/**
 * An input field is not declared, or not allowed, by the capability dictionary.
 */
public class UnknownFieldException extends GovernanceException {

    public UnknownFieldException(String claimId, String field, String message) {
        super(claimId, field, message);
    }

    @Override
    public String getErrorCode() {
        return "UNKNOWN_FIELD";
    }
}
