package com.arbiter.core.governance;

/**
 * A field value violates its declared type, range or enumeration, or a required field is missing.
 */
public class OutOfRangeException extends GovernanceException {

    public OutOfRangeException(String claimId, String field, String message) {
        super(claimId, field, message);
    }

    @Override
    public String getErrorCode() {
        return "OUT_OF_RANGE";
    }
}
