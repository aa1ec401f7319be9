package com.arbiter.core.engine;

/**
 * Root of every failure the decision pipeline reports to its caller.
 * <p>
 * Each subclass names one failure category, so callers can react to the
 * category without parsing messages. The message is always a human-readable
 * reason suitable for showing to a reviewer.
 */
public class DecisionEngineException extends RuntimeException {

    private final String claimId;

    public DecisionEngineException(String claimId, String message) {
        super(message);
        this.claimId = claimId;
    }

    public DecisionEngineException(String claimId, String message, Throwable cause) {
        super(message, cause);
        this.claimId = claimId;
    }

    /** The claim the failure belongs to; {@code null} when it occurred before an id was assigned. */
    public String getClaimId() {
        return claimId;
    }

    /** Short machine-readable category, e.g. {@code OUT_OF_RANGE}. */
    public String getErrorCode() {
        return "DECISION_ENGINE_ERROR";
    }
}
