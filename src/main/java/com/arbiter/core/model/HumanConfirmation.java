package com.arbiter.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A reviewer's verdict on a pending advisory decision.
 * <p>
 * The rationale is mandatory for both outcomes; the human gate refuses a
 * confirmation whose {@code overrideReason} is blank.
 *
 * @param confirmed       {@code true} to accept the suggestion, {@code false} to reject it
 * @param overrideReason  the reviewer's rationale
 * @param decisionMakerId identifier of the accountable reviewer
 * @param timestamp       when the verdict was given
 */
public record HumanConfirmation(
    boolean confirmed,
    String overrideReason,
    String decisionMakerId,
    Instant timestamp
) implements Serializable {

    public static HumanConfirmation accept(String decisionMakerId, String reason, Instant at) {
        return new HumanConfirmation(true, reason, decisionMakerId, at);
    }

    public static HumanConfirmation reject(String decisionMakerId, String reason, Instant at) {
        return new HumanConfirmation(false, reason, decisionMakerId, at);
    }

    public boolean hasRationale() {
        return overrideReason != null && !overrideReason.isBlank();
    }

    public boolean hasDecisionMaker() {
        return decisionMakerId != null && !decisionMakerId.isBlank();
    }
}
