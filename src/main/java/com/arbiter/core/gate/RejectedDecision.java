package com.arbiter.core.gate;

import com.arbiter.core.ledger.AuditChain;
import com.arbiter.core.model.AdvisorySuggestion;

import java.util.Objects;
import java.util.Optional;

/**
 * A claim closed without a decision, either by a reviewer or by the system.
 * Created only by {@link HumanGate}.
 */
public final class RejectedDecision implements DecisionResult {

    /** Recorded as {@link #rejectedBy()} when the system, not a person, closed the claim. */
    public static final String SYSTEM = "system";

    private final String claimId;
    private final AdvisorySuggestion suggestion;
    private final String rationale;
    private final String rejectedBy;
    private final AuditChain auditChain;

    RejectedDecision(String claimId, AdvisorySuggestion suggestion, String rationale, String rejectedBy,
                     AuditChain auditChain) {
        this.claimId = Objects.requireNonNull(claimId);
        this.suggestion = suggestion;
        this.rationale = Objects.requireNonNull(rationale);
        this.rejectedBy = Objects.requireNonNull(rejectedBy);
        this.auditChain = Objects.requireNonNull(auditChain);
    }

    @Override
    public String claimId() {
        return claimId;
    }

    @Override
    public DecisionState state() {
        return DecisionState.REJECTED;
    }

    /** The suggestion that was under review, if the claim got that far. */
    public Optional<AdvisorySuggestion> suggestion() {
        return Optional.ofNullable(suggestion);
    }

    public String rationale() {
        return rationale;
    }

    public String rejectedBy() {
        return rejectedBy;
    }

    public boolean isSystemRejection() {
        return SYSTEM.equals(rejectedBy);
    }

    @Override
    public AuditChain auditChain() {
        return auditChain;
    }

    @Override
    public String toString() {
        return "RejectedDecision[claimId=" + claimId + ", rejectedBy=" + rejectedBy
                + ", rationale=" + rationale + "]";
    }
}
