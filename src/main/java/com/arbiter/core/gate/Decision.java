package com.arbiter.core.gate;

import com.arbiter.core.ledger.AuditChain;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.HumanConfirmation;
import com.arbiter.core.model.Severity;

import java.util.Objects;

/**
 * A finalized, human-ratified decision.
 * <p>
 * The constructor is package-private: only {@link HumanGate} can create one, and
 * only after the reviewer's confirmation and the FINALIZED record are in the ledger.
 */
public final class Decision implements DecisionResult {

    private final String claimId;
    private final AdvisorySuggestion suggestion;
    private final HumanConfirmation confirmation;
    private final AuditChain auditChain;

    Decision(String claimId, AdvisorySuggestion suggestion, HumanConfirmation confirmation, AuditChain auditChain) {
        this.claimId = Objects.requireNonNull(claimId);
        this.suggestion = Objects.requireNonNull(suggestion);
        this.confirmation = Objects.requireNonNull(confirmation);
        this.auditChain = Objects.requireNonNull(auditChain);
    }

    @Override
    public String claimId() {
        return claimId;
    }

    @Override
    public DecisionState state() {
        return DecisionState.FINALIZED;
    }

    public AdvisorySuggestion suggestion() {
        return suggestion;
    }

    public HumanConfirmation confirmation() {
        return confirmation;
    }

    /** The ratified category. */
    public Severity category() {
        return suggestion.category();
    }

    @Override
    public AuditChain auditChain() {
        return auditChain;
    }

    @Override
    public String toString() {
        return "Decision[claimId=" + claimId + ", category=" + category()
                + ", decisionMaker=" + confirmation.decisionMakerId() + "]";
    }
}
