package com.arbiter.core.gate;

import com.arbiter.core.ledger.AuditChain;

/**
 * Terminal outcome of a claim: a {@link Decision} or a {@link RejectedDecision}.
 * Both are created only by {@link HumanGate}.
 */
public interface DecisionResult {

    String claimId();

    DecisionState state();

    /** The claim's audit records as of the moment the outcome was recorded. */
    AuditChain auditChain();
}
