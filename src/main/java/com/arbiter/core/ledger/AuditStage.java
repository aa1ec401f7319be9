package com.arbiter.core.ledger;

import java.util.List;

/**
 * Pipeline stage recorded by an audit record.
 * <p>
 * A claim's chain is a gap-free prefix of {@link #FORWARD_ORDER}, optionally
 * closed by a single {@link #REJECTED} record. {@link #ADVISED} marks the claim
 * as pending human review.
 */
public enum AuditStage {
    RECEIVED,
    VALIDATED,
    GOVERNED,
    ADVISED,
    HUMAN_CONFIRMED,
    FINALIZED,
    REJECTED;

    public static final List<AuditStage> FORWARD_ORDER =
            List.of(RECEIVED, VALIDATED, GOVERNED, ADVISED, HUMAN_CONFIRMED, FINALIZED);

    public boolean isTerminal() {
        return this == FINALIZED || this == REJECTED;
    }
}
