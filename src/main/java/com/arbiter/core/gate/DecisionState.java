package com.arbiter.core.gate;

/**
 * Lifecycle of a {@link DecisionContext}. The only transitions are
 * PENDING_HUMAN to FINALIZED or REJECTED.
 */
public enum DecisionState {
    PENDING_HUMAN,
    FINALIZED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING_HUMAN;
    }
}
