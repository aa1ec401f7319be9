package com.arbiter.core.gate;

import com.arbiter.core.governance.GovernedInput;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.policy.BoundaryReference;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A claim waiting for human review.
 * <p>
 * Issued by {@link HumanGate#open} once the ADVISED record is in the ledger, and
 * consumed by exactly one successful {@link HumanGate#confirm} or
 * {@link HumanGate#abandon}. A confirmation refused for a missing rationale
 * leaves the context pending.
 */
public final class DecisionContext {

    private final GovernedInput governed;
    private final AdvisorySuggestion suggestion;
    private final List<String> reminders;
    private final AtomicReference<DecisionState> state = new AtomicReference<>(DecisionState.PENDING_HUMAN);

    DecisionContext(GovernedInput governed, AdvisorySuggestion suggestion, List<String> reminders) {
        this.governed = Objects.requireNonNull(governed);
        this.suggestion = Objects.requireNonNull(suggestion);
        this.reminders = List.copyOf(reminders);
    }

    public String claimId() {
        return governed.claimId();
    }

    public ClaimInput input() {
        return governed.input();
    }

    public BoundaryReference reference() {
        return governed.reference();
    }

    public AdvisorySuggestion suggestion() {
        return suggestion;
    }

    /** Governance reminders to show the reviewer alongside the suggestion. */
    public List<String> reminders() {
        return reminders;
    }

    public DecisionState state() {
        return state.get();
    }

    public boolean isPending() {
        return state.get() == DecisionState.PENDING_HUMAN;
    }

    boolean consume(DecisionState outcome) {
        return state.compareAndSet(DecisionState.PENDING_HUMAN, outcome);
    }

    void release(DecisionState outcome) {
        state.compareAndSet(outcome, DecisionState.PENDING_HUMAN);
    }

    @Override
    public String toString() {
        return "DecisionContext[claimId=" + claimId() + ", suggestion=" + suggestion.category()
                + ", state=" + state.get() + "]";
    }
}
