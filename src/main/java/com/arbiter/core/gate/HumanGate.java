package com.arbiter.core.gate;

import com.arbiter.core.governance.BoundaryViolationException;
import com.arbiter.core.governance.GovernanceException;
import com.arbiter.core.governance.GovernanceValidator;
import com.arbiter.core.governance.GovernedInput;
import com.arbiter.core.ledger.AuditChain;
import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.AuditPayloads;
import com.arbiter.core.ledger.AuditRecord;
import com.arbiter.core.ledger.AuditStage;
import com.arbiter.core.ledger.LedgerUnavailableException;
import com.arbiter.core.logging.MdcContext;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.HumanConfirmation;
import com.arbiter.core.policy.GovernancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The single point where a claim becomes final.
 * <p>
 * Every transition is recorded before it takes effect: the reviewer's verdict
 * is appended as HUMAN_CONFIRMED, then the outcome as FINALIZED or REJECTED,
 * and only then is the {@link Decision} or {@link RejectedDecision} built.
 * If an append fails the exception propagates and no outcome exists.
 * <p>
 * A context is issued only for the suggestion recorded at ADVISED, after that
 * suggestion passes governance again, and at most one context per claim is
 * open at a time.
 */
@Service
public class HumanGate {

    private static final Logger log = LoggerFactory.getLogger(HumanGate.class);

    static final String DEFAULT_ABANDON_REASON = "Abandoned before human review";

    private final AuditLedger ledger;
    private final GovernanceValidator validator;
    private final GovernancePolicy policy;

    /** Contexts issued and not yet consumed, keyed by claimId. */
    private final ConcurrentHashMap<String, DecisionContext> open = new ConcurrentHashMap<>();

    public HumanGate(AuditLedger ledger, GovernanceValidator validator, GovernancePolicy policy) {
        this.ledger = ledger;
        this.validator = validator;
        this.policy = policy;
    }

    /**
     * Issues the pending-review context for a claim whose chain ends in ADVISED.
     *
     * @throws GovernanceException      if the governed input or the suggestion does not hold under the
     *                                  current policy, or the suggestion is not the one recorded at ADVISED
     * @throws ClaimNotPendingException if the claim is not awaiting review or already has an open context
     */
    public DecisionContext open(GovernedInput governed, AdvisorySuggestion suggestion, List<String> reminders) {
        String claimId = governed.claimId();
        AuditChain chain = requirePendingInLedger(claimId);

        GovernedInput envelope = validator.governInput(claimId, governed.input(), policy);
        if (!envelope.equals(governed)) {
            throw new BoundaryViolationException(claimId, "reference",
                    "Governance envelope for claim " + claimId + " does not match the current policy");
        }
        validator.validateSuggestion(claimId, suggestion, envelope, policy);
        requireRecordedSuggestion(chain, suggestion);

        DecisionContext context = new DecisionContext(envelope, suggestion, reminders);
        if (open.putIfAbsent(claimId, context) != null) {
            throw new ClaimNotPendingException(claimId, "Claim " + claimId + " already has an open review");
        }
        return context;
    }

    /**
     * Applies a reviewer's verdict.
     *
     * @throws MissingRationaleException if the rationale or reviewer id is blank; nothing is recorded
     * @throws ClaimNotPendingException  if the context was already used or the claim is no longer awaiting review
     * @throws LedgerUnavailableException if the verdict or outcome could not be recorded
     */
    public DecisionResult confirm(DecisionContext context, HumanConfirmation confirmation) {
        String claimId = context.claimId();
        if (confirmation == null || !confirmation.hasRationale()) {
            log.warn("Refused confirmation for claim {}: rationale is missing", claimId);
            throw new MissingRationaleException(claimId,
                    "A non-empty rationale is required to confirm or reject claim " + claimId);
        }
        if (!confirmation.hasDecisionMaker()) {
            log.warn("Refused confirmation for claim {}: decision maker is missing", claimId);
            throw new MissingRationaleException(claimId,
                    "The accountable decision maker must be identified for claim " + claimId);
        }

        DecisionState outcome = confirmation.confirmed() ? DecisionState.FINALIZED : DecisionState.REJECTED;
        if (!context.consume(outcome)) {
            throw new ClaimNotPendingException(claimId,
                    "Claim " + claimId + " was already " + context.state().name().toLowerCase());
        }

        MdcContext.setReview(claimId, confirmation.decisionMakerId());
        try {
            try {
                requireRecordedSuggestion(requirePendingInLedger(claimId), context.suggestion());
                ledger.append(AuditPayloads.entry(claimId, AuditStage.HUMAN_CONFIRMED,
                        verdictSnapshot(context, confirmation)));
            } catch (RuntimeException e) {
                // nothing was recorded, so the claim is still awaiting review
                context.release(outcome);
                throw e;
            }
            log.info("Reviewer {} {} claim {}", confirmation.decisionMakerId(),
                    confirmation.confirmed() ? "confirmed" : "rejected", claimId);

            if (confirmation.confirmed()) {
                ledger.append(AuditPayloads.entry(claimId, AuditStage.FINALIZED,
                        finalizedSnapshot(context, confirmation)));
                log.info("Claim {} finalized as {}", claimId, context.suggestion().category().label());
                return new Decision(claimId, context.suggestion(), confirmation, ledger.readChain(claimId));
            }
            ledger.append(AuditPayloads.entry(claimId, AuditStage.REJECTED,
                    rejectedSnapshot(claimId, confirmation.decisionMakerId(), confirmation.overrideReason(),
                            context.suggestion(), null)));
            log.info("Claim {} rejected by {}", claimId, confirmation.decisionMakerId());
            return new RejectedDecision(claimId, context.suggestion(), confirmation.overrideReason(),
                    confirmation.decisionMakerId(), ledger.readChain(claimId));
        } finally {
            closeIfConsumed(context);
            MdcContext.clearReview();
        }
    }

    /**
     * Closes a pending claim without review, recording REJECTED with a system rationale.
     */
    public RejectedDecision abandon(DecisionContext context, String reason) {
        String claimId = context.claimId();
        String rationale = reason == null || reason.isBlank() ? DEFAULT_ABANDON_REASON : reason;
        if (!context.consume(DecisionState.REJECTED)) {
            throw new ClaimNotPendingException(claimId,
                    "Claim " + claimId + " was already " + context.state().name().toLowerCase());
        }
        try {
            requirePendingInLedger(claimId);
            ledger.append(AuditPayloads.entry(claimId, AuditStage.REJECTED,
                    rejectedSnapshot(claimId, RejectedDecision.SYSTEM, rationale, context.suggestion(), "ABANDONED")));
        } catch (RuntimeException e) {
            context.release(DecisionState.REJECTED);
            throw e;
        } finally {
            closeIfConsumed(context);
        }
        log.warn("Claim {} abandoned: {}", claimId, rationale);
        return new RejectedDecision(claimId, context.suggestion(), rationale, RejectedDecision.SYSTEM,
                ledger.readChain(claimId));
    }

    /**
     * Records that the system closed a claim after a pipeline failure. No
     * {@link RejectedDecision} is produced; the caller rethrows the failure.
     */
    public void recordSystemRejection(String claimId, String errorCode, String reason) {
        ledger.append(AuditPayloads.entry(claimId, AuditStage.REJECTED,
                rejectedSnapshot(claimId, RejectedDecision.SYSTEM, reason, null, errorCode)));
        log.warn("Claim {} closed by system ({}): {}", claimId, errorCode, reason);
    }

    private AuditChain requirePendingInLedger(String claimId) {
        AuditChain chain = ledger.readChain(claimId);
        if (!chain.isPendingReview()) {
            throw new ClaimNotPendingException(claimId, "Claim " + claimId + " is not awaiting review (last stage: "
                    + chain.lastStage().map(Enum::name).orElse("none") + ")");
        }
        return chain;
    }

    private static void requireRecordedSuggestion(AuditChain chain, AdvisorySuggestion suggestion) {
        String claimId = chain.claimId();
        String recorded = chain.find(AuditStage.ADVISED).map(AuditRecord::payload).orElse(null);
        String presented = AuditPayloads.entry(claimId, AuditStage.ADVISED, suggestion).payload();
        if (!presented.equals(recorded)) {
            throw new BoundaryViolationException(claimId, "suggestion",
                    "Suggestion for claim " + claimId + " is not the one recorded at ADVISED");
        }
    }

    private void closeIfConsumed(DecisionContext context) {
        if (!context.isPending()) {
            open.remove(context.claimId(), context);
        }
    }

    private static Map<String, Object> verdictSnapshot(DecisionContext context, HumanConfirmation confirmation) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("claimId", context.claimId());
        snapshot.put("suggestedCategory", context.suggestion().category());
        snapshot.put("confirmation", confirmation);
        return snapshot;
    }

    private static Map<String, Object> finalizedSnapshot(DecisionContext context, HumanConfirmation confirmation) {
        AdvisorySuggestion suggestion = context.suggestion();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("claimId", context.claimId());
        snapshot.put("category", suggestion.category());
        snapshot.put("confidence", suggestion.confidence());
        snapshot.put("modelId", suggestion.modelId());
        snapshot.put("modelVersion", suggestion.modelVersion());
        snapshot.put("decisionMakerId", confirmation.decisionMakerId());
        snapshot.put("rationale", confirmation.overrideReason());
        return snapshot;
    }

    private static Map<String, Object> rejectedSnapshot(String claimId, String rejectedBy, String rationale,
                                                        AdvisorySuggestion suggestion, String errorCode) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("claimId", claimId);
        snapshot.put("rejectedBy", rejectedBy);
        snapshot.put("rationale", rationale);
        if (suggestion != null) {
            snapshot.put("suggestedCategory", suggestion.category());
        }
        if (errorCode != null) {
            snapshot.put("errorCode", errorCode);
        }
        return snapshot;
    }
}
