package com.arbiter.core.engine;

import com.arbiter.core.advisory.AdvisoryUnavailableException;
import com.arbiter.core.advisory.TimeBoundedAdvisory;
import com.arbiter.core.events.DecisionEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.gate.DecisionContext;
import com.arbiter.core.gate.DecisionResult;
import com.arbiter.core.gate.HumanGate;
import com.arbiter.core.gate.HumanReviewer;
import com.arbiter.core.gate.RejectedDecision;
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
import com.arbiter.core.metrics.ArbiterMetrics;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.HumanConfirmation;
import com.arbiter.core.model.RawClaimInput;
import com.arbiter.core.policy.GovernancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a claim through RECEIVED, VALIDATED, GOVERNED and ADVISED, then hands
 * it to the {@link HumanGate}.
 * <p>
 * Each stage appends its audit record before the next stage starts. A
 * governance or advisory failure closes the claim with a system REJECTED
 * record and is rethrown; a ledger failure is rethrown without further writes.
 * Nothing is retried. The engine keeps no per-claim state: pending contexts
 * belong to the caller.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final GovernancePolicy policy;
    private final GovernanceValidator validator;
    private final TimeBoundedAdvisory advisory;
    private final HumanGate gate;
    private final AuditLedger ledger;
    private final EventBus eventBus;
    private final ArbiterMetrics metrics;

    /** Claim ids between the duplicate check and their RECEIVED record. */
    private final Set<String> admitting = ConcurrentHashMap.newKeySet();

    public DecisionEngine(GovernancePolicy policy, GovernanceValidator validator, TimeBoundedAdvisory advisory,
                          HumanGate gate, AuditLedger ledger, EventBus eventBus, ArbiterMetrics metrics) {
        this.policy = policy;
        this.validator = validator;
        this.advisory = advisory;
        this.gate = gate;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Evaluates a claim up to the point where a human must decide.
     *
     * @return the pending context; never a decision
     * @throws DuplicateClaimException       if the claim id already has audit records
     * @throws GovernanceException           if the input or the suggestion breaks policy
     * @throws AdvisoryUnavailableException  if the model failed or timed out
     * @throws LedgerUnavailableException    if any stage could not be recorded
     */
    public DecisionContext submit(RawClaimInput raw) {
        String claimId = raw.hasClaimId() ? raw.claimId() : generateClaimId();
        MdcContext.setClaim(claimId);
        try {
            metrics.recordClaimSubmitted();
            admit(claimId, raw);

            DecisionContext context;
            try {
                MdcContext.setStage(claimId, AuditStage.VALIDATED.name());
                ClaimInput input = validator.validateInput(claimId, raw, policy.dictionary());
                record(claimId, AuditStage.VALIDATED, input);

                MdcContext.setStage(claimId, AuditStage.GOVERNED.name());
                GovernedInput governed = validator.governInput(claimId, input, policy);
                record(claimId, AuditStage.GOVERNED, governedSnapshot(governed));

                MdcContext.setStage(claimId, AuditStage.ADVISED.name());
                AdvisorySuggestion suggestion = advise(claimId, governed);
                validator.validateSuggestion(claimId, suggestion, governed, policy);
                List<String> reminders = GovernanceReminders.render(governed, suggestion);
                record(claimId, AuditStage.ADVISED, suggestion);

                context = gate.open(governed, suggestion, reminders);
            } catch (GovernanceException e) {
                metrics.recordGovernanceRejection(e.getErrorCode());
                log.warn("Governance rejected claim {} [{}]: {}", claimId, e.getErrorCode(), e.getMessage());
                closeAfterFailure(claimId, e);
                throw e;
            } catch (AdvisoryUnavailableException e) {
                log.warn("Advisory unavailable for claim {}: {}", claimId, e.getMessage());
                closeAfterFailure(claimId, e);
                throw e;
            }

            AdvisorySuggestion suggestion = context.suggestion();
            log.info("Claim {} awaiting human review: {} (confidence {})", claimId,
                    suggestion.displayLabel(), suggestion.confidence());
            publish("claim.pending", claimId, -1, Map.of("suggestion", suggestion.category().label()));
            return context;
        } catch (LedgerUnavailableException e) {
            log.error("Ledger unavailable while evaluating claim {}: {}", claimId, e.getMessage(), e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies a reviewer's verdict to a pending claim.
     */
    public DecisionResult confirm(DecisionContext context, HumanConfirmation confirmation) {
        String claimId = context.claimId();
        MdcContext.setStage(claimId, AuditStage.HUMAN_CONFIRMED.name());
        try {
            DecisionResult result = gate.confirm(context, confirmation);
            metrics.recordDecision(result.state().name().toLowerCase());
            publish("claim." + result.state().name().toLowerCase(), claimId, lastSequence(result.auditChain()),
                    Map.of("decisionMaker", confirmation.decisionMakerId()));
            return result;
        } catch (LedgerUnavailableException e) {
            log.error("Ledger unavailable while confirming claim {}: {}", claimId, e.getMessage(), e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Single end-to-end path from raw input to a terminal outcome. The reviewer
     * is asked only after the claim is pending. If the reviewer fails or the
     * confirmation is refused, the context would be lost with this call, so the
     * claim is abandoned with a system rationale before the failure is rethrown.
     */
    public DecisionResult makeDecision(RawClaimInput raw, HumanReviewer reviewer) {
        DecisionContext context = submit(raw);
        try {
            HumanConfirmation confirmation = reviewer.review(context);
            return confirm(context, confirmation);
        } catch (RuntimeException e) {
            abandonUnreviewed(context, e);
            throw e;
        }
    }

    /**
     * Closes a pending claim without review, recording a system rationale.
     */
    public RejectedDecision abandon(DecisionContext context, String reason) {
        String claimId = context.claimId();
        MdcContext.setClaim(claimId);
        try {
            RejectedDecision rejected = gate.abandon(context, reason);
            metrics.recordDecision("abandoned");
            publish("claim.abandoned", claimId, lastSequence(rejected.auditChain()),
                    Map.of("reason", rejected.rationale()));
            return rejected;
        } finally {
            MdcContext.clear();
        }
    }

    public AuditChain readChain(String claimId) {
        return ledger.readChain(claimId);
    }

    public GovernancePolicy policy() {
        return policy;
    }

    /**
     * Generates a claim id of the form {@code CLM-<year>-<8 hex chars>}.
     */
    public String generateClaimId() {
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String suffix = UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        return String.format("CLM-%d-%s", year, suffix);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void admit(String claimId, RawClaimInput raw) {
        if (!admitting.add(claimId)) {
            throw new DuplicateClaimException(claimId);
        }
        try {
            if (!ledger.readChain(claimId).isEmpty()) {
                throw new DuplicateClaimException(claimId);
            }
            MdcContext.setStage(claimId, AuditStage.RECEIVED.name());
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("claimId", claimId);
            snapshot.put("fields", raw.fields());
            long sequence = ledger.append(AuditPayloads.entry(claimId, AuditStage.RECEIVED, snapshot));
            log.info("Received claim {} with {} field(s)", claimId, raw.fields().size());
            publish("claim.received", claimId, sequence, Map.of());
        } finally {
            admitting.remove(claimId);
        }
    }

    private AdvisorySuggestion advise(String claimId, GovernedInput governed) {
        long start = System.currentTimeMillis();
        try {
            return advisory.suggest(claimId, governed.input());
        } catch (AdvisoryUnavailableException e) {
            metrics.recordAdvisoryFailure();
            throw e;
        } finally {
            metrics.recordAdvisoryDuration(System.currentTimeMillis() - start);
        }
    }

    private void record(String claimId, AuditStage stage, Object snapshot) {
        long sequence = ledger.append(AuditPayloads.entry(claimId, stage, snapshot));
        log.info("Claim {} {}", claimId, stage);
        publish("claim." + stage.name().toLowerCase(), claimId, sequence, Map.of());
    }

    private void closeAfterFailure(String claimId, DecisionEngineException failure) {
        try {
            gate.recordSystemRejection(claimId, failure.getErrorCode(), failure.getMessage());
            publish("claim.rejected", claimId, -1, Map.of("errorCode", failure.getErrorCode()));
        } catch (LedgerUnavailableException e) {
            log.error("Could not record system rejection for claim {}: {}", claimId, e.getMessage(), e);
            failure.addSuppressed(e);
        }
    }

    private void abandonUnreviewed(DecisionContext context, RuntimeException failure) {
        if (!context.isPending()) {
            return;
        }
        String reason = failure instanceof DecisionEngineException engineFailure
                ? "Review not completed [" + engineFailure.getErrorCode() + "]: " + failure.getMessage()
                : "Review not completed: " + failure.getMessage();
        try {
            abandon(context, reason);
        } catch (DecisionEngineException e) {
            log.error("Could not abandon unreviewed claim {}: {}", context.claimId(), e.getMessage(), e);
            failure.addSuppressed(e);
        }
    }

    private Map<String, Object> governedSnapshot(GovernedInput governed) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("claimId", governed.claimId());
        snapshot.put("reference", governed.reference());
        snapshot.put("permittedActions", governed.permittedActions());
        snapshot.put("dictionaryVersion", policy.dictionary().version());
        snapshot.put("dictionaryFingerprint", policy.dictionaryFingerprint());
        snapshot.put("boundariesVersion", policy.boundaries().version());
        snapshot.put("boundariesFingerprint", policy.boundariesFingerprint());
        return snapshot;
    }

    private void publish(String eventType, String claimId, long sequence, Map<String, Object> payload) {
        eventBus.publish(new DecisionEvent(eventType, claimId, sequence, payload, Instant.now()));
    }

    private static long lastSequence(AuditChain chain) {
        List<AuditRecord> records = chain.records();
        return records.isEmpty() ? -1 : records.get(records.size() - 1).sequenceNumber();
    }
}
