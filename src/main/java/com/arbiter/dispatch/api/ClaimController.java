package com.arbiter.dispatch.api;

import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.gate.ClaimNotPendingException;
import com.arbiter.core.gate.Decision;
import com.arbiter.core.gate.DecisionContext;
import com.arbiter.core.gate.DecisionResult;
import com.arbiter.core.gate.RejectedDecision;
import com.arbiter.core.ledger.AuditChain;
import com.arbiter.core.model.HumanConfirmation;
import com.arbiter.core.model.RawClaimInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the claim lifecycle: submit, review, abandon, audit.
 * <p>
 * Pending contexts are held by {@link PendingReviews}. They do not survive a
 * restart, after which such claims can still be inspected through their
 * audit trail.
 */
@RestController
@RequestMapping("/api/v1/claims")
public class ClaimController {

    private static final Logger log = LoggerFactory.getLogger(ClaimController.class);

    private final DecisionEngine decisionEngine;
    private final PendingReviews pendingReviews;
    private final ClaimEventStream eventStream;

    public ClaimController(DecisionEngine decisionEngine, PendingReviews pendingReviews,
                           ClaimEventStream eventStream) {
        this.decisionEngine = decisionEngine;
        this.pendingReviews = pendingReviews;
        this.eventStream = eventStream;
    }

    /**
     * POST /api/v1/claims: Evaluate a claim up to human review.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody ClaimRequest request) {
        if (request.fields() == null || request.fields().isEmpty()) {
            throw new IllegalArgumentException("Claim fields are required");
        }
        DecisionContext context = decisionEngine.submit(new RawClaimInput(request.claimId(), request.fields()));
        pendingReviews.add(context);
        log.info("Claim {} pending review via API", context.claimId());
        return ResponseEntity.status(HttpStatus.CREATED).body(pendingView(context));
    }

    /**
     * GET /api/v1/claims/{claimId}: The pending review view of a claim.
     */
    @GetMapping("/{claimId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String claimId) {
        return pendingReviews.find(claimId)
                .map(context -> ResponseEntity.ok(pendingView(context)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/claims/{claimId}/confirmation: Record the reviewer's verdict.
     */
    @PostMapping("/{claimId}/confirmation")
    public ResponseEntity<Map<String, Object>> confirm(@PathVariable String claimId,
                                                       @RequestBody ConfirmationRequest request) {
        if (request.confirmed() == null) {
            throw new IllegalArgumentException("confirmed is required");
        }
        DecisionContext context = requirePending(claimId);
        HumanConfirmation confirmation = new HumanConfirmation(request.confirmed(), request.overrideReason(),
                request.decisionMakerId(), Instant.now());
        DecisionResult result;
        try {
            result = decisionEngine.confirm(context, confirmation);
        } finally {
            pendingReviews.release(context);
        }
        return ResponseEntity.ok(resultView(result));
    }

    /**
     * POST /api/v1/claims/{claimId}/abandon: Close a pending claim without review.
     */
    @PostMapping("/{claimId}/abandon")
    public ResponseEntity<Map<String, Object>> abandon(@PathVariable String claimId,
                                                       @RequestBody(required = false) AbandonRequest request) {
        DecisionContext context = requirePending(claimId);
        RejectedDecision rejected;
        try {
            rejected = decisionEngine.abandon(context, request != null ? request.reason() : null);
        } finally {
            pendingReviews.release(context);
        }
        return ResponseEntity.ok(resultView(rejected));
    }

    /**
     * GET /api/v1/claims/{claimId}/audit: The claim's audit trail.
     */
    @GetMapping("/{claimId}/audit")
    public ResponseEntity<Map<String, Object>> audit(@PathVariable String claimId) {
        AuditChain chain = decisionEngine.readChain(claimId);
        if (chain.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(chainView(chain));
    }

    /**
     * GET /api/v1/claims/{claimId}/events: Live lifecycle events for a claim.
     */
    @GetMapping(value = "/{claimId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String claimId) {
        if (decisionEngine.readChain(claimId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(eventStream.createEmitter(claimId));
    }

    // ── Views ─────────────────────────────────────────────────────────────

    private DecisionContext requirePending(String claimId) {
        return pendingReviews.find(claimId).orElseThrow(() ->
                new ClaimNotPendingException(claimId, "Claim " + claimId + " has no pending review"));
    }

    private static Map<String, Object> pendingView(DecisionContext context) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("claim_id", context.claimId());
        view.put("state", context.state().name());
        view.put("input", context.input());
        view.put("reference", context.reference());
        view.put("suggestion", context.suggestion());
        view.put("display_label", context.suggestion().displayLabel());
        view.put("governance_reminders", context.reminders());
        return view;
    }

    private static Map<String, Object> resultView(DecisionResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("claim_id", result.claimId());
        view.put("state", result.state().name());
        if (result instanceof Decision decision) {
            view.put("category", decision.category());
            view.put("decision_maker_id", decision.confirmation().decisionMakerId());
            view.put("rationale", decision.confirmation().overrideReason());
        } else if (result instanceof RejectedDecision rejected) {
            view.put("rejected_by", rejected.rejectedBy());
            view.put("rationale", rejected.rationale());
        }
        view.put("audit", chainView(result.auditChain()));
        return view;
    }

    static Map<String, Object> chainView(AuditChain chain) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("claim_id", chain.claimId());
        view.put("valid", chain.isValid());
        view.put("violations", chain.violations());
        view.put("records", chain.records().stream().map(AuditRecordView::of).toList());
        return view;
    }
}
