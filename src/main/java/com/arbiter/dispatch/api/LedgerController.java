package com.arbiter.dispatch.api;

import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.LedgerVerification;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for cross-claim compliance review of the audit ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    static final int MAX_PAGE = 500;

    private final AuditLedger ledger;

    public LedgerController(AuditLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * GET /api/v1/ledger/verify: Recompute the hash chain.
     * Returns 200 when intact, 409 when broken.
     */
    @GetMapping("/verify")
    public ResponseEntity<LedgerVerification> verify() {
        LedgerVerification verification = ledger.verify();
        return verification.intact()
                ? ResponseEntity.ok(verification)
                : ResponseEntity.status(409).body(verification);
    }

    /**
     * GET /api/v1/ledger/records?from=1&amp;limit=100: Records in sequence order.
     */
    @GetMapping("/records")
    public ResponseEntity<Map<String, Object>> records(@RequestParam(defaultValue = "1") long from,
                                                       @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_PAGE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE);
        }
        List<AuditRecordView> records = ledger.readFrom(from, limit).stream().map(AuditRecordView::of).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("count", records.size());
        body.put("records", records);
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/ledger/claims: Claim ids in order of first appearance.
     */
    @GetMapping("/claims")
    public ResponseEntity<List<String>> claims() {
        return ResponseEntity.ok(ledger.claimIds());
    }
}
