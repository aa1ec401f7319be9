package com.arbiter.dispatch.api;

import com.arbiter.core.advisory.AdvisoryUnavailableException;
import com.arbiter.core.engine.DecisionEngineException;
import com.arbiter.core.engine.DuplicateClaimException;
import com.arbiter.core.gate.ClaimNotPendingException;
import com.arbiter.core.gate.MissingRationaleException;
import com.arbiter.core.governance.GovernanceException;
import com.arbiter.core.ledger.LedgerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline failures to JSON error bodies carrying the human-readable reason.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<Map<String, Object>> handleGovernance(GovernanceException ex) {
        Map<String, Object> body = buildBody(HttpStatus.UNPROCESSABLE_ENTITY, ex);
        body.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(MissingRationaleException.class)
    public ResponseEntity<Map<String, Object>> handleMissingRationale(MissingRationaleException ex) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler({DuplicateClaimException.class, ClaimNotPendingException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(DecisionEngineException ex) {
        return buildResponse(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(AdvisoryUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleAdvisory(AdvisoryUnavailableException ex) {
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleLedger(LedgerUnavailableException ex) {
        log.error("Ledger unavailable for claim {}: {}", ex.getClaimId(), ex.getMessage());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(DecisionEngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngine(DecisionEngineException ex) {
        log.error("Decision engine failure for claim {}", ex.getClaimId(), ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.internalServerError().body(body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected system error occurred.", null));
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, DecisionEngineException ex) {
        return ResponseEntity.status(status).body(buildBody(status, ex));
    }

    private Map<String, Object> buildBody(HttpStatus status, DecisionEngineException ex) {
        return body(status, ex.getErrorCode(), ex.getMessage(), ex.getClaimId());
    }

    private Map<String, Object> body(HttpStatus status, String code, String message, String claimId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error_code", code);
        body.put("message", message);
        if (claimId != null) {
            body.put("claim_id", claimId);
        }
        return body;
    }
}
