package com.arbiter.dispatch.api;

import com.arbiter.core.ledger.AuditRecord;
import com.arbiter.core.ledger.AuditStage;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * Audit record as returned by the API; the payload is embedded as JSON rather than a string.
 */
public record AuditRecordView(
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("claim_id") String claimId,
    AuditStage stage,
    @JsonRawValue String payload,
    Instant timestamp,
    @JsonProperty("previous_hash") String previousHash,
    String hash
) {

    public static AuditRecordView of(AuditRecord record) {
        return new AuditRecordView(record.sequenceNumber(), record.claimId(), record.stage(), record.payload(),
                record.timestamp(), record.previousHash(), record.hash());
    }
}
