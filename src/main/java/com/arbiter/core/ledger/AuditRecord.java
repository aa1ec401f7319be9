package com.arbiter.core.ledger;

import java.io.Serializable;
import java.time.Instant;

/**
 * An appended, immutable audit record.
 *
 * @param sequenceNumber global, strictly increasing position in the ledger
 * @param claimId        claim the record belongs to
 * @param stage          stage entered
 * @param payload        JSON snapshot written with the record
 * @param timestamp      when the ledger accepted the record
 * @param previousHash   hash of the preceding record in the ledger ({@link AuditHashing#GENESIS} for the first)
 * @param hash           SHA-256 over this record's content and {@code previousHash}
 */
public record AuditRecord(
    long sequenceNumber,
    String claimId,
    AuditStage stage,
    String payload,
    Instant timestamp,
    String previousHash,
    String hash
) implements Serializable {}
