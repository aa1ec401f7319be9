package com.arbiter.core.ledger;

import java.util.List;

/**
 * Append-only, hash-chained store of stage transitions.
 * <p>
 * There is no update or delete. {@link #append} either makes the record
 * durable and returns its sequence number, or throws
 * {@link LedgerUnavailableException} and nothing is written.
 * Sequence numbers are unique and strictly increasing across all claims,
 * including under concurrent appends.
 */
public interface AuditLedger {

    /**
     * @return the sequence number assigned to the new record
     * @throws LedgerUnavailableException if the record could not be made durable in time
     */
    long append(AuditEntry entry);

    /** Records for one claim in sequence order; empty chain when the claim is unknown. */
    AuditChain readChain(String claimId);

    /** Up to {@code limit} records with sequence number {@code >= fromSequence}, in order. */
    List<AuditRecord> readFrom(long fromSequence, int limit);

    /** Distinct claim ids in order of first appearance. */
    List<String> claimIds();

    /** Total number of records. */
    long size();

    /** Recomputes the full hash chain. */
    LedgerVerification verify();
}
