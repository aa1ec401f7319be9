package com.arbiter.core.ledger;

/**
 * Outcome of recomputing the ledger's hash chain.
 *
 * @param intact              whether every record links correctly
 * @param recordsChecked      number of records verified before stopping
 * @param firstBrokenSequence sequence number of the first bad record, or {@code null}
 * @param reason              description of the first problem, or {@code null}
 */
public record LedgerVerification(
    boolean intact,
    int recordsChecked,
    Long firstBrokenSequence,
    String reason
) {

    public static LedgerVerification intact(int recordsChecked) {
        return new LedgerVerification(true, recordsChecked, null, null);
    }

    public static LedgerVerification broken(int recordsChecked, long sequence, String reason) {
        return new LedgerVerification(false, recordsChecked, sequence, reason);
    }
}
