package com.arbiter.core.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash chaining that makes the ledger tamper-evident: each record's hash
 * covers its own content and the previous record's hash, so editing,
 * reordering or deleting any record breaks every hash after it.
 */
public final class AuditHashing {

    public static final String GENESIS = "0".repeat(64);

    private AuditHashing() {}

    public static String hash(String previousHash, long sequenceNumber, String claimId,
                              AuditStage stage, String payload, Instant timestamp) {
        String material = previousHash + '\n' + sequenceNumber + '\n' + claimId + '\n'
                + stage.name() + '\n' + timestamp + '\n' + payload;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hashOf(AuditRecord record) {
        return hash(record.previousHash(), record.sequenceNumber(), record.claimId(),
                record.stage(), record.payload(), record.timestamp());
    }

    /**
     * Walks the whole ledger in sequence order and recomputes every link.
     */
    public static LedgerVerification verify(List<AuditRecord> records) {
        String expectedPrevious = GENESIS;
        long lastSequence = Long.MIN_VALUE;
        int checked = 0;
        for (AuditRecord record : records) {
            if (record.sequenceNumber() <= lastSequence) {
                return LedgerVerification.broken(checked, record.sequenceNumber(),
                        "Sequence number " + record.sequenceNumber() + " does not increase");
            }
            if (!expectedPrevious.equals(record.previousHash())) {
                return LedgerVerification.broken(checked, record.sequenceNumber(),
                        "Record " + record.sequenceNumber() + " does not link to its predecessor");
            }
            if (!hashOf(record).equals(record.hash())) {
                return LedgerVerification.broken(checked, record.sequenceNumber(),
                        "Record " + record.sequenceNumber() + " content does not match its hash");
            }
            expectedPrevious = record.hash();
            lastSequence = record.sequenceNumber();
            checked++;
        }
        return LedgerVerification.intact(checked);
    }
}
