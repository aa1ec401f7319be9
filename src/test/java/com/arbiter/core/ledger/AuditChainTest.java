package com.arbiter.core.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditChainTest {

    private static AuditChain chain(AuditStage... stages) {
        List<AuditRecord> records = new ArrayList<>();
        long sequence = 10;
        for (AuditStage stage : stages) {
            records.add(new AuditRecord(sequence, "CLM-1", stage, "{}", Instant.EPOCH, "p", "h"));
            sequence += 3;
        }
        return new AuditChain("CLM-1", records);
    }

    @Test
    @DisplayName("full forward chain is valid and terminal")
    void finalizedChain() {
        AuditChain chain = chain(AuditStage.RECEIVED, AuditStage.VALIDATED, AuditStage.GOVERNED,
                AuditStage.ADVISED, AuditStage.HUMAN_CONFIRMED, AuditStage.FINALIZED);

        assertTrue(chain.isValid(), chain.violations()::toString);
        assertTrue(chain.isTerminal());
        assertFalse(chain.isPendingReview());
    }

    @Test
    @DisplayName("chain stopped at ADVISED is pending review")
    void pendingChain() {
        AuditChain chain = chain(AuditStage.RECEIVED, AuditStage.VALIDATED, AuditStage.GOVERNED, AuditStage.ADVISED);

        assertTrue(chain.isValid());
        assertTrue(chain.isPendingReview());
        assertFalse(chain.isTerminal());
    }

    @Test
    @DisplayName("rejection may follow any forward prefix")
    void rejectionAfterPrefix() {
        assertTrue(chain(AuditStage.RECEIVED, AuditStage.REJECTED).isValid());
        assertTrue(chain(AuditStage.RECEIVED, AuditStage.VALIDATED, AuditStage.GOVERNED, AuditStage.ADVISED,
                AuditStage.HUMAN_CONFIRMED, AuditStage.REJECTED).isValid());
    }

    @Test
    @DisplayName("skipped stage is a violation")
    void skippedStage() {
        AuditChain chain = chain(AuditStage.RECEIVED, AuditStage.GOVERNED);
        assertFalse(chain.isValid());
        assertTrue(chain.violations().get(0).contains("GOVERNED"));
    }

    @Test
    @DisplayName("records after REJECTED are a violation")
    void recordsAfterRejection() {
        assertFalse(chain(AuditStage.RECEIVED, AuditStage.REJECTED, AuditStage.VALIDATED).isValid());
        assertFalse(chain(AuditStage.REJECTED).isValid());
    }

    @Test
    @DisplayName("both FINALIZED and REJECTED is a violation")
    void bothTerminals() {
        assertFalse(chain(AuditStage.RECEIVED, AuditStage.VALIDATED, AuditStage.GOVERNED, AuditStage.ADVISED,
                AuditStage.HUMAN_CONFIRMED, AuditStage.FINALIZED, AuditStage.REJECTED).isValid());
    }

    @Test
    @DisplayName("non-increasing sequence numbers are a violation")
    void sequenceOrder() {
        AuditChain chain = new AuditChain("CLM-1", List.of(
                new AuditRecord(5, "CLM-1", AuditStage.RECEIVED, "{}", Instant.EPOCH, "p", "h"),
                new AuditRecord(5, "CLM-1", AuditStage.VALIDATED, "{}", Instant.EPOCH, "p", "h")));
        assertFalse(chain.isValid());
    }

    @Test
    @DisplayName("empty chain is valid but neither pending nor terminal")
    void emptyChain() {
        AuditChain chain = AuditChain.empty("CLM-1");
        assertTrue(chain.isValid());
        assertFalse(chain.isPendingReview());
        assertFalse(chain.isTerminal());
        assertTrue(chain.lastStage().isEmpty());
    }
}
