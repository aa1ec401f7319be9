package com.arbiter.core.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Every audit record of one claim, in sequence order.
 * <p>
 * A valid chain has strictly increasing sequence numbers, starts at
 * {@link AuditStage#RECEIVED}, follows {@link AuditStage#FORWARD_ORDER} without
 * gaps, and either stops there or ends with exactly one {@link AuditStage#REJECTED}.
 */
public record AuditChain(String claimId, List<AuditRecord> records) {

    public AuditChain {
        records = List.copyOf(records);
    }

    public static AuditChain empty(String claimId) {
        return new AuditChain(claimId, List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public List<AuditStage> stages() {
        return records.stream().map(AuditRecord::stage).toList();
    }

    public Optional<AuditStage> lastStage() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1).stage());
    }

    public boolean contains(AuditStage stage) {
        return records.stream().anyMatch(r -> r.stage() == stage);
    }

    /** Most recent record for a stage. */
    public Optional<AuditRecord> find(AuditStage stage) {
        for (int i = records.size() - 1; i >= 0; i--) {
            if (records.get(i).stage() == stage) {
                return Optional.of(records.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean isTerminal() {
        return lastStage().map(AuditStage::isTerminal).orElse(false);
    }

    /** Chain reached {@link AuditStage#ADVISED} and nothing has been recorded since. */
    public boolean isPendingReview() {
        return lastStage().map(stage -> stage == AuditStage.ADVISED).orElse(false);
    }

    public boolean isValid() {
        return violations().isEmpty();
    }

    /**
     * Describes every ordering problem in the chain. Empty when the chain is valid.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        long previousSequence = Long.MIN_VALUE;
        for (int i = 0; i < records.size(); i++) {
            AuditRecord record = records.get(i);
            if (!record.claimId().equals(claimId)) {
                problems.add("Record " + record.sequenceNumber() + " belongs to claim " + record.claimId());
            }
            if (record.sequenceNumber() <= previousSequence) {
                problems.add("Sequence number " + record.sequenceNumber() + " does not increase");
            }
            previousSequence = record.sequenceNumber();

            AuditStage stage = record.stage();
            boolean last = i == records.size() - 1;
            if (stage == AuditStage.REJECTED) {
                if (i == 0) {
                    problems.add("Chain cannot begin with REJECTED");
                } else if (!last) {
                    problems.add("REJECTED at position " + i + " is followed by further records");
                }
            } else if (i >= AuditStage.FORWARD_ORDER.size() || AuditStage.FORWARD_ORDER.get(i) != stage) {
                problems.add("Stage " + stage + " out of order at position " + i);
            }
        }
        return problems;
    }
}
