package com.arbiter.core.ledger;

/**
 * A stage transition waiting to be appended. The ledger assigns its sequence
 * number, timestamp and hashes.
 *
 * @param claimId claim the transition belongs to
 * @param stage   stage being entered
 * @param payload JSON snapshot of the entity relevant to the stage
 */
public record AuditEntry(
    String claimId,
    AuditStage stage,
    String payload
) {

    public AuditEntry {
        if (claimId == null || claimId.isBlank()) {
            throw new IllegalArgumentException("Audit entry requires a claim id");
        }
        if (stage == null) {
            throw new IllegalArgumentException("Audit entry requires a stage");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Audit entry requires a payload snapshot");
        }
    }
}
