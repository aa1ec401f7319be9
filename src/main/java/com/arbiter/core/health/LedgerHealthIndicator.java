package com.arbiter.core.health;

import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.LedgerVerification;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the audit ledger. Reports DOWN when the hash
 * chain no longer verifies or the store cannot be read.
 */
@Component("ledgerHealthIndicator")
public class LedgerHealthIndicator implements HealthIndicator {

    private final AuditLedger ledger;

    public LedgerHealthIndicator(AuditLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Health health() {
        try {
            LedgerVerification verification = ledger.verify();
            if (verification.intact()) {
                return Health.up()
                        .withDetail("records", verification.recordsChecked())
                        .build();
            }
            return Health.down()
                    .withDetail("firstBrokenSequence", verification.firstBrokenSequence())
                    .withDetail("reason", verification.reason())
                    .build();
        } catch (Exception e) {
            return Health.down(e).build();
        }
    }
}
