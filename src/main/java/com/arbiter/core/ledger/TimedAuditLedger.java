package com.arbiter.core.ledger;

import com.arbiter.core.metrics.ArbiterMetrics;

import java.util.List;

/**
 * Records append latency for whichever ledger backend is configured.
 */
public class TimedAuditLedger implements AuditLedger {

    private final AuditLedger delegate;
    private final ArbiterMetrics metrics;

    public TimedAuditLedger(AuditLedger delegate, ArbiterMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public long append(AuditEntry entry) {
        long start = System.nanoTime();
        try {
            return delegate.append(entry);
        } finally {
            metrics.recordLedgerAppend((System.nanoTime() - start) / 1_000_000);
        }
    }

    @Override
    public AuditChain readChain(String claimId) {
        return delegate.readChain(claimId);
    }

    @Override
    public List<AuditRecord> readFrom(long fromSequence, int limit) {
        return delegate.readFrom(fromSequence, limit);
    }

    @Override
    public List<String> claimIds() {
        return delegate.claimIds();
    }

    @Override
    public long size() {
        return delegate.size();
    }

    @Override
    public LedgerVerification verify() {
        return delegate.verify();
    }

    public AuditLedger delegate() {
        return delegate;
    }
}
