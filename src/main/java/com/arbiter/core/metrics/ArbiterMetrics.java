package com.arbiter.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the decision pipeline.
 */
@Service
public class ArbiterMetrics {

    private final MeterRegistry registry;

    public ArbiterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClaimSubmitted() {
        Counter.builder("arbiter.claims.submitted")
                .description("Claims entering the pipeline")
                .register(registry)
                .increment();
    }

    /**
     * @param reason governance error code, e.g. {@code UNKNOWN_FIELD}
     */
    public void recordGovernanceRejection(String reason) {
        Counter.builder("arbiter.governance.rejections")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAdvisoryDuration(long ms) {
        Timer.builder("arbiter.advisory.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAdvisoryFailure() {
        Counter.builder("arbiter.advisory.failures")
                .description("Advisory model failures and timeouts")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "finalized", "rejected" or "abandoned"
     */
    public void recordDecision(String outcome) {
        Counter.builder("arbiter.decisions.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordLedgerAppend(long ms) {
        Timer.builder("arbiter.ledger.append.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
