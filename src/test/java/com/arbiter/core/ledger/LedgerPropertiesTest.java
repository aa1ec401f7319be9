package com.arbiter.core.ledger;

import com.arbiter.core.advisory.AdvisoryProperties;
import com.arbiter.core.policy.PolicyProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LedgerPropertiesTest {

    @Test
    void ledgerDefaultsAreReasonable() {
        var props = new LedgerProperties();
        assertEquals("memory", props.getStore());
        assertEquals(Duration.ofSeconds(2), props.getAppendTimeout());
    }

    @Test
    void advisoryDefaultsAreReasonable() {
        var props = new AdvisoryProperties();
        assertEquals(Duration.ofSeconds(5), props.getTimeout());
        assertEquals(4, props.getWorkerThreads());
    }

    @Test
    void policyDefaultsPointAtBundledDocuments() {
        var props = new PolicyProperties();
        assertEquals("classpath:policy/capability-dictionary.yaml", props.getCapabilityDictionary());
        assertEquals("classpath:policy/decision-boundaries.yaml", props.getDecisionBoundaries());
    }
}
