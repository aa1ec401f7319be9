package com.arbiter.integration;

import com.arbiter.core.ClaimFixtures;
import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.gate.DecisionResult;
import com.arbiter.core.gate.DecisionState;
import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.AuditStage;
import com.arbiter.core.ledger.JdbcAuditLedger;
import com.arbiter.core.ledger.TimedAuditLedger;
import com.arbiter.core.model.HumanConfirmation;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full application context with the JDBC ledger on an in-memory H2 database.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:arbiter-it;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password="
})
@ActiveProfiles("jdbc")
class JdbcLedgerIntegrationTest {

    @Autowired
    private DecisionEngine decisionEngine;

    @Autowired
    private AuditLedger ledger;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void wiresTimedJdbcLedger() {
        TimedAuditLedger timed = assertInstanceOf(TimedAuditLedger.class, ledger);
        assertInstanceOf(JdbcAuditLedger.class, timed.delegate());
    }

    @Test
    void claimIsFinalizedThroughTheDatabase() {
        DecisionResult result = decisionEngine.makeDecision(ClaimFixtures.autoInjuryClaim("CLM-IT-1"),
                context -> HumanConfirmation.accept("adjuster-7", "Consistent with the report", Instant.now()));

        assertEquals(DecisionState.FINALIZED, result.state());
        assertEquals(AuditStage.FINALIZED, ledger.readChain("CLM-IT-1").lastStage().orElseThrow());
        assertTrue(ledger.verify().intact());
        assertTrue(meterRegistry.get("arbiter.ledger.append.duration").timer().count() > 0);
    }
}
