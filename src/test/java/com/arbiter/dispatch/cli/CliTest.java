package com.arbiter.dispatch.cli;

import com.arbiter.core.ClaimFixtures;
import com.arbiter.core.advisory.RuleBasedAdvisoryModel;
import com.arbiter.core.advisory.TimeBoundedAdvisory;
import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.gate.HumanGate;
import com.arbiter.core.governance.GovernanceValidator;
import com.arbiter.core.health.HealthCheckService;
import com.arbiter.core.health.HealthStatus;
import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.AuditStage;
import com.arbiter.core.ledger.InMemoryAuditLedger;
import com.arbiter.core.ledger.LedgerVerification;
import com.arbiter.core.metrics.ArbiterMetrics;
import com.arbiter.core.model.RawClaimInput;
import com.arbiter.core.policy.GovernancePolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Arbiter CLI command structure.
 * Commands run through picocli directly, without a Spring context, against
 * a real engine over an in-memory ledger.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private GovernancePolicy policy;
    private AuditLedger ledger;
    private DecisionEngine engine;
    private HealthCheckService healthCheckService;
    private ExecutorService advisoryPool;

    @BeforeEach
    void setUp() {
        policy = ClaimFixtures.standardPolicy();
        ledger = new InMemoryAuditLedger();
        advisoryPool = Executors.newSingleThreadExecutor();
        TimeBoundedAdvisory advisory = new TimeBoundedAdvisory(new RuleBasedAdvisoryModel(policy.boundaries()),
                advisoryPool, Duration.ofSeconds(2));
        GovernanceValidator validator = new GovernanceValidator();
        engine = new DecisionEngine(policy, validator, advisory, new HumanGate(ledger, validator, policy), ledger,
                new EventBus(), new ArbiterMetrics(new SimpleMeterRegistry()));
        healthCheckService = new HealthCheckService(policy, ledger, advisory);
    }

    @AfterEach
    void tearDown() {
        advisoryPool.shutdownNow();
    }

    /**
     * Custom picocli IFactory that hands commands the test's components.
     */
    private CommandLine.IFactory createFactory(AuditLedger commandLedger, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == EvaluateCommand.class) {
                    return (K) new EvaluateCommand(engine);
                }
                if (cls == ChainCommand.class) {
                    return (K) new ChainCommand(engine);
                }
                if (cls == VerifyCommand.class) {
                    return (K) new VerifyCommand(commandLedger);
                }
                if (cls == PolicyCommand.class) {
                    return (K) new PolicyCommand(policy);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(ledger, healthCheckService, args);
    }

    private CliResult execute(AuditLedger commandLedger, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ArbiterCommand(), createFactory(commandLedger, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult evaluate(String claimId, String... verdict) {
        String[] base = {"evaluate", "--claim-id", claimId, "-t", "Auto", "-d", "15000", "--injury", "-r", "medium",
                "--decision-maker", "adjuster-7"};
        String[] args = new String[base.length + verdict.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(verdict, 0, args, base.length, verdict.length);
        return execute(args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("evaluate", "chain", "verify", "policy", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Arbiter 0.1.0"));
        }
    }

    @Nested
    @DisplayName("evaluate")
    class EvaluateTests {

        @Test
        @DisplayName("confirmed claim is finalized and its trail printed")
        void confirm() {
            CliResult result = evaluate("CLM-CLI-1", "--confirm", "--reason", "Matches adjuster report");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("High Severity (Advisory)"), result.output());
            assertTrue(result.output().contains("FINALIZED as High"), result.output());
            assertTrue(result.output().contains("This is an ADVISORY suggestion only"));
            assertEquals(AuditStage.FINALIZED, ledger.readChain("CLM-CLI-1").lastStage().orElseThrow());
        }

        @Test
        @DisplayName("rejected claim ends in REJECTED")
        void reject() {
            CliResult result = evaluate("CLM-CLI-2", "--reject", "--reason", "Insufficient evidence");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("REJECTED by adjuster-7"));
            assertEquals(AuditStage.REJECTED, ledger.readChain("CLM-CLI-2").lastStage().orElseThrow());
        }

        @Test
        @DisplayName("missing reason is a usage error and nothing is recorded")
        void missingReason() {
            CliResult result = evaluate("CLM-CLI-3", "--confirm");

            assertEquals(2, result.exitCode());
            assertTrue(ledger.readChain("CLM-CLI-3").isEmpty());
        }

        @Test
        @DisplayName("blank reason closes the claim instead of leaving it pending")
        void blankReason() {
            CliResult result = evaluate("CLM-CLI-7", "--confirm", "--reason", "  ");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("MISSING_RATIONALE"), result.output());
            assertEquals(AuditStage.REJECTED, ledger.readChain("CLM-CLI-7").lastStage().orElseThrow());
            assertTrue(ledger.readChain("CLM-CLI-7").isValid());
        }

        @Test
        @DisplayName("--field may not override a named option")
        void fieldOverridesNamedOption() {
            CliResult result = evaluate("CLM-CLI-8", "--confirm", "--reason", "ok", "--field", "risk_factor=low");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("risk_factor"), result.output());
            assertTrue(ledger.readChain("CLM-CLI-8").isEmpty());
        }

        @Test
        @DisplayName("an over-long claim id exits with the usage code")
        void overlongClaimId() {
            String claimId = "C".repeat(RawClaimInput.MAX_CLAIM_ID_LENGTH + 1);
            CliResult result = evaluate(claimId, "--confirm", "--reason", "ok");

            assertEquals(2, result.exitCode());
            assertTrue(ledger.readChain(claimId).isEmpty());
        }

        @Test
        @DisplayName("unknown field exits with the governance code")
        void unknownField() {
            CliResult result = evaluate("CLM-CLI-4", "--confirm", "--reason", "ok", "--field", "claimant_name=Doe");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("UNKNOWN_FIELD"), result.output());
        }

        @Test
        @DisplayName("confirm and reject together are a usage error")
        void bothVerdicts() {
            CliResult result = evaluate("CLM-CLI-5", "--confirm", "--reject", "--reason", "x");
            assertEquals(2, result.exitCode());
            assertTrue(ledger.readChain("CLM-CLI-5").isEmpty());
        }
    }

    @Nested
    @DisplayName("chain and verify")
    class LedgerCommands {

        @Test
        @DisplayName("chain prints a claim's records")
        void chain() {
            evaluate("CLM-CLI-6", "--confirm", "--reason", "ok");

            CliResult result = execute("chain", "CLM-CLI-6", "--payload");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("HUMAN_CONFIRMED"));
            assertTrue(result.output().contains("Stage order valid"));
        }

        @Test
        @DisplayName("chain of an unknown claim fails")
        void unknownChain() {
            assertEquals(1, execute("chain", "CLM-NOPE").exitCode());
        }

        @Test
        @DisplayName("verify succeeds on an intact ledger")
        void verifyIntact() {
            evaluate("CLM-CLI-7", "--confirm", "--reason", "ok");

            CliResult result = execute("verify");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Hash chain intact (6 records)"));
        }

        @Test
        @DisplayName("verify fails on a broken hash chain")
        void verifyBroken() {
            AuditLedger broken = mock(AuditLedger.class);
            when(broken.verify()).thenReturn(LedgerVerification.broken(2, 3L, "Record 3 content does not match its hash"));

            CliResult result = execute(broken, healthCheckService, "verify");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("broken at #3"));
        }
    }

    @Nested
    @DisplayName("policy and health")
    class Inspection {

        @Test
        @DisplayName("policy lists fields and rules")
        void policy() {
            CliResult result = execute("policy");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("damage_amount"));
            assertTrue(result.output().contains("catastrophic-damage"));
            assertTrue(result.output().contains("DISALLOWED"));
        }

        @Test
        @DisplayName("health reports all components")
        void healthUp() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("health exits non-zero when a component is down")
        void healthDown() {
            HealthCheckService failing = mock(HealthCheckService.class);
            when(failing.checkAll()).thenReturn(List.of(
                    new HealthStatus("ledger", HealthStatus.Status.DOWN, "Hash chain broken", Map.of())));

            CliResult result = execute(ledger, failing, "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("ledger: Hash chain broken"));
        }
    }
}
