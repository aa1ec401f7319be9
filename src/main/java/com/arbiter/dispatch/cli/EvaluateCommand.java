package com.arbiter.dispatch.cli;

import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.engine.DecisionEngineException;
import com.arbiter.core.gate.Decision;
import com.arbiter.core.gate.DecisionResult;
import com.arbiter.core.gate.RejectedDecision;
import com.arbiter.core.governance.GovernanceException;
import com.arbiter.core.ledger.AuditRecord;
import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.HumanConfirmation;
import com.arbiter.core.model.RawClaimInput;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: arbiter evaluate --claim-type Auto --damage 15000 --injury --risk medium
 * --decision-maker adjuster-7 --confirm --reason "..."
 * <p>
 * Runs one claim end to end. The verdict and rationale come from the options;
 * the pending suggestion is printed before the verdict is applied. A claim
 * whose verdict cannot be recorded is closed as REJECTED by the engine.
 */
@Command(name = "evaluate", mixinStandardHelpOptions = true,
        description = "Evaluate a claim and record the reviewer's verdict")
@Component
public class EvaluateCommand implements Callable<Integer> {

    @Option(names = "--claim-id", description = "Claim id (generated when omitted)")
    private String claimId;

    @Option(names = {"--claim-type", "-t"}, required = true, description = "Auto, Property, Health or Liability")
    private String claimType;

    @Option(names = {"--damage", "-d"}, required = true, description = "Damage amount")
    private String damage;

    @Option(names = "--injury", description = "Injury involved")
    private boolean injury;

    @Option(names = {"--risk", "-r"}, required = true, description = "low, medium or high")
    private String risk;

    @Option(names = "--field", description = "Additional input field as key=value (checked against the dictionary)")
    private Map<String, String> extraFields = new LinkedHashMap<>();

    @Option(names = "--decision-maker", required = true, description = "Accountable reviewer id")
    private String decisionMaker;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Verdict verdict;

    @Option(names = "--reason", required = true, description = "Reviewer's rationale")
    private String reason;

    static class Verdict {
        @Option(names = "--confirm", required = true, description = "Accept the advisory suggestion")
        boolean confirm;

        @Option(names = "--reject", required = true, description = "Reject the advisory suggestion")
        boolean reject;
    }

    /** Fields owned by the named options; {@code --field} may not set them. */
    private static final Set<String> NAMED_FIELDS = Set.of(
            ClaimInput.CLAIM_TYPE, ClaimInput.DAMAGE_AMOUNT, ClaimInput.INJURY_INVOLVED, ClaimInput.RISK_FACTOR);

    private final DecisionEngine decisionEngine;

    public EvaluateCommand(DecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        for (String key : extraFields.keySet()) {
            if (NAMED_FIELDS.contains(key)) {
                ConsoleOutput.error("--field " + key + " conflicts with its named option");
                return 2;
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ClaimInput.CLAIM_TYPE, claimType);
        fields.put(ClaimInput.DAMAGE_AMOUNT, damage);
        fields.put(ClaimInput.INJURY_INVOLVED, injury);
        fields.put(ClaimInput.RISK_FACTOR, risk);
        fields.putAll(extraFields);

        RawClaimInput raw;
        try {
            raw = new RawClaimInput(claimId, fields);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        DecisionResult result;
        try {
            result = decisionEngine.makeDecision(raw, context -> {
                ConsoleOutput.pending(context);
                System.out.println("──────────────────────────────────");
                return new HumanConfirmation(verdict.confirm, reason, decisionMaker, Instant.now());
            });
        } catch (GovernanceException e) {
            ConsoleOutput.error("Governance rejected claim [" + e.getErrorCode() + "] "
                    + (e.getField() != null ? e.getField() + ": " : "") + e.getMessage());
            return 2;
        } catch (DecisionEngineException e) {
            ConsoleOutput.error("[" + e.getErrorCode() + "] " + e.getMessage());
            return 1;
        }

        if (result instanceof Decision decision) {
            ConsoleOutput.success("Claim " + decision.claimId() + " FINALIZED as " + decision.category().label()
                    + " by " + decision.confirmation().decisionMakerId());
        } else if (result instanceof RejectedDecision rejected) {
            ConsoleOutput.warn("Claim " + rejected.claimId() + " REJECTED by " + rejected.rejectedBy()
                    + ": " + rejected.rationale());
        }
        ConsoleOutput.info("Audit trail:");
        for (AuditRecord record : result.auditChain().records()) {
            ConsoleOutput.auditRecord(record);
        }
        return 0;
    }
}
