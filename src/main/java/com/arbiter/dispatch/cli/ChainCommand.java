package com.arbiter.dispatch.cli;

import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.ledger.AuditChain;
import com.arbiter.core.ledger.AuditRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: arbiter chain &lt;claimId&gt;
 * <p>
 * Prints a claim's audit records and whether their stage order is valid.
 */
@Command(name = "chain", mixinStandardHelpOptions = true, description = "Show a claim's audit trail")
@Component
public class ChainCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Claim id")
    private String claimId;

    @Option(names = "--payload", description = "Include each record's JSON payload")
    private boolean showPayload;

    private final DecisionEngine decisionEngine;

    public ChainCommand(DecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AuditChain chain = decisionEngine.readChain(claimId);
        if (chain.isEmpty()) {
            ConsoleOutput.error("No audit records for claim " + claimId);
            return 1;
        }
        ConsoleOutput.info("Claim " + claimId + " (" + chain.size() + " records)");
        for (AuditRecord record : chain.records()) {
            ConsoleOutput.auditRecord(record);
            if (showPayload) {
                System.out.println("           " + record.payload());
            }
        }
        if (chain.isValid()) {
            ConsoleOutput.success("Stage order valid");
            return 0;
        }
        chain.violations().forEach(ConsoleOutput::error);
        return 1;
    }
}
