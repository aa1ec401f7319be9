package com.arbiter.dispatch.cli;

import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.LedgerVerification;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: arbiter verify
 * <p>
 * Recomputes the ledger hash chain and every claim's stage order.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Verify the audit ledger")
@Component
public class VerifyCommand implements Callable<Integer> {

    private final AuditLedger ledger;

    public VerifyCommand(AuditLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        LedgerVerification verification = ledger.verify();
        if (!verification.intact()) {
            ConsoleOutput.error("Hash chain broken at #" + verification.firstBrokenSequence()
                    + ": " + verification.reason());
            return 1;
        }
        ConsoleOutput.success("Hash chain intact (" + verification.recordsChecked() + " records)");

        int invalid = 0;
        for (String claimId : ledger.claimIds()) {
            var chain = ledger.readChain(claimId);
            if (!chain.isValid()) {
                invalid++;
                ConsoleOutput.error(claimId + ": " + String.join("; ", chain.violations()));
            }
        }
        if (invalid > 0) {
            ConsoleOutput.error(invalid + " claim chain(s) out of order");
            return 1;
        }
        ConsoleOutput.success("All claim chains in canonical order");
        return 0;
    }
}
