package com.arbiter.dispatch.cli;

import com.arbiter.core.model.ClaimType;
import com.arbiter.core.policy.BoundaryRule;
import com.arbiter.core.policy.CapabilityDictionary;
import com.arbiter.core.policy.DecisionBoundarySpec;
import com.arbiter.core.policy.GovernancePolicy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: arbiter policy
 * <p>
 * Shows the loaded capability dictionary and decision boundaries.
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show the loaded governance policy")
@Component
public class PolicyCommand implements Runnable {

    private final GovernancePolicy policy;

    public PolicyCommand(GovernancePolicy policy) {
        this.policy = policy;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        CapabilityDictionary dictionary = policy.dictionary();
        ConsoleOutput.info("Capability dictionary " + dictionary.version()
                + " (sha256 " + policy.dictionaryFingerprint().substring(0, 12) + ")");
        dictionary.fields().forEach((name, field) -> System.out.printf("  %-18s %-8s %s%s%n",
                name, field.type(), field.allowed() ? field.describeDomain() : "DISALLOWED",
                field.required() ? " (required)" : ""));
        for (ClaimType type : ClaimType.values()) {
            System.out.printf("  %-18s %s%n", type.wireName() + " actions", dictionary.permittedActions(type));
        }

        DecisionBoundarySpec boundaries = policy.boundaries();
        System.out.println();
        ConsoleOutput.info("Decision boundaries " + boundaries.version()
                + " (sha256 " + policy.boundariesFingerprint().substring(0, 12) + ")"
                + ", max deviation " + boundaries.maxCategoryDeviation());
        for (BoundaryRule rule : boundaries.rules()) {
            System.out.printf("  %-24s -> %-6s %s%n", rule.id(), rule.category().label(), rule.rationale());
        }
    }
}
