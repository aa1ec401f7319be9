package com.arbiter.dispatch.cli;

import com.arbiter.core.gate.DecisionContext;
import com.arbiter.core.ledger.AuditRecord;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.Severity;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Arbiter CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARBITER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ARBITER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Renders a pending claim the way a reviewer sees it before deciding.
     */
    public static void pending(DecisionContext context) {
        AdvisorySuggestion suggestion = context.suggestion();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ADVISORY ONLY - HUMAN CONFIRMATION REQUIRED|@"));
        System.out.println("  Claim:      " + context.claimId());
        System.out.println("  Suggestion: " + suggestion.displayLabel());
        System.out.println(String.format(Locale.ROOT, "  Confidence: %.4f (%.2f%%)",
                suggestion.confidence(), suggestion.confidence() * 100));
        System.out.println("  Reference:  " + context.reference().category().label()
                + " (" + context.reference().rationale() + ")");

        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Rule signals|@"));
        for (String signal : suggestion.ruleSignals()) {
            System.out.println("  " + signal);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Feature importance|@"));
        for (Map.Entry<String, Double> entry : suggestion.featureImportance().entrySet()) {
            System.out.println(String.format(Locale.ROOT, "  %s: %.1f%%", entry.getKey(), entry.getValue()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Uncertainty|@"));
        System.out.println(String.format(Locale.ROOT, "  %s (normalized entropy %.4f): %s",
                suggestion.uncertaintyLevel(), suggestion.uncertainty(),
                suggestion.uncertaintyLevel().interpretation()));
        for (Map.Entry<Severity, Double> entry : suggestion.confidenceDistribution().entrySet()) {
            System.out.println(String.format(Locale.ROOT, "    %s: %.4f", entry.getKey().label(), entry.getValue()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Governance reminders|@"));
        for (String reminder : context.reminders()) {
            System.out.println("  " + reminder);
        }
    }

    public static void auditRecord(AuditRecord record) {
        String stageColor = switch (record.stage()) {
            case FINALIZED -> "fg(green),bold";
            case REJECTED -> "fg(red),bold";
            case HUMAN_CONFIRMED -> "fg(magenta)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  #%-6d @|%s %-16s|@ %s  %s", record.sequenceNumber(), stageColor, record.stage(),
                record.timestamp(), abbreviate(record.hash()))));
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) + "…" : hash;
    }
}
