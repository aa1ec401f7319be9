package com.arbiter.core.advisory;

import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.RiskFactor;
import com.arbiter.core.model.Severity;
import com.arbiter.core.policy.BoundaryThresholds;
import com.arbiter.core.policy.DecisionBoundarySpec;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic advisory model built directly on the frozen boundary thresholds.
 * <p>
 * The claim's severity score places it in a LOW, MEDIUM or HIGH band. The
 * confidence distribution is a softmax over each band's distance from the
 * score, so claims near a band edge split their probability between the two
 * neighbouring bands and report high uncertainty. Rule signals and feature
 * importance explain which factors drove the score.
 */
public class RuleBasedAdvisoryModel implements AdvisoryModel {

    public static final String MODEL_ID = "rule-based-severity";

    private static final double ENTROPY_EPSILON = 1e-10;

    private final DecisionBoundarySpec boundaries;

    public RuleBasedAdvisoryModel(DecisionBoundarySpec boundaries) {
        this.boundaries = boundaries;
    }

    @Override
    public AdvisorySuggestion suggest(ClaimInput input) {
        BoundaryThresholds thresholds = boundaries.thresholds();
        double score = thresholds.severityScore(input);
        Severity category = thresholds.categoryForScore(score);

        Map<Severity, Double> distribution = distribution(score, thresholds);
        double confidence = distribution.get(category);
        double uncertainty = normalizedEntropy(distribution);

        List<String> signals = ruleSignals(input, thresholds);
        signals.add(String.format(Locale.ROOT, "Severity score %.2f (Low < %s, Medium < %s)",
                score, trim(thresholds.severityLow()), trim(thresholds.severityMedium())));

        return AdvisorySuggestion.advisory(category, confidence, signals, uncertainty,
                distribution, featureImportance(input, thresholds), MODEL_ID, modelVersion());
    }

    @Override
    public String modelId() {
        return MODEL_ID;
    }

    @Override
    public String modelVersion() {
        return boundaries.version();
    }

    /**
     * Human-readable reasons, one per input factor, in a fixed order.
     */
    List<String> ruleSignals(ClaimInput input, BoundaryThresholds thresholds) {
        List<String> signals = new ArrayList<>();
        BigDecimal damage = input.damageAmount();
        String amount = money(damage);

        if (damage.compareTo(thresholds.damageLow()) < 0) {
            signals.add("✓ Low damage (<" + money(thresholds.damageLow()) + "): " + amount);
        } else if (damage.compareTo(thresholds.damageMedium()) < 0) {
            signals.add("⚠ Medium damage (" + money(thresholds.damageLow()) + "-"
                    + money(thresholds.damageMedium()) + "): " + amount);
        } else if (damage.compareTo(thresholds.damageHigh()) < 0) {
            signals.add("⚠⚠ High damage (" + money(thresholds.damageMedium()) + "-"
                    + money(thresholds.damageHigh()) + "): " + amount);
        } else {
            signals.add("⚠⚠⚠ Very high damage (≥" + money(thresholds.damageHigh()) + "): " + amount);
        }

        if (input.injuryInvolved()) {
            signals.add("⚠ Injury involved (multiplier: " + trim(thresholds.injuryMultiplier()) + "x)");
        } else {
            signals.add("✓ No injury involved");
        }

        RiskFactor risk = input.riskFactor();
        String weight = trim(thresholds.riskWeight(risk));
        switch (risk) {
            case HIGH -> signals.add("⚠⚠ High risk factor (weight: " + weight + "x)");
            case MEDIUM -> signals.add("⚠ Medium risk factor (weight: " + weight + "x)");
            case LOW -> signals.add("✓ Low risk factor (weight: " + weight + "x)");
        }

        if (input.claimType() == ClaimType.LIABILITY) {
            signals.add("⚠ Liability claim (multiplier: " + trim(thresholds.liabilityMultiplier()) + "x)");
        } else {
            signals.add("Claim type: " + input.claimType().wireName());
        }
        return signals;
    }

    private Map<Severity, Double> distribution(double score, BoundaryThresholds thresholds) {
        double temperature = (thresholds.severityMedium() - thresholds.severityLow()) / 4.0;
        Map<Severity, Double> logits = new EnumMap<>(Severity.class);
        logits.put(Severity.LOW, -Math.max(0.0, score - thresholds.severityLow()) / temperature);
        logits.put(Severity.MEDIUM, -bandDistance(score, thresholds.severityLow(), thresholds.severityMedium()) / temperature);
        logits.put(Severity.HIGH, -Math.max(0.0, thresholds.severityMedium() - score) / temperature);

        double max = logits.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double sum = 0.0;
        Map<Severity, Double> exp = new EnumMap<>(Severity.class);
        for (Map.Entry<Severity, Double> entry : logits.entrySet()) {
            double value = Math.exp(entry.getValue() - max);
            exp.put(entry.getKey(), value);
            sum += value;
        }
        Map<Severity, Double> probabilities = new EnumMap<>(Severity.class);
        for (Map.Entry<Severity, Double> entry : exp.entrySet()) {
            probabilities.put(entry.getKey(), entry.getValue() / sum);
        }
        return probabilities;
    }

    private static double bandDistance(double score, double lower, double upper) {
        if (score < lower) {
            return lower - score;
        }
        if (score >= upper) {
            return score - upper;
        }
        return 0.0;
    }

    static double normalizedEntropy(Map<Severity, Double> distribution) {
        double entropy = 0.0;
        for (double p : distribution.values()) {
            entropy -= p * Math.log(p + ENTROPY_EPSILON);
        }
        double maxEntropy = Math.log(distribution.size());
        if (maxEntropy <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, entropy / maxEntropy));
    }

    /**
     * Share of the (log-scale) severity score contributed by each input field, in percent,
     * ordered from most to least influential.
     */
    private Map<String, Double> featureImportance(ClaimInput input, BoundaryThresholds thresholds) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        contributions.put(ClaimInput.DAMAGE_AMOUNT,
                Math.log1p(input.damageAmount().doubleValue() / 1000.0));
        contributions.put(ClaimInput.RISK_FACTOR,
                Math.abs(Math.log(thresholds.riskWeight(input.riskFactor()))));
        contributions.put(ClaimInput.INJURY_INVOLVED,
                input.injuryInvolved() ? Math.abs(Math.log(thresholds.injuryMultiplier())) : 0.0);
        contributions.put(ClaimInput.CLAIM_TYPE,
                input.claimType() == ClaimType.LIABILITY ? Math.abs(Math.log(thresholds.liabilityMultiplier())) : 0.0);

        double total = contributions.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> shares = new LinkedHashMap<>();
        contributions.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> shares.put(e.getKey(),
                        total > 0.0 ? e.getValue() / total * 100.0 : 100.0 / contributions.size()));
        return shares;
    }

    private static String money(BigDecimal amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    private static String trim(double value) {
        return value == Math.rint(value)
                ? String.format(Locale.ROOT, "%.1f", value)
                : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
