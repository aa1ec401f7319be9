package com.arbiter.core.policy;

import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.RiskFactor;
import com.arbiter.core.model.Severity;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frozen numeric boundaries used to score claim severity.
 * <p>
 * The severity score is {@code damage / 1000 x riskWeight x injuryMultiplier x liabilityMultiplier},
 * where the two multipliers only apply when the claim involves an injury or is a
 * liability claim. Scores below {@code severityLow} are LOW, below {@code severityMedium}
 * MEDIUM, and HIGH otherwise.
 *
 * @param damageLow           upper bound of the low damage band
 * @param damageMedium        upper bound of the medium damage band
 * @param damageHigh          upper bound of the high damage band; anything above is "very high"
 * @param riskWeights         weight per risk factor wire name ({@code low}, {@code medium}, {@code high})
 * @param injuryMultiplier    multiplier applied when an injury is involved
 * @param liabilityMultiplier multiplier applied to liability claims
 * @param severityLow         score below which a claim is LOW severity
 * @param severityMedium      score below which a claim is MEDIUM severity
 */
public record BoundaryThresholds(
    BigDecimal damageLow,
    BigDecimal damageMedium,
    BigDecimal damageHigh,
    Map<String, Double> riskWeights,
    double injuryMultiplier,
    double liabilityMultiplier,
    double severityLow,
    double severityMedium
) {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    public BoundaryThresholds {
        if (damageLow == null || damageMedium == null || damageHigh == null) {
            throw new IllegalArgumentException("All damage thresholds must be declared");
        }
        if (damageLow.compareTo(damageMedium) >= 0 || damageMedium.compareTo(damageHigh) >= 0) {
            throw new IllegalArgumentException("Damage thresholds must be strictly increasing: "
                    + damageLow + ", " + damageMedium + ", " + damageHigh);
        }
        if (injuryMultiplier <= 0 || liabilityMultiplier <= 0) {
            throw new IllegalArgumentException("Multipliers must be positive");
        }
        if (severityLow >= severityMedium) {
            throw new IllegalArgumentException("severityLow must be below severityMedium");
        }
        riskWeights = riskWeights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(riskWeights));
        for (RiskFactor factor : RiskFactor.values()) {
            if (!riskWeights.containsKey(factor.wireName())) {
                throw new IllegalArgumentException("Missing risk weight for " + factor.wireName());
            }
        }
    }

    /**
     * The boundaries of the original claims-advisory model.
     */
    public static BoundaryThresholds defaults() {
        return new BoundaryThresholds(
                BigDecimal.valueOf(5000), BigDecimal.valueOf(15000), BigDecimal.valueOf(50000),
                Map.of("low", 1.0, "medium", 1.5, "high", 2.0),
                1.8, 1.25, 5, 15);
    }

    public double riskWeight(RiskFactor factor) {
        return riskWeights.get(factor.wireName());
    }

    public double severityScore(ClaimInput input) {
        double score = input.damageAmount().divide(THOUSAND, MathContext.DECIMAL64).doubleValue();
        score *= riskWeight(input.riskFactor());
        if (input.injuryInvolved()) {
            score *= injuryMultiplier;
        }
        if (input.claimType() == ClaimType.LIABILITY) {
            score *= liabilityMultiplier;
        }
        return score;
    }

    public Severity categoryForScore(double score) {
        if (score < severityLow) {
            return Severity.LOW;
        }
        if (score < severityMedium) {
            return Severity.MEDIUM;
        }
        return Severity.HIGH;
    }
}
