package com.arbiter.core.policy;

import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.RiskFactor;
import com.arbiter.core.model.Severity;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One frozen boundary rule: a predicate over {@link ClaimInput} mapped to a
 * reference category and the rationale shown to reviewers.
 * <p>
 * Every condition is optional; an unset condition matches anything. Damage
 * bounds are {@code minDamage <= amount < maxDamage}.
 */
public record BoundaryRule(
    String id,
    Set<ClaimType> claimTypes,
    BigDecimal minDamage,
    BigDecimal maxDamage,
    Boolean injuryInvolved,
    Set<RiskFactor> riskFactors,
    Severity category,
    String rationale
) {

    public BoundaryRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Boundary rule must have an id");
        }
        if (category == null) {
            throw new IllegalArgumentException("Boundary rule " + id + " must declare a category");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("Boundary rule " + id + " must carry a rationale");
        }
        claimTypes = claimTypes == null || claimTypes.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(claimTypes));
        riskFactors = riskFactors == null || riskFactors.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(riskFactors));
    }

    public boolean matches(ClaimInput input) {
        if (!claimTypes.isEmpty() && !claimTypes.contains(input.claimType())) {
            return false;
        }
        if (minDamage != null && input.damageAmount().compareTo(minDamage) < 0) {
            return false;
        }
        if (maxDamage != null && input.damageAmount().compareTo(maxDamage) >= 0) {
            return false;
        }
        if (injuryInvolved != null && injuryInvolved != input.injuryInvolved()) {
            return false;
        }
        return riskFactors.isEmpty() || riskFactors.contains(input.riskFactor());
    }
}
