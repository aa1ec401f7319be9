package com.arbiter.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A claim that has passed capability validation.
 * <p>
 * Only {@link com.arbiter.core.governance.GovernanceValidator} builds these from
 * untrusted input; everything downstream of validation works with this type.
 */
public record ClaimInput(
    ClaimType claimType,
    BigDecimal damageAmount,
    boolean injuryInvolved,
    RiskFactor riskFactor
) implements Serializable {

    public static final String CLAIM_TYPE = "claim_type";
    public static final String DAMAGE_AMOUNT = "damage_amount";
    public static final String INJURY_INVOLVED = "injury_involved";
    public static final String RISK_FACTOR = "risk_factor";

    public ClaimInput {
        Objects.requireNonNull(claimType, "claimType");
        Objects.requireNonNull(damageAmount, "damageAmount");
        Objects.requireNonNull(riskFactor, "riskFactor");
        if (damageAmount.signum() < 0) {
            throw new IllegalArgumentException("damageAmount must be non-negative: " + damageAmount);
        }
    }

    /**
     * Field view keyed by the wire field names, in declaration order.
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CLAIM_TYPE, claimType.wireName());
        fields.put(DAMAGE_AMOUNT, damageAmount);
        fields.put(INJURY_INVOLVED, injuryInvolved);
        fields.put(RISK_FACTOR, riskFactor.wireName());
        return fields;
    }
}
