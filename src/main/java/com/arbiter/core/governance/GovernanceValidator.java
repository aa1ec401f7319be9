package com.arbiter.core.governance;

import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.GovernanceStatus;
import com.arbiter.core.model.RawClaimInput;
import com.arbiter.core.model.RiskFactor;
import com.arbiter.core.model.Severity;
import com.arbiter.core.model.UncertaintyLevel;
import com.arbiter.core.policy.BoundaryReference;
import com.arbiter.core.policy.CapabilityDictionary;
import com.arbiter.core.policy.DecisionBoundarySpec;
import com.arbiter.core.policy.FieldCapability;
import com.arbiter.core.policy.GovernancePolicy;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Checks claim input and advisory output against the capability dictionary
 * and the decision boundary spec.
 * <p>
 * Every method is a pure function of its arguments: it either returns the
 * validated value or throws a {@link GovernanceException} naming the first
 * violation. Nothing is corrected or defaulted.
 * <p>
 * The pipeline calls it twice per claim: on the raw input before the
 * advisory model runs ({@link #validateInput} and {@link #governInput}), and
 * on the model's output before a human sees it ({@link #validateSuggestion}).
 */
@Service
public class GovernanceValidator {

    /**
     * Validates untrusted field values and builds the typed claim.
     *
     * @throws UnknownFieldException if a field is undeclared or not allowed
     * @throws OutOfRangeException   if a value is missing, mistyped or outside its domain
     */
    public ClaimInput validateInput(String claimId, RawClaimInput raw, CapabilityDictionary dictionary) {
        Map<String, Object> fields = raw.fields();

        for (String name : fields.keySet()) {
            if (dictionary.field(name).isEmpty()) {
                throw new UnknownFieldException(claimId, name,
                        "Field '" + name + "' is not declared in capability dictionary " + dictionary.version());
            }
            if (!dictionary.isFieldAllowed(name)) {
                throw new UnknownFieldException(claimId, name,
                        "Field '" + name + "' is not permitted by capability dictionary " + dictionary.version());
            }
        }

        for (Map.Entry<String, FieldCapability> declared : dictionary.fields().entrySet()) {
            FieldCapability capability = declared.getValue();
            if (capability.allowed() && capability.required() && fields.get(declared.getKey()) == null) {
                throw new OutOfRangeException(claimId, declared.getKey(),
                        "Required field '" + declared.getKey() + "' is missing");
            }
        }

        Map<String, Object> typed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            FieldCapability capability = dictionary.field(entry.getKey()).orElseThrow();
            typed.put(entry.getKey(), coerce(claimId, entry.getKey(), entry.getValue(), capability));
        }

        return toClaimInput(claimId, typed);
    }

    /**
     * Places a validated claim inside its governance envelope: the advisory
     * actions permitted for its claim type and the boundary reference category.
     *
     * @throws BoundaryViolationException if no permitted action can satisfy the boundaries
     */
    public GovernedInput governInput(String claimId, ClaimInput input, GovernancePolicy policy) {
        CapabilityDictionary dictionary = policy.dictionary();
        DecisionBoundarySpec boundaries = policy.boundaries();

        Set<Severity> permitted = dictionary.permittedActions(input.claimType());
        if (permitted.isEmpty()) {
            throw new BoundaryViolationException(claimId, ClaimInput.CLAIM_TYPE,
                    "No advisory action is permitted for " + input.claimType().wireName() + " claims");
        }

        BoundaryReference reference = boundaries.reference(input);
        boolean reachable = permitted.stream()
                .anyMatch(action -> boundaries.withinDeviation(action, reference.category()));
        if (!reachable) {
            throw new BoundaryViolationException(claimId, ClaimInput.CLAIM_TYPE,
                    "No permitted advisory action for " + input.claimType().wireName()
                            + " claims lies within " + boundaries.maxCategoryDeviation()
                            + " step(s) of the boundary reference " + reference.category().label());
        }
        return new GovernedInput(claimId, input, reference, permitted);
    }

    /**
     * Checks an advisory suggestion against the claim's governance envelope.
     *
     * @throws BoundaryViolationException if the suggestion is malformed, claims authority,
     *                                    uses a disallowed action or strays from the boundaries
     */
    public AdvisorySuggestion validateSuggestion(String claimId, AdvisorySuggestion suggestion,
                                                 GovernedInput governed, GovernancePolicy policy) {
        if (suggestion == null) {
            throw new BoundaryViolationException(claimId, "suggestion", "Advisory model returned no suggestion");
        }
        if (suggestion.governanceStatus() != GovernanceStatus.ADVISORY_ONLY) {
            throw new BoundaryViolationException(claimId, "governanceStatus",
                    "Suggestion is not tagged ADVISORY_ONLY: " + suggestion.governanceStatus());
        }
        if (suggestion.category() == null) {
            throw new BoundaryViolationException(claimId, "category", "Suggestion carries no category");
        }
        if (!isUnitInterval(suggestion.confidence())) {
            throw new BoundaryViolationException(claimId, "confidence",
                    "Confidence " + suggestion.confidence() + " is outside [0, 1]");
        }
        if (!isUnitInterval(suggestion.uncertainty())) {
            throw new BoundaryViolationException(claimId, "uncertainty",
                    "Uncertainty " + suggestion.uncertainty() + " is outside [0, 1]");
        }
        UncertaintyLevel expectedLevel = UncertaintyLevel.fromNormalizedEntropy(suggestion.uncertainty());
        if (suggestion.uncertaintyLevel() != expectedLevel) {
            throw new BoundaryViolationException(claimId, "uncertaintyLevel",
                    "Uncertainty level " + suggestion.uncertaintyLevel() + " does not match uncertainty "
                            + suggestion.uncertainty() + " (expected " + expectedLevel + ")");
        }
        if (suggestion.ruleSignals().isEmpty()
                || suggestion.ruleSignals().stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new BoundaryViolationException(claimId, "ruleSignals",
                    "Suggestion must explain itself with non-blank rule signals");
        }

        Severity category = suggestion.category();
        ClaimType claimType = governed.input().claimType();
        if (!governed.permittedActions().contains(category)
                || !policy.dictionary().isActionAllowed(category, claimType)) {
            throw new BoundaryViolationException(claimId, "category",
                    "Advisory action " + category.label() + " is not permitted for "
                            + claimType.wireName() + " claims");
        }

        DecisionBoundarySpec boundaries = policy.boundaries();
        Severity reference = governed.reference().category();
        if (!boundaries.withinDeviation(category, reference)) {
            throw new BoundaryViolationException(claimId, "category",
                    "Suggested " + category.label() + " deviates " + category.distanceTo(reference)
                            + " step(s) from boundary reference " + reference.label()
                            + " (maximum " + boundaries.maxCategoryDeviation() + ")");
        }
        return suggestion;
    }

    private Object coerce(String claimId, String field, Object value, FieldCapability capability) {
        return switch (capability.type()) {
            case ENUM -> coerceEnum(claimId, field, value, capability);
            case DECIMAL -> coerceDecimal(claimId, field, value, capability);
            case BOOLEAN -> coerceBoolean(claimId, field, value, capability);
        };
    }

    private String coerceEnum(String claimId, String field, Object value, FieldCapability capability) {
        if (!(value instanceof String) && !(value instanceof Enum<?>)) {
            throw outOfRange(claimId, field, value, capability);
        }
        String text;
        if (value instanceof ClaimType type) {
            text = type.wireName();
        } else if (value instanceof RiskFactor factor) {
            text = factor.wireName();
        } else {
            text = value instanceof Enum<?> e ? e.name() : (String) value;
        }
        if (!capability.allowedValues().contains(text)) {
            throw outOfRange(claimId, field, value, capability);
        }
        return text;
    }

    private BigDecimal coerceDecimal(String claimId, String field, Object value, FieldCapability capability) {
        BigDecimal number;
        try {
            if (value instanceof BigDecimal decimal) {
                number = decimal;
            } else if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw outOfRange(claimId, field, value, capability);
                }
                number = BigDecimal.valueOf(d);
            } else if (value instanceof Number n) {
                number = new BigDecimal(n.toString());
            } else if (value instanceof String s) {
                number = new BigDecimal(s.trim());
            } else {
                throw outOfRange(claimId, field, value, capability);
            }
        } catch (NumberFormatException e) {
            throw outOfRange(claimId, field, value, capability);
        }
        if (capability.min() != null && number.compareTo(capability.min()) < 0) {
            throw outOfRange(claimId, field, value, capability);
        }
        if (capability.max() != null && number.compareTo(capability.max()) > 0) {
            throw outOfRange(claimId, field, value, capability);
        }
        return number;
    }

    private Boolean coerceBoolean(String claimId, String field, Object value, FieldCapability capability) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return Boolean.FALSE;
            }
        }
        throw outOfRange(claimId, field, value, capability);
    }

    private ClaimInput toClaimInput(String claimId, Map<String, Object> typed) {
        Object claimType = require(claimId, typed, ClaimInput.CLAIM_TYPE);
        Object damage = require(claimId, typed, ClaimInput.DAMAGE_AMOUNT);
        Object injury = require(claimId, typed, ClaimInput.INJURY_INVOLVED);
        Object risk = require(claimId, typed, ClaimInput.RISK_FACTOR);

        if (!(damage instanceof BigDecimal amount)) {
            throw new OutOfRangeException(claimId, ClaimInput.DAMAGE_AMOUNT,
                    "Field '" + ClaimInput.DAMAGE_AMOUNT + "' must be declared DECIMAL");
        }
        if (amount.signum() < 0) {
            throw new OutOfRangeException(claimId, ClaimInput.DAMAGE_AMOUNT,
                    "Field '" + ClaimInput.DAMAGE_AMOUNT + "' must be non-negative, got " + amount.toPlainString());
        }
        if (!(injury instanceof Boolean injuryInvolved)) {
            throw new OutOfRangeException(claimId, ClaimInput.INJURY_INVOLVED,
                    "Field '" + ClaimInput.INJURY_INVOLVED + "' must be declared BOOLEAN");
        }

        ClaimType type;
        try {
            type = ClaimType.fromWire(String.valueOf(claimType));
        } catch (IllegalArgumentException e) {
            throw new OutOfRangeException(claimId, ClaimInput.CLAIM_TYPE, e.getMessage());
        }
        RiskFactor riskFactor;
        try {
            riskFactor = RiskFactor.fromWire(String.valueOf(risk));
        } catch (IllegalArgumentException e) {
            throw new OutOfRangeException(claimId, ClaimInput.RISK_FACTOR, e.getMessage());
        }
        return new ClaimInput(type, amount, injuryInvolved, riskFactor);
    }

    private Object require(String claimId, Map<String, Object> typed, String field) {
        Object value = typed.get(field);
        if (value == null) {
            throw new OutOfRangeException(claimId, field, "Required field '" + field + "' is missing");
        }
        return value;
    }

    private OutOfRangeException outOfRange(String claimId, String field, Object value, FieldCapability capability) {
        return new OutOfRangeException(claimId, field,
                "Field '" + field + "' value '" + value + "' is out of range; expected "
                        + capability.describeDomain());
    }

    private static boolean isUnitInterval(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
