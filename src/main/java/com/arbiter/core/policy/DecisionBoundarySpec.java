package com.arbiter.core.policy;

import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Frozen set of boundary rules and thresholds the advisory step is bounded by.
 * <p>
 * Rules are evaluated in order and the first match provides the reference
 * category; when none matches, the severity-score bands decide. An advisory
 * suggestion may differ from the reference by at most {@link #maxCategoryDeviation()}
 * severity steps. Instances are immutable; the rule list rejects mutation.
 */
public final class DecisionBoundarySpec {

    public static final int DEFAULT_MAX_CATEGORY_DEVIATION = 1;

    private final String version;
    private final List<BoundaryRule> rules;
    private final BoundaryThresholds thresholds;
    private final int maxCategoryDeviation;

    @JsonCreator
    public DecisionBoundarySpec(@JsonProperty("version") String version,
                                @JsonProperty("rules") List<BoundaryRule> rules,
                                @JsonProperty("thresholds") BoundaryThresholds thresholds,
                                @JsonProperty("maxCategoryDeviation") Integer maxCategoryDeviation) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Decision boundary spec must declare a version");
        }
        this.version = version;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.thresholds = thresholds != null ? thresholds : BoundaryThresholds.defaults();
        this.maxCategoryDeviation = maxCategoryDeviation != null
                ? maxCategoryDeviation
                : DEFAULT_MAX_CATEGORY_DEVIATION;
        if (this.maxCategoryDeviation < 0) {
            throw new IllegalArgumentException("maxCategoryDeviation must be >= 0");
        }
        Set<String> ids = new HashSet<>();
        for (BoundaryRule rule : this.rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate boundary rule id: " + rule.id());
            }
        }
    }

    @JsonProperty("version")
    public String version() {
        return version;
    }

    @JsonProperty("rules")
    public List<BoundaryRule> rules() {
        return rules;
    }

    @JsonProperty("thresholds")
    public BoundaryThresholds thresholds() {
        return thresholds;
    }

    @JsonProperty("maxCategoryDeviation")
    public int maxCategoryDeviation() {
        return maxCategoryDeviation;
    }

    /**
     * Computes the reference category for a validated claim.
     */
    public BoundaryReference reference(ClaimInput input) {
        double score = thresholds.severityScore(input);
        for (BoundaryRule rule : rules) {
            if (rule.matches(input)) {
                return new BoundaryReference(rule.category(), rule.rationale(), rule.id(), score);
            }
        }
        Severity category = thresholds.categoryForScore(score);
        return new BoundaryReference(category,
                String.format(Locale.ROOT, "Severity score %.2f falls in the %s band", score, category.label()),
                null, score);
    }

    /**
     * Whether a suggested category stays within the permitted deviation from the reference.
     */
    public boolean withinDeviation(Severity suggested, Severity reference) {
        return suggested.distanceTo(reference) <= maxCategoryDeviation;
    }

    @Override
    public String toString() {
        return "DecisionBoundarySpec[version=" + version + ", rules=" + rules.size()
                + ", maxCategoryDeviation=" + maxCategoryDeviation + "]";
    }
}
