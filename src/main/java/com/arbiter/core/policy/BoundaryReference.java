package com.arbiter.core.policy;

import com.arbiter.core.model.Severity;

/**
 * The category the frozen boundaries expect for a claim, and why.
 *
 * @param category      reference category
 * @param rationale     rule rationale, or a description of the score band
 * @param ruleId        id of the matching rule, or {@code null} when the score bands decided
 * @param severityScore severity score computed from the thresholds
 */
public record BoundaryReference(
    Severity category,
    String rationale,
    String ruleId,
    double severityScore
) {

    public boolean fromRule() {
        return ruleId != null;
    }
}
