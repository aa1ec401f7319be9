package com.arbiter.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-binding recommendation produced by an {@link com.arbiter.core.advisory.AdvisoryModel}.
 *
 * @param category               suggested severity category
 * @param confidence             probability mass assigned to {@code category}, in [0, 1]
 * @param ruleSignals            ordered human-readable reasons behind the suggestion
 * @param uncertainty            normalized entropy of the confidence distribution, in [0, 1]
 * @param uncertaintyLevel       banding of {@code uncertainty}
 * @param confidenceDistribution probability per category
 * @param featureImportance      relative influence of each input field, in percent
 * @param governanceStatus       always {@link GovernanceStatus#ADVISORY_ONLY}
 * @param modelId                identifier of the model that produced this suggestion
 * @param modelVersion           version of that model
 */
public record AdvisorySuggestion(
    Severity category,
    double confidence,
    List<String> ruleSignals,
    double uncertainty,
    UncertaintyLevel uncertaintyLevel,
    Map<Severity, Double> confidenceDistribution,
    Map<String, Double> featureImportance,
    GovernanceStatus governanceStatus,
    String modelId,
    String modelVersion
) implements Serializable {

    public AdvisorySuggestion {
        ruleSignals = ruleSignals == null ? List.of() : List.copyOf(ruleSignals);
        confidenceDistribution = confidenceDistribution == null || confidenceDistribution.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(confidenceDistribution));
        featureImportance = featureImportance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
    }

    /**
     * Builds a suggestion tagged {@link GovernanceStatus#ADVISORY_ONLY}.
     */
    public static AdvisorySuggestion advisory(Severity category, double confidence, List<String> ruleSignals,
                                              double uncertainty, Map<Severity, Double> confidenceDistribution,
                                              Map<String, Double> featureImportance,
                                              String modelId, String modelVersion) {
        return new AdvisorySuggestion(category, confidence, ruleSignals, uncertainty,
                UncertaintyLevel.fromNormalizedEntropy(uncertainty), confidenceDistribution,
                featureImportance, GovernanceStatus.ADVISORY_ONLY, modelId, modelVersion);
    }

    /** Display label in the form shown to reviewers, e.g. "High Severity (Advisory)". */
    public String displayLabel() {
        return (category != null ? category.label() : "Unknown") + " Severity (Advisory)";
    }
}
