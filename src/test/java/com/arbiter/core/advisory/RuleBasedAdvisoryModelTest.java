package com.arbiter.core.advisory;

import com.arbiter.core.ClaimFixtures;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.GovernanceStatus;
import com.arbiter.core.model.RiskFactor;
import com.arbiter.core.model.Severity;
import com.arbiter.core.model.UncertaintyLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedAdvisoryModelTest {

    private RuleBasedAdvisoryModel model;

    @BeforeEach
    void setUp() {
        model = new RuleBasedAdvisoryModel(ClaimFixtures.standardPolicy().boundaries());
    }

    @Test
    @DisplayName("auto claim with injury scores High with confident, low-uncertainty output")
    void autoInjuryIsHigh() {
        AdvisorySuggestion suggestion = model.suggest(ClaimFixtures.autoInjuryInput());

        assertEquals(Severity.HIGH, suggestion.category());
        assertTrue(suggestion.confidence() > 0.9);
        assertEquals(UncertaintyLevel.LOW, suggestion.uncertaintyLevel());
        assertEquals(GovernanceStatus.ADVISORY_ONLY, suggestion.governanceStatus());
        assertEquals(RuleBasedAdvisoryModel.MODEL_ID, suggestion.modelId());
        assertEquals("2024.1", suggestion.modelVersion());
    }

    @Test
    @DisplayName("rule signals explain each factor")
    void ruleSignals() {
        List<String> signals = model.suggest(ClaimFixtures.autoInjuryInput()).ruleSignals();

        assertTrue(signals.contains("⚠⚠ High damage ($15,000.00-$50,000.00): $15,000.00"), signals::toString);
        assertTrue(signals.contains("⚠ Injury involved (multiplier: 1.8x)"), signals::toString);
        assertTrue(signals.contains("⚠ Medium risk factor (weight: 1.5x)"), signals::toString);
        assertTrue(signals.stream().anyMatch(s -> s.startsWith("Severity score 40.50")), signals::toString);
    }

    @Test
    @DisplayName("small claim without injury is Low")
    void smallClaimIsLow() {
        AdvisorySuggestion suggestion = model.suggest(
                ClaimFixtures.input(ClaimType.PROPERTY, "1200", false, RiskFactor.LOW));

        assertEquals(Severity.LOW, suggestion.category());
        assertTrue(suggestion.ruleSignals().contains("✓ No injury involved"));
    }

    @Test
    @DisplayName("score on a band edge splits probability and raises uncertainty")
    void bandEdge() {
        AdvisorySuggestion edge = model.suggest(
                ClaimFixtures.input(ClaimType.PROPERTY, "5000", false, RiskFactor.LOW));
        AdvisorySuggestion centre = model.suggest(
                ClaimFixtures.input(ClaimType.PROPERTY, "10000", false, RiskFactor.LOW));

        assertEquals(Severity.MEDIUM, edge.category());
        assertTrue(edge.uncertainty() > centre.uncertainty());
        assertTrue(edge.confidence() < centre.confidence());
    }

    @Test
    @DisplayName("distribution sums to one and importance to one hundred")
    void normalised() {
        AdvisorySuggestion suggestion = model.suggest(
                ClaimFixtures.input(ClaimType.LIABILITY, "20000", true, RiskFactor.HIGH));

        double probability = suggestion.confidenceDistribution().values().stream().mapToDouble(Double::doubleValue).sum();
        double importance = suggestion.featureImportance().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, probability, 1e-9);
        assertEquals(100.0, importance, 1e-6);
        assertTrue(suggestion.ruleSignals().contains("⚠ Liability claim (multiplier: 1.25x)"));
    }

    @Test
    @DisplayName("identical input yields an equal suggestion")
    void deterministic() {
        assertEquals(model.suggest(ClaimFixtures.autoInjuryInput()), model.suggest(ClaimFixtures.autoInjuryInput()));
    }

    @Test
    @DisplayName("uniform distribution has maximal normalized entropy")
    void entropy() {
        double third = 1.0 / 3;
        assertEquals(1.0, RuleBasedAdvisoryModel.normalizedEntropy(
                Map.of(Severity.LOW, third, Severity.MEDIUM, third, Severity.HIGH, third)), 1e-6);
        assertEquals(0.0, RuleBasedAdvisoryModel.normalizedEntropy(
                Map.of(Severity.LOW, 0.0, Severity.MEDIUM, 0.0, Severity.HIGH, 1.0)), 1e-6);
    }
}
