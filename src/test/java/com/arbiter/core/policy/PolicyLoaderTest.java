package com.arbiter.core.policy;

import com.arbiter.core.ClaimFixtures;
import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyLoaderTest {

    private final PolicyLoader loader = ClaimFixtures.loader();

    @Nested
    @DisplayName("Bundled policy")
    class BundledPolicy {

        @Test
        @DisplayName("loads the capability dictionary with the four approved fields")
        void loadsDictionary() {
            CapabilityDictionary dictionary = loader.loadDictionary(ClaimFixtures.DICTIONARY);

            assertEquals("2024.1", dictionary.version());
            assertTrue(dictionary.isFieldAllowed("claim_type"));
            assertTrue(dictionary.isFieldAllowed("damage_amount"));
            assertTrue(dictionary.isFieldAllowed("injury_involved"));
            assertTrue(dictionary.isFieldAllowed("risk_factor"));
            assertFalse(dictionary.isFieldAllowed("prior_claims_count"), "declared but disallowed");
            assertFalse(dictionary.isFieldAllowed("claimant_name"), "absent");
            assertEquals(FieldType.DECIMAL, dictionary.field("damage_amount").orElseThrow().type());
            assertEquals(BigDecimal.ZERO, dictionary.field("damage_amount").orElseThrow().min().stripTrailingZeros());
        }

        @Test
        @DisplayName("every category is a permitted action for every claim type")
        void permittedActions() {
            CapabilityDictionary dictionary = loader.loadDictionary(ClaimFixtures.DICTIONARY);
            for (ClaimType type : ClaimType.values()) {
                assertEquals(3, dictionary.permittedActions(type).size());
            }
        }

        @Test
        @DisplayName("loads the decision boundaries in declared order")
        void loadsBoundaries() {
            DecisionBoundarySpec spec = loader.loadBoundaries(ClaimFixtures.BOUNDARIES);

            assertEquals(List.of("catastrophic-damage", "liability-with-injury", "minor-no-injury"),
                    spec.rules().stream().map(BoundaryRule::id).toList());
            assertEquals(1, spec.maxCategoryDeviation());
            assertEquals(1.25, spec.thresholds().liabilityMultiplier());
            assertEquals(Severity.HIGH, spec.rules().get(0).category());
        }

        @Test
        @DisplayName("fingerprints are stable across loads")
        void stableFingerprints() {
            GovernancePolicy first = loader.load(ClaimFixtures.DICTIONARY, ClaimFixtures.BOUNDARIES);
            GovernancePolicy second = loader.load(ClaimFixtures.DICTIONARY, ClaimFixtures.BOUNDARIES);

            assertEquals(64, first.dictionaryFingerprint().length());
            assertEquals(first.dictionaryFingerprint(), second.dictionaryFingerprint());
            assertEquals(first.boundariesFingerprint(), second.boundariesFingerprint());
            assertNotEquals(first.dictionaryFingerprint(), first.boundariesFingerprint());
        }

        @Test
        @DisplayName("JSON documents load like YAML ones")
        void loadsJson() {
            DecisionBoundarySpec json = loader.loadBoundaries("classpath:policy/boundaries-strict.json");
            assertEquals("strict-1", json.version());
            assertEquals(0, json.maxCategoryDeviation());
            assertTrue(json.rules().isEmpty());
        }
    }

    @Nested
    @DisplayName("Immutability")
    class Immutability {

        @Test
        @DisplayName("policy views reject mutation")
        void rejectsMutation() {
            GovernancePolicy policy = ClaimFixtures.standardPolicy();

            assertThrows(UnsupportedOperationException.class,
                    () -> policy.dictionary().fields().remove("claim_type"));
            assertThrows(UnsupportedOperationException.class,
                    () -> policy.dictionary().actions().clear());
            assertThrows(UnsupportedOperationException.class,
                    () -> policy.boundaries().rules().clear());
            assertThrows(UnsupportedOperationException.class,
                    () -> policy.boundaries().thresholds().riskWeights().put("low", 9.0));
        }
    }

    @Nested
    @DisplayName("Malformed documents")
    class Malformed {

        @Test
        @DisplayName("missing document fails with PolicyLoadException")
        void missingDocument() {
            assertThrows(PolicyLoadException.class,
                    () -> loader.loadDictionary("classpath:policy/does-not-exist.yaml"));
        }

        @Test
        @DisplayName("unknown properties are rejected rather than ignored")
        void unknownProperty() {
            PolicyLoadException ex = assertThrows(PolicyLoadException.class,
                    () -> loader.loadDictionary("classpath:policy/dictionary-typo.yaml"));
            assertTrue(ex.getMessage().contains("dictionary-typo.yaml"));
        }

        @Test
        @DisplayName("invalid thresholds are rejected")
        void invalidThresholds() {
            assertThrows(PolicyLoadException.class,
                    () -> loader.loadBoundaries("classpath:policy/boundaries-inverted.yaml"));
        }
    }
}
