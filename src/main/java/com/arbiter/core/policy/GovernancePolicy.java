package com.arbiter.core.policy;

import java.util.Objects;

/**
 * The immutable policy handle passed into every pipeline invocation.
 *
 * @param dictionary             capability dictionary
 * @param boundaries             decision boundary spec
 * @param dictionaryFingerprint  SHA-256 of the dictionary's canonical form
 * @param boundariesFingerprint  SHA-256 of the boundary spec's canonical form
 */
public record GovernancePolicy(
    CapabilityDictionary dictionary,
    DecisionBoundarySpec boundaries,
    String dictionaryFingerprint,
    String boundariesFingerprint
) {

    public GovernancePolicy {
        Objects.requireNonNull(dictionary, "dictionary");
        Objects.requireNonNull(boundaries, "boundaries");
        Objects.requireNonNull(dictionaryFingerprint, "dictionaryFingerprint");
        Objects.requireNonNull(boundariesFingerprint, "boundariesFingerprint");
    }
}
