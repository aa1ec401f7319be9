package com.arbiter.core.governance;

import com.arbiter.core.model.ClaimInput;
import com.arbiter.core.model.Severity;
import com.arbiter.core.policy.BoundaryReference;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A validated claim together with the envelope its advisory output must stay in.
 *
 * @param claimId          claim identifier
 * @param input            validated claim
 * @param reference        boundary reference category for the claim
 * @param permittedActions advisory categories the dictionary allows for this claim type
 */
public record GovernedInput(
    String claimId,
    ClaimInput input,
    BoundaryReference reference,
    Set<Severity> permittedActions
) {

    public GovernedInput {
        permittedActions = permittedActions == null || permittedActions.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(permittedActions));
    }
}
