package com.arbiter.core.policy;

import com.arbiter.core.model.ClaimType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Whether an advisory action may be suggested, and for which claim types.
 * An empty {@code claimTypes} set means the action applies to every claim type.
 */
public record ActionCapability(
    boolean allowed,
    Set<ClaimType> claimTypes
) {

    public ActionCapability {
        claimTypes = claimTypes == null || claimTypes.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(claimTypes));
    }

    public boolean permits(ClaimType claimType) {
        return allowed && (claimTypes.isEmpty() || claimTypes.contains(claimType));
    }
}
