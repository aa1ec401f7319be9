package com.arbiter.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untrusted claim data as it arrives from a UI, CLI or API caller.
 *
 * @param claimId optional caller-supplied claim identifier; the engine generates one when absent
 * @param fields  field name to untyped value, in the order supplied
 */
public record RawClaimInput(
    String claimId,
    Map<String, Object> fields
) implements Serializable {

    /** Longest claim id the audit ledger stores. */
    public static final int MAX_CLAIM_ID_LENGTH = 128;

    public RawClaimInput {
        if (claimId != null && claimId.length() > MAX_CLAIM_ID_LENGTH) {
            throw new IllegalArgumentException("Claim id must be at most " + MAX_CLAIM_ID_LENGTH
                    + " characters, got " + claimId.length());
        }
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawClaimInput of(Map<String, Object> fields) {
        return new RawClaimInput(null, fields);
    }

    public boolean hasClaimId() {
        return claimId != null && !claimId.isBlank();
    }
}
