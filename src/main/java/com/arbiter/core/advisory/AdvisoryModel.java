package com.arbiter.core.advisory;

import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;

/**
 * External advisory capability: turns a validated claim into a non-binding suggestion.
 * <p>
 * Implementations may be a fixed rule table or a trained classifier; the
 * governance and audit contract is identical either way. Implementations must
 * be deterministic (identical input yields an equal suggestion) and must
 * signal failure by throwing, never by returning a default guess. The engine
 * only ever passes input that has cleared governance validation.
 */
public interface AdvisoryModel {

    AdvisorySuggestion suggest(ClaimInput input);

    /** Stable identifier recorded with every suggestion. */
    String modelId();

    default String modelVersion() {
        return "1";
    }
}
