package com.arbiter.core.engine;

import com.arbiter.core.governance.GovernedInput;
import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.policy.BoundaryReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Reminders shown to the reviewer with every pending claim.
 */
final class GovernanceReminders {

    static final List<String> STANDARD = List.of(
            "⚠ This is an ADVISORY suggestion only",
            "⚠ Human decision-maker has FULL AUTHORITY to accept or override",
            "⚠ Human must independently evaluate the claim",
            "⚠ Human must document rationale for final decision",
            "⚠ All decisions must be logged in audit trail");

    private GovernanceReminders() {}

    static List<String> render(GovernedInput governed, AdvisorySuggestion suggestion) {
        List<String> reminders = new ArrayList<>(STANDARD);
        reminders.add("⚠ " + suggestion.uncertaintyLevel().interpretation());
        BoundaryReference reference = governed.reference();
        if (reference.category() != suggestion.category()) {
            reminders.add("⚠ Suggestion differs from boundary reference " + reference.category().label()
                    + " (" + reference.rationale() + ")");
        }
        return reminders;
    }
}
