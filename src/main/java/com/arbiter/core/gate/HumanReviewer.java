package com.arbiter.core.gate;

import com.arbiter.core.model.HumanConfirmation;

/**
 * The accountable person answering a pending claim. Implementations collect a
 * verdict; they never decide on the person's behalf.
 */
@FunctionalInterface
public interface HumanReviewer {

    HumanConfirmation review(DecisionContext context);
}
