package com.arbiter.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Arbiter-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CLAIM_ID = "claimId";
    public static final String STAGE = "stage";
    public static final String DECISION_MAKER = "decisionMaker";

    private MdcContext() {}

    public static void setClaim(String claimId) {
        MDC.put(CLAIM_ID, claimId);
    }

    public static void setStage(String claimId, String stage) {
        MDC.put(CLAIM_ID, claimId);
        MDC.put(STAGE, stage);
    }

    public static void setReview(String claimId, String decisionMakerId) {
        MDC.put(CLAIM_ID, claimId);
        MDC.put(DECISION_MAKER, decisionMakerId);
    }

    public static void clearReview() {
        MDC.remove(DECISION_MAKER);
    }

    public static void clear() {
        MDC.remove(CLAIM_ID);
        MDC.remove(STAGE);
        MDC.remove(DECISION_MAKER);
    }
}
