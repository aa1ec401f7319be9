package com.arbiter.core.model;

/**
 * Authority tag carried by every advisory suggestion. There is deliberately
 * only one value: suggestions never carry decision authority.
 */
public enum GovernanceStatus {
    ADVISORY_ONLY
}
