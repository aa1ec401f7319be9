package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Underwriting risk band attached to a claim.
 */
public enum RiskFactor {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskFactor(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RiskFactor fromWire(String value) {
        for (RiskFactor factor : values()) {
            if (factor.wireName.equals(value) || factor.name().equals(value)) {
                return factor;
            }
        }
        throw new IllegalArgumentException("Unknown risk factor: " + value);
    }
}
