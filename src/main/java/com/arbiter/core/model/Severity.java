package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory severity category. Each category is also an advisory action
 * ("suggest severity X") that the capability dictionary may permit or deny.
 */
public enum Severity {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Zero-based position on the severity scale, used to measure deviation between categories. */
    public int rank() {
        return ordinal();
    }

    public int distanceTo(Severity other) {
        return Math.abs(rank() - other.rank());
    }

    @JsonCreator
    public static Severity fromLabel(String value) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(value) || severity.name().equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
