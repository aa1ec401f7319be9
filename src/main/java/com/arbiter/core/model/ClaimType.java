package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Line of business a claim belongs to.
 */
public enum ClaimType {
    AUTO("Auto"),
    PROPERTY("Property"),
    HEALTH("Health"),
    LIABILITY("Liability");

    private final String wireName;

    ClaimType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a claim type from its wire name ("Auto") or constant name ("AUTO").
     *
     * @throws IllegalArgumentException if the value names no claim type
     */
    @JsonCreator
    public static ClaimType fromWire(String value) {
        for (ClaimType type : values()) {
            if (type.wireName.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown claim type: " + value);
    }
}
