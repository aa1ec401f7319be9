package com.arbiter.core.policy;

/**
 * Value domain of a capability dictionary field.
 */
public enum FieldType {
    ENUM,
    DECIMAL,
    BOOLEAN
}
