package com.arbiter.core.policy;

import java.math.BigDecimal;
import java.util.List;

/**
 * What the capability dictionary permits for one input field.
 *
 * @param allowed       whether the field may appear in input at all
 * @param type          value domain
 * @param allowedValues permitted values for {@link FieldType#ENUM} fields
 * @param min           inclusive lower bound for {@link FieldType#DECIMAL} fields, or {@code null}
 * @param max           inclusive upper bound for {@link FieldType#DECIMAL} fields, or {@code null}
 * @param required      whether the field must be present
 */
public record FieldCapability(
    boolean allowed,
    FieldType type,
    List<String> allowedValues,
    BigDecimal min,
    BigDecimal max,
    boolean required
) {

    public FieldCapability {
        if (type == null) {
            throw new IllegalArgumentException("Field capability must declare a type");
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (type == FieldType.ENUM && allowedValues.isEmpty()) {
            throw new IllegalArgumentException("ENUM field capability must list allowedValues");
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min " + min + " exceeds max " + max);
        }
    }

    public static FieldCapability enumField(List<String> values) {
        return new FieldCapability(true, FieldType.ENUM, values, null, null, true);
    }

    public static FieldCapability decimalField(BigDecimal min, BigDecimal max) {
        return new FieldCapability(true, FieldType.DECIMAL, List.of(), min, max, true);
    }

    public static FieldCapability booleanField() {
        return new FieldCapability(true, FieldType.BOOLEAN, List.of(), null, null, true);
    }

    /** Human-readable description of the permitted domain, used in rejection reasons. */
    public String describeDomain() {
        return switch (type) {
            case ENUM -> "one of " + allowedValues;
            case BOOLEAN -> "true or false";
            case DECIMAL -> "a number in [" + (min != null ? min.toPlainString() : "-inf")
                    + ", " + (max != null ? max.toPlainString() : "+inf") + "]";
        };
    }
}
