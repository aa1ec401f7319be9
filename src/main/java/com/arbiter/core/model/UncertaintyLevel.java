package com.arbiter.core.model;

/**
 * Banding of normalized prediction entropy.
 */
public enum UncertaintyLevel {
    LOW("Model is confident in this suggestion"),
    MEDIUM("Model has moderate uncertainty - extra human scrutiny recommended"),
    HIGH("Model is uncertain - requires careful human review");

    private static final double LOW_CEILING = 0.3;
    private static final double MEDIUM_CEILING = 0.6;

    private final String interpretation;

    UncertaintyLevel(String interpretation) {
        this.interpretation = interpretation;
    }

    public String interpretation() {
        return interpretation;
    }

    public static UncertaintyLevel fromNormalizedEntropy(double normalizedEntropy) {
        if (normalizedEntropy < LOW_CEILING) {
            return LOW;
        }
        if (normalizedEntropy < MEDIUM_CEILING) {
            return MEDIUM;
        }
        return HIGH;
    }
}
