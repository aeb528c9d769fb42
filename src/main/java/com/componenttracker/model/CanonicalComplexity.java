package com.componenttracker.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical three-level complexity. The legacy Simple/Medium/Complex vocabulary
 * maps onto Low/Medium/High.
 */
public enum CanonicalComplexity {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    CanonicalComplexity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static CanonicalComplexity defaultComplexity() {
        return MEDIUM;
    }
}
