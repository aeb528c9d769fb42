package com.componenttracker.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical release status of a component.
 */
public enum CanonicalStatus {

    PLANNED("Planned"),
    IN_DEVELOPMENT("In Development"),
    RELEASED("Released");

    private final String label;

    CanonicalStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static CanonicalStatus defaultStatus() {
        return PLANNED;
    }
}
