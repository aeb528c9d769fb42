package com.componenttracker.model;

/**
 * Target fields of a canonical component record, in the order they are extracted.
 */
public enum CanonicalField {
    EXTERNAL_KEY,
    COMPONENT_LABEL,
    TOWER_NAME,
    APP_GROUP,
    COMPONENT_TYPE,
    COMPLEXITY,
    STATUS,
    CHANGE_TYPE,
    MONTH,
    YEAR,
    DESCRIPTION,
    RELEASE_DATE
}
