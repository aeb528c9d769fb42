package com.componenttracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * A component after normalization. Every field except {@code externalKey},
 * {@code description} and {@code releaseDate} holds a non-empty, valid value.
 * {@code externalKey} stays null when the source carried none; the reconciler assigns one.
 */
@Getter
@Builder(toBuilder = true)
public class CanonicalComponentRecord {

    @JsonIgnore
    private final int sourceRow;

    private final String externalKey;
    private final String towerName;
    private final String appGroup;
    private final String componentType;
    private final String componentLabel;
    private final CanonicalComplexity complexity;
    private final CanonicalStatus status;
    private final String changeType;
    private final int month;
    private final int year;
    private final String description;
    private final LocalDate releaseDate;

    @JsonIgnore
    public boolean hasExternalKey() {
        return externalKey != null && !externalKey.isBlank();
    }
}
