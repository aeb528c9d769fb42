package com.componenttracker.dto;

import com.componenttracker.model.CanonicalComplexity;
import com.componenttracker.model.CanonicalStatus;
import com.componenttracker.model.ComponentRecord;
import lombok.Getter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Getter
public class ComponentResponse {

    private final String externalKey;
    private final String componentLabel;
    private final String towerName;
    private final String appGroup;
    private final String componentType;
    private final CanonicalComplexity complexity;
    private final CanonicalStatus status;
    private final String changeType;
    private final Integer month;
    private final Integer year;
    private final String description;
    private final LocalDate releaseDate;
    private final String createdBy;
    private final String updatedBy;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;

    public ComponentResponse(ComponentRecord c) {
        this.externalKey = c.getExternalKey();
        this.componentLabel = c.getComponentLabel();
        this.towerName = c.getTowerName();
        this.appGroup = c.getAppGroup();
        this.componentType = c.getComponentType();
        this.complexity = c.getComplexity();
        this.status = c.getStatus();
        this.changeType = c.getChangeType();
        this.month = c.getMonth();
        this.year = c.getYear();
        this.description = c.getDescription();
        this.releaseDate = c.getReleaseDate();
        this.createdBy = c.getCreatedBy();
        this.updatedBy = c.getUpdatedBy();
        this.createdAt = c.getCreatedAt();
        this.updatedAt = c.getUpdatedAt();
    }
}
