package com.componenttracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Setter
@Getter
@Entity
@Table(name = "components",
        uniqueConstraints = @UniqueConstraint(name = "uk_components_external_key", columnNames = "external_key"))
public class ComponentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "external_key", nullable = false, length = 100)
    private String externalKey;

    @Column(name = "component_label", nullable = false, length = 200)
    private String componentLabel;

    @Column(name = "tower_name", nullable = false, length = 100)
    private String towerName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tower_id", foreignKey = @ForeignKey(name = "fk_components_tower"))
    private Tower tower;

    @Column(name = "app_group", nullable = false, length = 100)
    private String appGroup;

    @Column(name = "component_type", nullable = false, length = 100)
    private String componentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "complexity", nullable = false, length = 20)
    private CanonicalComplexity complexity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CanonicalStatus status;

    @Column(name = "change_type", nullable = false, length = 100)
    private String changeType;

    @Column(name = "release_month", nullable = false)
    private Integer month;

    @Column(name = "release_year", nullable = false)
    private Integer year;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "release_date")
    private LocalDate releaseDate;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public ComponentRecord() {
    }

    /**
     * Overwrites every canonical field from {@code source}. The external key is left untouched.
     */
    public void applyCanonical(CanonicalComponentRecord source) {
        this.componentLabel = source.getComponentLabel();
        this.towerName = source.getTowerName();
        this.appGroup = source.getAppGroup();
        this.componentType = source.getComponentType();
        this.complexity = source.getComplexity();
        this.status = source.getStatus();
        this.changeType = source.getChangeType();
        this.month = source.getMonth();
        this.year = source.getYear();
        this.description = source.getDescription();
        this.releaseDate = source.getReleaseDate();
    }
}
