package com.componenttracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Business domain that groups components. Created on first sight of a new tower name during ingestion.
 */
@Setter
@Getter
@Entity
@Table(name = "towers",
        uniqueConstraints = @UniqueConstraint(name = "uk_towers_name", columnNames = "name"))
public class Tower {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "ownership", length = 100)
    private String ownership;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public Tower() {
    }
}
