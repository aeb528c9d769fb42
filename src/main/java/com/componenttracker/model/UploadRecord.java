package com.componenttracker.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One ingestion attempt and its summary. Written for every upload, including
 * ones that fail to decode.
 */
@Getter
@Entity
@Table(name = "upload_records")
public class UploadRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "filename", nullable = false, columnDefinition = "TEXT")
    private String filename;

    @Column(name = "content_type", columnDefinition = "TEXT")
    private String contentType;

    @Column(name = "payload_format", length = 20)
    private String payloadFormat;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "actor", length = 100)
    private String actor;

    @Column(name = "status", nullable = false, length = 40)
    private String status;

    @Column(name = "created_count")
    private Integer createdCount = 0;

    @Column(name = "updated_count")
    private Integer updatedCount = 0;

    @Column(name = "failed_count")
    private Integer failedCount = 0;

    @Column(name = "total_rows")
    private Integer totalRows = 0;

    @Column(name = "messages", columnDefinition = "TEXT")
    private String messages;

    @Column(name = "received_at", nullable = false, updatable = false)
    private OffsetDateTime receivedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    /**
     * Default constructor for JPA.
     */
    public UploadRecord() {}

    public void setFilename(String filename) { this.filename = filename; }

    public void setContentType(String contentType) { this.contentType = contentType; }

    public void setPayloadFormat(String payloadFormat) { this.payloadFormat = payloadFormat; }

    public void setSizeBytes(Long sizeBytes) { this.sizeBytes = sizeBytes; }

    public void setActor(String actor) { this.actor = actor; }

    /**
     * Sets the ingestion status, one of {@link UploadStatus}.
     */
    public void setStatus(String status) { this.status = status; }

    public void setCreatedCount(Integer createdCount) { this.createdCount = createdCount; }

    public void setUpdatedCount(Integer updatedCount) { this.updatedCount = updatedCount; }

    public void setFailedCount(Integer failedCount) { this.failedCount = failedCount; }

    public void setTotalRows(Integer totalRows) { this.totalRows = totalRows; }

    /**
     * Sets the newline-joined row messages.
     */
    public void setMessages(String messages) { this.messages = messages; }

    public void setReceivedAt(OffsetDateTime receivedAt) { this.receivedAt = receivedAt; }

    public void setCompletedAt(OffsetDateTime completedAt) { this.completedAt = completedAt; }
}
