package com.componenttracker.dto;

import com.componenttracker.model.UploadRecord;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Getter
public class UploadSummaryResponse {

    private final UUID id;
    private final String filename;
    private final String format;
    private final String actor;
    private final String status;
    private final int created;
    private final int updated;
    private final int failed;
    private final int totalRows;
    private final List<String> messages;
    private final OffsetDateTime receivedAt;
    private final OffsetDateTime completedAt;

    public UploadSummaryResponse(UploadRecord upload) {
        this.id = upload.getId();
        this.filename = upload.getFilename();
        this.format = upload.getPayloadFormat();
        this.actor = upload.getActor();
        this.status = upload.getStatus();
        this.created = nullToZero(upload.getCreatedCount());
        this.updated = nullToZero(upload.getUpdatedCount());
        this.failed = nullToZero(upload.getFailedCount());
        this.totalRows = nullToZero(upload.getTotalRows());
        this.messages = upload.getMessages() == null || upload.getMessages().isEmpty()
                ? List.of()
                : Arrays.asList(upload.getMessages().split("\n"));
        this.receivedAt = upload.getReceivedAt();
        this.completedAt = upload.getCompletedAt();
    }

    private static int nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
