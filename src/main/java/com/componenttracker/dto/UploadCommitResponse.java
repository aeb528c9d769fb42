package com.componenttracker.dto;

import com.componenttracker.model.BatchResult;
import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * Commit summary. {@code errors} holds every row message in row order, warnings and failures alike.
 */
@Getter
public class UploadCommitResponse {

    private final boolean success = true;
    private final String message;
    private final int created;
    private final int updated;
    private final int failed;
    private final int totalRows;
    private final List<String> errors;
    private final int totalErrors;
    private final int towersCreated;
    private final List<String> towersCreatedList;
    private final UUID uploadId;

    public UploadCommitResponse(String filename, BatchResult result) {
        this.message = "Processed " + result.getTotalRows() + " row(s) from " + filename;
        this.created = result.getCreated();
        this.updated = result.getUpdated();
        this.failed = result.getFailed();
        this.totalRows = result.getTotalRows();
        this.errors = result.formattedMessages();
        this.totalErrors = this.errors.size();
        this.towersCreatedList = result.getTowersCreated();
        this.towersCreated = this.towersCreatedList.size();
        this.uploadId = result.getUploadId();
    }
}
