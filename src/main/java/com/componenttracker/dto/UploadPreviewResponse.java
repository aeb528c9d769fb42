package com.componenttracker.dto;

import com.componenttracker.model.CanonicalComponentRecord;
import com.componenttracker.model.RowMessage;
import com.componenttracker.model.UploadPreview;
import lombok.Getter;

import java.util.List;

@Getter
public class UploadPreviewResponse {

    private final boolean success = true;
    private final String filename;
    private final List<CanonicalComponentRecord> previewData;
    private final int totalRows;
    private final int previewRows;
    private final List<String> warnings;

    public UploadPreviewResponse(String filename, UploadPreview preview) {
        this.filename = filename;
        this.previewData = preview.records();
        this.totalRows = preview.totalRows();
        this.previewRows = preview.previewRows();
        this.warnings = preview.warnings().stream().map(RowMessage::format).toList();
    }
}
