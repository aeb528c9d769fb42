package com.componenttracker.model;

import java.util.List;

/**
 * Validated but unsaved view of the first records of an upload.
 */
public record UploadPreview(int totalRows, List<CanonicalComponentRecord> records, List<RowMessage> warnings) {

    public UploadPreview {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public int previewRows() {
        return records.size();
    }
}
