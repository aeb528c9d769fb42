package com.componenttracker.dto;

import lombok.Getter;

import java.time.OffsetDateTime;

@Getter
public class UploadProgressEvent implements BroadcastEvent {

    public static final String TYPE = "upload_progress";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ERROR = "error";

    private final String type = TYPE;
    private final String filename;
    private final int progress;
    private final String status;
    private final OffsetDateTime timestamp;

    public UploadProgressEvent(String filename, int progress, String status) {
        this.filename = filename;
        this.progress = Math.max(0, Math.min(100, progress));
        this.status = status;
        this.timestamp = OffsetDateTime.now();
    }

    @Override
    public String toString() {
        return TYPE + "{" + filename + " " + progress + "% " + status + "}";
    }
}
