package com.componenttracker.model;

/**
 * Status values stored on {@link UploadRecord}.
 */
public final class UploadStatus {

    private UploadStatus() {
    }

    public static final String PROCESSING = "PROCESSING";
    public static final String COMPLETED = "COMPLETED";
    public static final String DECODE_FAILED = "DECODE_FAILED";

}
