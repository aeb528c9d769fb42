package com.componenttracker.model;

/**
 * A row-indexed warning or error surfaced in an ingestion result.
 */
public record RowMessage(int rowIndex, Severity severity, String message) {

    public enum Severity {
        WARNING,
        ERROR
    }

    public static RowMessage warning(int rowIndex, String message) {
        return new RowMessage(rowIndex, Severity.WARNING, message);
    }

    public static RowMessage error(int rowIndex, String message) {
        return new RowMessage(rowIndex, Severity.ERROR, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Renders as {@code "Row 3: message"}.
     */
    public String format() {
        return "Row " + rowIndex + ": " + message;
    }
}
