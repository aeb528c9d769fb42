package com.componenttracker.model;

import java.util.Locale;
import java.util.Optional;

public enum PayloadFormat {
    CSV,
    EXCEL,
    JSON;

    /**
     * Resolves the format from a file name extension.
     */
    public static Optional<PayloadFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "csv" -> Optional.of(CSV);
            case "xlsx", "xls" -> Optional.of(EXCEL);
            case "json" -> Optional.of(JSON);
            default -> Optional.empty();
        };
    }
}
