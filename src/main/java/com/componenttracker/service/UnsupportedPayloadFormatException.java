package com.componenttracker.service;

public class UnsupportedPayloadFormatException extends IllegalArgumentException {
    public UnsupportedPayloadFormatException(String filename) {
        super("File type not supported: " + filename + ". Please upload CSV, Excel, or JSON files.");
    }
}
