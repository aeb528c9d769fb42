package com.componenttracker.model;

/**
 * Stages of one ingestion run. FAILED is only reachable from DECODING.
 */
public enum IngestionStage {
    DECODING,
    EXTRACTING,
    VALIDATING,
    RECONCILING,
    COMPLETED,
    FAILED
}
