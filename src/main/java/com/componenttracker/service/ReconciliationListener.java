package com.componenttracker.service;

import com.componenttracker.model.ReconciliationOutcome;

import java.util.List;

/**
 * Receives the outcomes of each chunk once they are final (committed, or settled by the
 * single-record retry pass).
 */
@FunctionalInterface
public interface ReconciliationListener {

    ReconciliationListener NONE = (chunkNumber, totalChunks, outcomes) -> { };

    void onChunkSettled(int chunkNumber, int totalChunks, List<ReconciliationOutcome> outcomes);
}
