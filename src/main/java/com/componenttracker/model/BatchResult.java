package com.componenttracker.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate outcome of one ingestion run. Immutable once assembled.
 */
public final class BatchResult {

    private final int created;
    private final int updated;
    private final int failed;
    private final int totalRows;
    private final List<RowMessage> messages;
    private final List<ReconciliationOutcome> outcomes;
    private final List<String> towersCreated;
    private final UUID uploadId;

    public BatchResult(int totalRows, List<ReconciliationOutcome> outcomes, List<RowMessage> messages) {
        this(totalRows, outcomes, messages, List.of(), null);
    }

    public BatchResult(int totalRows, List<ReconciliationOutcome> outcomes, List<RowMessage> messages,
                       List<String> towersCreated) {
        this(totalRows, outcomes, messages, towersCreated, null);
    }

    private BatchResult(int totalRows, List<ReconciliationOutcome> outcomes, List<RowMessage> messages,
                        List<String> towersCreated, UUID uploadId) {
        this.totalRows = totalRows;
        this.uploadId = uploadId;
        this.towersCreated = List.copyOf(towersCreated);
        this.outcomes = List.copyOf(outcomes);
        List<RowMessage> sorted = new ArrayList<>(messages);
        // stable sort keeps warnings ahead of errors within a row
        sorted.sort(Comparator.comparingInt(RowMessage::rowIndex));
        this.messages = List.copyOf(sorted);
        int c = 0;
        int u = 0;
        int f = 0;
        for (ReconciliationOutcome outcome : this.outcomes) {
            switch (outcome.getKind()) {
                case CREATED -> c++;
                case UPDATED -> u++;
                case FAILED -> f++;
            }
        }
        this.created = c;
        this.updated = u;
        this.failed = f;
    }

    /**
     * Returns a copy with additional row messages merged in row order.
     */
    public BatchResult withMessages(List<RowMessage> extra) {
        List<RowMessage> merged = new ArrayList<>(extra);
        merged.addAll(messages);
        return new BatchResult(totalRows, outcomes, merged, towersCreated, uploadId);
    }

    public BatchResult withUploadId(UUID id) {
        return new BatchResult(totalRows, outcomes, messages, towersCreated, id);
    }

    /**
     * Id of the stored upload record, or {@code null} when history could not be written.
     */
    public UUID getUploadId() {
        return uploadId;
    }

    /**
     * Names of towers this run created, in the order they were first committed.
     */
    public List<String> getTowersCreated() {
        return towersCreated;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getFailed() {
        return failed;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public List<RowMessage> getMessages() {
        return messages;
    }

    public List<ReconciliationOutcome> getOutcomes() {
        return outcomes;
    }

    public List<RowMessage> getWarnings() {
        return messages.stream().filter(m -> !m.isError()).toList();
    }

    public List<RowMessage> getErrors() {
        return messages.stream().filter(RowMessage::isError).toList();
    }

    public List<String> formattedMessages() {
        return messages.stream().map(RowMessage::format).toList();
    }
}
