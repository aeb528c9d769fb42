package com.componenttracker.model;

import lombok.Getter;

/**
 * Result of reconciling one canonical record against the store.
 */
@Getter
public final class ReconciliationOutcome {

    public enum Kind {
        CREATED,
        UPDATED,
        FAILED
    }

    private final Kind kind;
    private final int sourceRow;
    private final String externalKey;
    private final CanonicalComponentRecord record;
    private final String reason;

    private ReconciliationOutcome(Kind kind, CanonicalComponentRecord record, String reason) {
        this.kind = kind;
        this.sourceRow = record.getSourceRow();
        this.externalKey = record.getExternalKey();
        this.record = record;
        this.reason = reason;
    }

    public static ReconciliationOutcome created(CanonicalComponentRecord record) {
        return new ReconciliationOutcome(Kind.CREATED, record, null);
    }

    public static ReconciliationOutcome updated(CanonicalComponentRecord record) {
        return new ReconciliationOutcome(Kind.UPDATED, record, null);
    }

    public static ReconciliationOutcome failed(CanonicalComponentRecord record, String reason) {
        return new ReconciliationOutcome(Kind.FAILED, record, reason);
    }

    public boolean isSuccess() {
        return kind != Kind.FAILED;
    }

    @Override
    public String toString() {
        return kind + "(" + externalKey + (reason != null ? ": " + reason : "") + ")";
    }
}
