package com.componenttracker.model;

import java.util.List;

/**
 * Output of the auto-fixer for one row: a usable record plus the warnings raised while fixing it.
 */
public record ValidatedRecord(CanonicalComponentRecord record, List<String> warnings) {

    public ValidatedRecord {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
