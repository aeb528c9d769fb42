package com.componenttracker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One decoded row (CSV/Excel) or element (JSON) of an upload, keyed by the
 * source's own field names. Values are scalars or strings as the decoder produced them.
 */
public final class RawRecord {

    private final int rowNumber;
    private final Map<String, Object> values;

    public RawRecord(int rowNumber, Map<String, ?> values) {
        this.rowNumber = rowNumber;
        this.values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 1-based position of the record among the data rows of the upload.
     */
    public int getRowNumber() {
        return rowNumber;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * True when every value is null or blank text.
     */
    public boolean isBlank() {
        for (Object value : values.values()) {
            if (value != null && !value.toString().trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "RawRecord{row=" + rowNumber + ", values=" + values + '}';
    }
}
