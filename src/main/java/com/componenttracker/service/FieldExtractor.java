package com.componenttracker.service;

import com.componenttracker.model.CanonicalField;
import com.componenttracker.model.RawRecord;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pulls one canonical field out of a raw record by trying its aliases in order.
 */
@Service
public class FieldExtractor {

    /**
     * Returns the trimmed text of the first alias whose value is present, non-blank and not a
     * {@code nan} sentinel, or {@code defaultValue} when none qualifies.
     */
    public String extract(RawRecord record, List<String> aliases, String defaultValue) {
        if (record == null || aliases == null) {
            return defaultValue;
        }
        for (String alias : aliases) {
            if (!record.containsKey(alias)) {
                continue;
            }
            String text = usableText(record.get(alias));
            if (text != null) {
                return text;
            }
        }
        return defaultValue;
    }

    public String extract(RawRecord record, CanonicalField field, String defaultValue) {
        return extract(record, FieldAliasTable.aliasesFor(field), defaultValue);
    }

    /**
     * Convenience for optional fields: empty string when nothing matches.
     */
    public String extract(RawRecord record, CanonicalField field) {
        return extract(record, field, "");
    }

    private static String usableText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double d && d.isNaN()) {
            return null;
        }
        String text = value.toString().trim();
        if (text.isEmpty() || "nan".equalsIgnoreCase(text)) {
            return null;
        }
        return text;
    }
}
