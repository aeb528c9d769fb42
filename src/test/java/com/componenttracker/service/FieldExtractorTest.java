package com.componenttracker.service;

import com.componenttracker.model.CanonicalField;
import com.componenttracker.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldExtractorTest {

    private final FieldExtractor fieldExtractor = new FieldExtractor();

    @Test
    void towerAliasesResolveToTheSameValue() {
        RawRecord spaced = new RawRecord(1, Map.of("Tower Name", "Security"));
        RawRecord camel = new RawRecord(2, Map.of("towerName", "Security"));
        RawRecord snake = new RawRecord(3, Map.of("tower_name", "Security"));

        assertThat(fieldExtractor.extract(spaced, CanonicalField.TOWER_NAME, null)).isEqualTo("Security");
        assertThat(fieldExtractor.extract(camel, CanonicalField.TOWER_NAME, null)).isEqualTo("Security");
        assertThat(fieldExtractor.extract(snake, CanonicalField.TOWER_NAME, null)).isEqualTo("Security");
    }

    @Test
    void firstUsableAliasWins() {
        RawRecord record = new RawRecord(1, Map.of("name", "Billing API", "title", "Ignored"));

        assertThat(fieldExtractor.extract(record, CanonicalField.COMPONENT_LABEL, null)).isEqualTo("Billing API");
    }

    @Test
    void skipsBlankNullAndNanValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("tower", "   ");
        values.put("tower_name", null);
        values.put("towerName", "NaN");
        values.put("Tower", Double.NaN);
        values.put("domain", " Finance ");
        RawRecord record = new RawRecord(1, values);

        assertThat(fieldExtractor.extract(record, CanonicalField.TOWER_NAME, "General")).isEqualTo("Finance");
    }

    @Test
    void returnsDefaultWhenNoAliasMatches() {
        RawRecord record = new RawRecord(1, Map.of("unrelated", "value"));

        assertThat(fieldExtractor.extract(record, CanonicalField.APP_GROUP, "Default Team")).isEqualTo("Default Team");
        assertThat(fieldExtractor.extract(record, CanonicalField.DESCRIPTION)).isEmpty();
        assertThat(fieldExtractor.extract(record, List.of("a", "b"), null)).isNull();
    }

    @Test
    void numericValuesAreReturnedAsText() {
        RawRecord record = new RawRecord(1, Map.of("year", 2025));

        assertThat(fieldExtractor.extract(record, CanonicalField.YEAR)).isEqualTo("2025");
    }
}
