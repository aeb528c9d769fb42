package com.componenttracker.service;

import com.componenttracker.model.CanonicalComplexity;
import com.componenttracker.model.CanonicalComponentRecord;
import com.componenttracker.model.CanonicalStatus;
import com.componenttracker.model.RawRecord;
import com.componenttracker.model.ValidatedRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RecordValidatorTest {

    private final RecordValidator recordValidator = new RecordValidator(
            new FieldExtractor(),
            new ValueNormalizer(ValueNormalizer.DEFAULT_DATE_PATTERNS),
            2020,
            2030);

    @Test
    void keepsValidValuesWithoutWarnings() {
        RawRecord raw = new RawRecord(1, Map.of(
                "componentId", "CMP-1",
                "name", "Billing API",
                "tower", "Finance",
                "appGroup", "Payments",
                "componentType", "Service",
                "complexity", "Complex",
                "status", "deployed",
                "month", "6",
                "year", "2025.0",
                "releaseDate", "2025-06-30"));

        ValidatedRecord validated = recordValidator.validateAndFix(raw);
        CanonicalComponentRecord record = validated.record();

        assertThat(validated.warnings()).isEmpty();
        assertThat(record.getExternalKey()).isEqualTo("CMP-1");
        assertThat(record.getComponentLabel()).isEqualTo("Billing API");
        assertThat(record.getComplexity()).isEqualTo(CanonicalComplexity.HIGH);
        assertThat(record.getStatus()).isEqualTo(CanonicalStatus.RELEASED);
        assertThat(record.getMonth()).isEqualTo(6);
        assertThat(record.getYear()).isEqualTo(2025);
        assertThat(record.getReleaseDate()).isEqualTo(LocalDate.of(2025, 6, 30));
        assertThat(record.getChangeType()).isEqualTo(RecordValidator.DEFAULT_CHANGE_TYPE);
        assertThat(record.getSourceRow()).isEqualTo(1);
    }

    @Test
    void fillsMissingRequiredFieldsWithDefaults() {
        ValidatedRecord validated = recordValidator.validateAndFix(new RawRecord(7, Map.of()));
        CanonicalComponentRecord record = validated.record();

        assertThat(record.getExternalKey()).isNull();
        assertThat(record.getComponentLabel()).isEqualTo("Component 7");
        assertThat(record.getTowerName()).isEqualTo(RecordValidator.DEFAULT_TOWER);
        assertThat(record.getAppGroup()).isEqualTo(RecordValidator.DEFAULT_APP_GROUP);
        assertThat(record.getComponentType()).isEqualTo(RecordValidator.DEFAULT_COMPONENT_TYPE);
        assertThat(record.getComplexity()).isEqualTo(CanonicalComplexity.MEDIUM);
        assertThat(record.getStatus()).isEqualTo(CanonicalStatus.PLANNED);
        assertThat(validated.warnings()).containsExactly(
                "Missing component name; using 'Component 7'",
                "Missing tower; using 'General'",
                "Missing app group; using 'Default Team'",
                "Missing component type; using 'General Component'");
    }

    @Test
    void unrecognizedStatusFallsBackWithWarning() {
        ValidatedRecord validated = recordValidator.validateAndFix(completeRecord(Map.of("status", "donezo")));

        assertThat(validated.record().getStatus()).isEqualTo(CanonicalStatus.defaultStatus());
        assertThat(validated.warnings()).containsExactly("Invalid status 'donezo'; using 'Planned'");
    }

    @Test
    void invalidComplexityFallsBackWithWarning() {
        ValidatedRecord validated = recordValidator.validateAndFix(completeRecord(Map.of("complexity", "invalid")));

        assertThat(validated.record().getComplexity()).isEqualTo(CanonicalComplexity.MEDIUM);
        assertThat(validated.warnings()).containsExactly("Invalid complexity 'invalid'; using 'Medium'");
    }

    @Test
    void outOfRangeYearAndMonthUseCurrentValues() {
        LocalDate today = LocalDate.now();
        ValidatedRecord validated = recordValidator.validateAndFix(
                completeRecord(Map.of("year", "1999", "month", "13")));

        assertThat(validated.record().getYear()).isEqualTo(today.getYear());
        assertThat(validated.record().getMonth()).isEqualTo(today.getMonthValue());
        assertThat(validated.warnings()).hasSize(2);
        assertThat(validated.warnings().get(0)).startsWith("Year 1999 outside 2020-2030");
        assertThat(validated.warnings().get(1)).startsWith("Month 13 outside 1-12");
    }

    @Test
    void unparsableReleaseDateIsDroppedWithWarning() {
        ValidatedRecord validated = recordValidator.validateAndFix(completeRecord(Map.of("releaseDate", "someday")));

        assertThat(validated.record().getReleaseDate()).isNull();
        assertThat(validated.warnings()).containsExactly("Unrecognized release date 'someday'; leaving it empty");
    }

    @Test
    void neverThrowsAndAlwaysProducesCanonicalValues() {
        Random random = new Random(42);
        List<String> keys = List.of("name", "tower", "appGroup", "componentType", "complexity", "status",
                "month", "year", "releaseDate", "componentId", "junk");
        List<Object> values = java.util.Arrays.asList(null, "", "  ", "nan", Double.NaN, "donezo", "2024.5",
                "-3", "99999999999", "13", "2021", "Simple", "live", "2025-02-30", 7, 2026.0, true, "{}");

        for (int i = 0; i < 500; i++) {
            Map<String, Object> row = new HashMap<>();
            for (String key : keys) {
                if (random.nextBoolean()) {
                    row.put(key, values.get(random.nextInt(values.size())));
                }
            }
            RawRecord raw = new RawRecord(i + 1, row);

            assertThatCode(() -> recordValidator.validateAndFix(raw)).doesNotThrowAnyException();
            CanonicalComponentRecord record = recordValidator.validateAndFix(raw).record();
            assertThat(record.getComplexity()).isIn((Object[]) CanonicalComplexity.values());
            assertThat(record.getStatus()).isIn((Object[]) CanonicalStatus.values());
            assertThat(record.getMonth()).isBetween(1, 12);
            assertThat(record.getYear()).isBetween(2020, 2030);
            assertThat(record.getComponentLabel()).isNotBlank();
            assertThat(record.getTowerName()).isNotBlank();
            assertThat(record.getAppGroup()).isNotBlank();
            assertThat(record.getComponentType()).isNotBlank();
            assertThat(record.getChangeType()).isNotBlank();
        }
    }

    @Test
    void parsesIntegralDecimals() {
        assertThat(RecordValidator.parseWholeNumber("2024")).contains(2024);
        assertThat(RecordValidator.parseWholeNumber("2024.0")).contains(2024);
        assertThat(RecordValidator.parseWholeNumber("2024.5")).isEmpty();
        assertThat(RecordValidator.parseWholeNumber("soon")).isEmpty();
    }

    private static RawRecord completeRecord(Map<String, Object> overrides) {
        Map<String, Object> values = new HashMap<>();
        values.put("componentId", "CMP-9");
        values.put("name", "Ledger");
        values.put("tower", "Finance");
        values.put("appGroup", "Accounting");
        values.put("componentType", "Service");
        values.put("complexity", "Low");
        values.put("status", "Released");
        values.putAll(overrides);
        return new RawRecord(1, values);
    }
}
