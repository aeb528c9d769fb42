package com.componenttracker.service;

import com.componenttracker.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw record into a canonical one, substituting defaults for anything missing or
 * invalid and recording a warning for each substitution. Never rejects a row.
 */
@Service
public class RecordValidator {

    private static final Logger logger = LoggerFactory.getLogger(RecordValidator.class);

    public static final String DEFAULT_TOWER = "General";
    public static final String DEFAULT_APP_GROUP = "Default Team";
    public static final String DEFAULT_COMPONENT_TYPE = "General Component";
    public static final String DEFAULT_CHANGE_TYPE = "Enhancement";
    private static final String PLACEHOLDER_LABEL_PREFIX = "Component ";

    private final FieldExtractor fieldExtractor;
    private final ValueNormalizer valueNormalizer;
    private final int minYear;
    private final int maxYear;

    public RecordValidator(FieldExtractor fieldExtractor,
                           ValueNormalizer valueNormalizer,
                           @Value("${app.ingestion.min-year:2020}") int minYear,
                           @Value("${app.ingestion.max-year:2030}") int maxYear) {
        this.fieldExtractor = fieldExtractor;
        this.valueNormalizer = valueNormalizer;
        this.minYear = minYear;
        this.maxYear = maxYear;
    }

    public ValidatedRecord validateAndFix(RawRecord raw) {
        int row = raw.getRowNumber();
        List<String> warnings = new ArrayList<>();
        LocalDate today = LocalDate.now();

        String externalKey = fieldExtractor.extract(raw, CanonicalField.EXTERNAL_KEY, null);

        String label = required(raw, CanonicalField.COMPONENT_LABEL, PLACEHOLDER_LABEL_PREFIX + row,
                "component name", warnings);
        String tower = required(raw, CanonicalField.TOWER_NAME, DEFAULT_TOWER, "tower", warnings);
        String appGroup = required(raw, CanonicalField.APP_GROUP, DEFAULT_APP_GROUP, "app group", warnings);
        String componentType = required(raw, CanonicalField.COMPONENT_TYPE, DEFAULT_COMPONENT_TYPE,
                "component type", warnings);

        String rawComplexity = fieldExtractor.extract(raw, CanonicalField.COMPLEXITY);
        CanonicalComplexity complexity = valueNormalizer.normalizeComplexity(rawComplexity).orElse(null);
        if (complexity == null) {
            complexity = CanonicalComplexity.defaultComplexity();
            if (!rawComplexity.isEmpty()) {
                warnings.add("Invalid complexity '" + rawComplexity + "'; using '" + complexity.getLabel() + "'");
            }
        }

        String rawStatus = fieldExtractor.extract(raw, CanonicalField.STATUS);
        CanonicalStatus status = valueNormalizer.normalizeStatus(rawStatus).orElse(null);
        if (status == null) {
            status = CanonicalStatus.defaultStatus();
            if (!rawStatus.isEmpty()) {
                warnings.add("Invalid status '" + rawStatus + "'; using '" + status.getLabel() + "'");
            }
        }

        int year = ranged(raw, CanonicalField.YEAR, minYear, maxYear, today.getYear(), "year", warnings);
        int month = ranged(raw, CanonicalField.MONTH, 1, 12, today.getMonthValue(), "month", warnings);

        String rawDate = fieldExtractor.extract(raw, CanonicalField.RELEASE_DATE);
        LocalDate releaseDate = null;
        if (!rawDate.isEmpty()) {
            releaseDate = valueNormalizer.normalizeDate(rawDate).orElse(null);
            if (releaseDate == null) {
                warnings.add("Unrecognized release date '" + rawDate + "'; leaving it empty");
            }
        }

        CanonicalComponentRecord record = CanonicalComponentRecord.builder()
                .sourceRow(row)
                .externalKey(externalKey)
                .componentLabel(label)
                .towerName(tower)
                .appGroup(appGroup)
                .componentType(componentType)
                .complexity(complexity)
                .status(status)
                .changeType(fieldExtractor.extract(raw, CanonicalField.CHANGE_TYPE, DEFAULT_CHANGE_TYPE))
                .year(year)
                .month(month)
                .description(fieldExtractor.extract(raw, CanonicalField.DESCRIPTION))
                .releaseDate(releaseDate)
                .build();

        if (!warnings.isEmpty()) {
            logger.debug("Row {} auto-fixed with {} warning(s): {}", row, warnings.size(), warnings);
        }
        return new ValidatedRecord(record, warnings);
    }

    private String required(RawRecord raw, CanonicalField field, String fallback, String label, List<String> warnings) {
        String value = fieldExtractor.extract(raw, field, null);
        if (value == null) {
            warnings.add("Missing " + label + "; using '" + fallback + "'");
            return fallback;
        }
        return value;
    }

    private int ranged(RawRecord raw, CanonicalField field, int min, int max, int fallback,
                       String label, List<String> warnings) {
        String text = fieldExtractor.extract(raw, field);
        if (text.isEmpty()) {
            return fallback;
        }
        Optional<Integer> parsed = parseWholeNumber(text);
        if (parsed.isEmpty()) {
            warnings.add("Invalid " + label + " '" + text + "'; using " + fallback);
            return fallback;
        }
        int value = parsed.get();
        if (value < min || value > max) {
            warnings.add(capitalize(label) + " " + value + " outside " + min + "-" + max + "; using " + fallback);
            return fallback;
        }
        return value;
    }

    // Accepts "2024" as well as spreadsheet-style "2024.0".
    static Optional<Integer> parseWholeNumber(String text) {
        try {
            return Optional.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            try {
                return Optional.of(new BigDecimal(text).intValueExact());
            } catch (NumberFormatException | ArithmeticException ex) {
                return Optional.empty();
            }
        }
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
