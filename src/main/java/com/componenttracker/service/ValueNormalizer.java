package com.componenttracker.service;

import com.componenttracker.model.CanonicalComplexity;
import com.componenttracker.model.CanonicalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Maps free-text status, complexity and date values onto the canonical vocabulary.
 * Unrecognized input yields an empty result and never an exception; callers pick the fallback.
 */
@Service
public class ValueNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ValueNormalizer.class);

    public static final List<String> DEFAULT_DATE_PATTERNS = List.of(
            "yyyy-MM-dd", "M/d/yyyy", "yyyy/MM/dd", "d-MMM-yyyy", "yyyy-MM-dd'T'HH:mm:ss");

    // Both the five-value lifecycle (planning/development/testing/deployed/deprecated)
    // and the three-value release vocabulary land here.
    private static final Map<String, CanonicalStatus> STATUS_SYNONYMS = synonyms(Map.of(
            CanonicalStatus.RELEASED, List.of(
                    "released", "release", "live", "production", "prod", "deployed", "deploy",
                    "complete", "completed", "done", "finished", "deprecated"),
            CanonicalStatus.IN_DEVELOPMENT, List.of(
                    "in development", "in-development", "development", "dev", "in progress",
                    "in-progress", "inprogress", "progress", "active", "working", "testing",
                    "test", "qa", "uat"),
            CanonicalStatus.PLANNED, List.of(
                    "planned", "planning", "plan", "pending", "future", "scheduled", "upcoming",
                    "backlog", "new", "proposed")
    ));

    // Legacy Simple/Complex naming maps onto Low/High.
    private static final Map<String, CanonicalComplexity> COMPLEXITY_SYNONYMS = synonyms(Map.of(
            CanonicalComplexity.LOW, List.of("low", "simple", "easy", "basic", "1"),
            CanonicalComplexity.MEDIUM, List.of("medium", "moderate", "med", "mid", "intermediate", "2"),
            CanonicalComplexity.HIGH, List.of("high", "complex", "hard", "difficult", "advanced", "3")
    ));

    private final List<DateTimeFormatter> dateFormatters;

    public ValueNormalizer(@Value("${app.ingestion.date-formats:yyyy-MM-dd,M/d/yyyy,yyyy/MM/dd,d-MMM-yyyy,yyyy-MM-dd'T'HH:mm:ss}")
                           List<String> datePatterns) {
        List<String> patterns = datePatterns == null || datePatterns.isEmpty() ? DEFAULT_DATE_PATTERNS : datePatterns;
        this.dateFormatters = patterns.stream().map(ValueNormalizer::formatter).toList();
    }

    public Optional<CanonicalStatus> normalizeStatus(String raw) {
        return lookup(raw, STATUS_SYNONYMS);
    }

    public Optional<CanonicalComplexity> normalizeComplexity(String raw) {
        return lookup(raw, COMPLEXITY_SYNONYMS);
    }

    /**
     * Parses {@code raw} with the configured patterns.
     */
    public Optional<LocalDate> normalizeDate(String raw) {
        return parseDate(raw, dateFormatters);
    }

    /**
     * Tries each pattern in order and returns the first successful parse.
     */
    public Optional<LocalDate> normalizeDate(String raw, List<String> patterns) {
        return parseDate(raw, patterns.stream().map(ValueNormalizer::formatter).toList());
    }

    private static Optional<LocalDate> parseDate(String raw, List<DateTimeFormatter> formatters) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException e) {
                logger.trace("Date '{}' did not match {}", text, formatter);
            }
        }
        return Optional.empty();
    }

    /**
     * Exact match on the folded input first, then a synonym that opens the text as whole words,
     * longest first. "Released to prod" resolves; "donezo", "not released" and
     * "pre-production" do not.
     */
    private static <T> Optional<T> lookup(String raw, Map<String, T> table) {
        if (raw == null) {
            return Optional.empty();
        }
        String folded = fold(raw);
        if (folded.isEmpty()) {
            return Optional.empty();
        }
        T exact = table.get(folded);
        if (exact != null) {
            return Optional.of(exact);
        }
        String padded = folded + " ";
        for (Map.Entry<String, T> entry : table.entrySet()) {
            if (padded.startsWith(entry.getKey() + " ")) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static String fold(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    // Longest phrases first so "in progress" is tried before "progress".
    private static <T> Map<String, T> synonyms(Map<T, List<String>> byValue) {
        List<Map.Entry<String, T>> entries = new ArrayList<>();
        byValue.forEach((value, words) -> words.forEach(w -> entries.add(Map.entry(fold(w), value))));
        entries.sort(Comparator.comparingInt((Map.Entry<String, T> e) -> e.getKey().length()).reversed()
                .thenComparing(e -> e.getKey()));
        Map<String, T> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, T> entry : entries) {
            ordered.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(ordered);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }
}
