package com.componenttracker.service;

import com.componenttracker.model.CanonicalField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Source column names accepted for each canonical field, in lookup priority order.
 * The same table applies to CSV headers, spreadsheet headers and JSON keys.
 */
public final class FieldAliasTable {

    private static final Map<CanonicalField, List<String>> ALIASES;

    static {
        Map<CanonicalField, List<String>> aliases = new EnumMap<>(CanonicalField.class);
        aliases.put(CanonicalField.EXTERNAL_KEY, List.of(
                "componentId", "component_id", "Component ID", "externalKey", "external_key",
                "slug", "identifier", "id"));
        aliases.put(CanonicalField.COMPONENT_LABEL, List.of(
                "name", "component_name", "componentName", "Component Name", "title"));
        aliases.put(CanonicalField.TOWER_NAME, List.of(
                "tower", "tower_name", "towerName", "Tower", "Tower Name", "domain", "area"));
        aliases.put(CanonicalField.APP_GROUP, List.of(
                "appGroup", "app_group", "App Group", "owner", "Owner", "team"));
        aliases.put(CanonicalField.COMPONENT_TYPE, List.of(
                "componentType", "component_type", "Component Type", "type"));
        aliases.put(CanonicalField.COMPLEXITY, List.of(
                "complexity", "level", "difficulty", "size", "Complexity"));
        aliases.put(CanonicalField.STATUS, List.of(
                "status", "state", "phase", "stage", "Status"));
        aliases.put(CanonicalField.CHANGE_TYPE, List.of(
                "changeType", "change_type", "Change Type"));
        aliases.put(CanonicalField.MONTH, List.of("month", "Month"));
        aliases.put(CanonicalField.YEAR, List.of("year", "Year"));
        aliases.put(CanonicalField.DESCRIPTION, List.of(
                "description", "desc", "details", "summary", "Description"));
        aliases.put(CanonicalField.RELEASE_DATE, List.of(
                "releaseDate", "release_date", "Release Date"));
        ALIASES = Collections.unmodifiableMap(aliases);
    }

    private FieldAliasTable() {
    }

    public static List<String> aliasesFor(CanonicalField field) {
        return ALIASES.get(field);
    }

    public static Map<CanonicalField, List<String>> all() {
        return ALIASES;
    }
}
