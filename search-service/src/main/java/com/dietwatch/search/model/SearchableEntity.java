package com.dietwatch.search.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A record as read from the structured store. The engine never writes it back.
 */
public record SearchableEntity(
        String id,
        Map<String, String> textFields,
        Map<String, Object> metadata,
        long version
) {

    public SearchableEntity {
        textFields = textFields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(textFields));
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Text fields joined in insertion order, which is the text that gets embedded.
     */
    public String concatenatedText() {
        return textFields.values().stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .collect(Collectors.joining("\n"));
    }

    public String category() {
        Object value = metadata.get("category");
        return value == null ? null : value.toString();
    }

    public String status() {
        Object value = metadata.get("status");
        return value == null ? null : value.toString();
    }

    public LocalDate date() {
        return parseDate(metadata.get("date"));
    }

    public static LocalDate parseDate(Object raw) {
        if (raw instanceof LocalDate localDate) {
            return localDate;
        }
        if (raw == null) {
            return null;
        }
        String text = raw.toString().trim();
        if (text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
