package com.peopleanalytics.importjob.parser;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * One data row of an import file. {@code rowNumber} counts from the header, which is row 0.
 */
public record ImportRow(int rowNumber, Map<String, String> values) {

    /**
     * Trimmed value of the column, or null when the column is missing or blank.
     */
    public String get(String column) {
        String value = values.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String raw() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
