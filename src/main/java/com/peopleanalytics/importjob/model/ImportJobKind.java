package com.peopleanalytics.importjob.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public enum ImportJobKind {

    EMPLOYEES("employees", List.of("name", "email", "hire_date")),
    TIME_ENTRIES("time-entries", List.of("date", "hours", "description"));

    private final String slug;
    private final List<String> requiredColumns;

    ImportJobKind(String slug, List<String> requiredColumns) {
        this.slug = slug;
        this.requiredColumns = requiredColumns;
    }

    public String getSlug() {
        return slug;
    }

    /**
     * Required columns absent from the given normalized header. Time-entry files also need one of
     * {@code employee_id} or {@code employee_email}.
     */
    public List<String> missingColumns(Set<String> headers) {
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns) {
            if (!headers.contains(column)) {
                missing.add(column);
            }
        }
        if (this == TIME_ENTRIES && !headers.contains("employee_id") && !headers.contains("employee_email")) {
            missing.add(0, "employee_id|employee_email");
        }
        return missing;
    }

    public static ImportJobKind fromSlug(String slug) {
        for (ImportJobKind kind : values()) {
            if (kind.slug.equalsIgnoreCase(slug)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown import kind: " + slug);
    }
}
