package com.peopleanalytics.search;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Searchable projection of an employee as stored in the index.
 */
public record EmployeeDocument(
        UUID id,
        String name,
        String email,
        UUID departmentId,
        String departmentName,
        String position,
        LocalDate hireDate
) {
}
