package com.peopleanalytics.validation;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Candidate employee values as received from the API or an import row.
 */
public record EmployeeDraft(
        String name,
        String email,
        UUID departmentId,
        String position,
        LocalDate hireDate
) {
}
