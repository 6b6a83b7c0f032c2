package com.peopleanalytics.validation;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Employee values that passed every rule, normalized for persistence.
 */
public record ValidatedEmployee(
        String name,
        String email,
        UUID departmentId,
        String position,
        LocalDate hireDate
) {
}
