package com.peopleanalytics.validation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Persisted state the time entry rules depend on.
 *
 * @param employeeExists     whether the referenced employee row exists at all
 * @param employeeActive     whether that employee is not soft-deleted
 * @param existingDailyHours hours already logged by the employee on the draft's date, excluding the entry being updated
 */
public record TimeEntryValidationContext(
        boolean employeeExists,
        boolean employeeActive,
        List<BigDecimal> existingDailyHours
) {
    public static TimeEntryValidationContext missingEmployee() {
        return new TimeEntryValidationContext(false, false, List.of());
    }
}
