package com.peopleanalytics.dashboard.dto.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Hours of one department in the range. {@code employeeCount} counts employees who logged time.
 */
public record DepartmentSummary(
        UUID departmentId,
        String departmentName,
        int employeeCount,
        BigDecimal totalHours,
        BigDecimal billableHours,
        BigDecimal nonBillableHours,
        BigDecimal utilizationRate
) {
}
