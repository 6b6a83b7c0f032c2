package com.peopleanalytics.dashboard.dto.response;

import java.math.BigDecimal;
import java.util.UUID;

public record EmployeeSummary(
        UUID employeeId,
        String name,
        String email,
        UUID departmentId,
        String departmentName,
        boolean active,
        BigDecimal totalHours,
        BigDecimal billableHours,
        BigDecimal nonBillableHours,
        BigDecimal utilizationRate,
        int entryCount
) {
}
