package com.peopleanalytics.dashboard.dto.response;

import com.peopleanalytics.dashboard.model.SummaryScope;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Aggregated hours for a scope and date range. Utilization is billable over total hours, 0 when
 * nothing was logged.
 */
public record Summary(
        SummaryScope scope,
        UUID scopeId,
        String scopeName,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal totalHours,
        BigDecimal billableHours,
        BigDecimal nonBillableHours,
        BigDecimal utilizationRate,
        int entryCount,
        List<DepartmentSummary> departments,
        List<EmployeeSummary> employees,
        int unassignedEmployeeCount,
        BigDecimal unassignedHours
) {
}
