package com.peopleanalytics.dashboard.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Firm-wide daily totals. Averages are taken over the days that have entries.
 */
public record TrendsResponse(
        LocalDate startDate,
        LocalDate endDate,
        List<DailyTotal> days,
        BigDecimal averageDailyHours,
        BigDecimal averageDailyBillableHours,
        BigDecimal periodUtilizationRate
) {
}
