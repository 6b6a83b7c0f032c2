package com.peopleanalytics.dashboard.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyTotal(
        LocalDate date,
        BigDecimal totalHours,
        BigDecimal billableHours,
        BigDecimal nonBillableHours,
        BigDecimal utilizationRate,
        int entryCount
) {
}
