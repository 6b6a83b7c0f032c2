package com.peopleanalytics.timeentry.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

public record TimeEntryResponse(
        UUID id,
        UUID employeeId,
        LocalDate date,
        BigDecimal hours,
        String description,
        boolean billable,
        String matterCode,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
