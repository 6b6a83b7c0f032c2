package com.peopleanalytics.validation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record ValidatedTimeEntry(
        UUID employeeId,
        LocalDate date,
        BigDecimal hours,
        String description,
        boolean billable,
        String matterCode
) {
}
