package com.peopleanalytics.timeentry.dto.request;

import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of a time entry; the owning employee cannot change.
 */
public record UpdateTimeEntryRequest(
        LocalDate date,

        BigDecimal hours,

        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        Boolean billable,

        String matterCode
) {
}
