package com.peopleanalytics.timeentry.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CreateTimeEntryRequest(
        @NotNull(message = "Employee is required")
        UUID employeeId,

        @NotNull(message = "Date is required")
        LocalDate date,

        @NotNull(message = "Hours is required")
        BigDecimal hours,

        @NotBlank(message = "Description is required")
        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        Boolean billable,

        String matterCode
) {
}
