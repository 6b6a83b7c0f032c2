package com.peopleanalytics.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a time entry draft against the time entry rules, including the daily cap computed
 * from the hours already logged for the same employee and date.
 */
@Component
@RequiredArgsConstructor
public class TimeEntryValidator {

    public static final BigDecimal MIN_HOURS = new BigDecimal("0.01");
    public static final BigDecimal MAX_DAILY_HOURS = new BigDecimal("24.00");
    public static final int MIN_DESCRIPTION_LENGTH = 10;
    private static final int MATTER_CODE_MAX_LENGTH = 20;

    private final Clock clock;

    public ValidationResult<ValidatedTimeEntry> validate(TimeEntryDraft draft, TimeEntryValidationContext context) {
        List<Violation> violations = new ArrayList<>();

        if (draft.employeeId() == null) {
            violations.add(Violation.of("employee_id", ViolationCode.REQUIRED, "Employee is required"));
        } else if (!context.employeeExists()) {
            violations.add(Violation.of("employee_id", ViolationCode.EMPLOYEE_NOT_FOUND,
                    "Employee with ID " + draft.employeeId() + " not found"));
        } else if (!context.employeeActive()) {
            violations.add(Violation.of("employee_id", ViolationCode.EMPLOYEE_INACTIVE,
                    "Employee with ID " + draft.employeeId() + " is deleted"));
        }

        if (draft.date() == null) {
            violations.add(Violation.of("date", ViolationCode.REQUIRED, "Date is required"));
        } else if (draft.date().isAfter(LocalDate.now(clock))) {
            violations.add(Violation.of("date", ViolationCode.FUTURE_DATE, "Time entry date cannot be in the future"));
        }

        BigDecimal hours = draft.hours();
        boolean hoursValid = false;
        if (hours == null) {
            violations.add(Violation.of("hours", ViolationCode.REQUIRED, "Hours is required"));
        } else if (hours.compareTo(MIN_HOURS) < 0 || hours.compareTo(MAX_DAILY_HOURS) > 0) {
            violations.add(Violation.of("hours", ViolationCode.OUT_OF_RANGE, "Hours must be between 0.01 and 24.00"));
        } else if (hours.stripTrailingZeros().scale() > 2) {
            violations.add(Violation.of("hours", ViolationCode.INVALID_FORMAT,
                    "Hours must have at most 2 decimal places"));
        } else {
            hoursValid = true;
        }

        String description = draft.description() == null ? "" : draft.description().trim();
        if (description.isEmpty()) {
            violations.add(Violation.of("description", ViolationCode.REQUIRED, "Description is required"));
        } else if (description.length() < MIN_DESCRIPTION_LENGTH) {
            violations.add(Violation.of("description", ViolationCode.TOO_SHORT,
                    "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters"));
        }

        String matterCode = draft.matterCode() == null || draft.matterCode().isBlank()
                ? null : draft.matterCode().trim();
        if (matterCode != null && matterCode.length() > MATTER_CODE_MAX_LENGTH) {
            violations.add(Violation.of("matter_code", ViolationCode.OUT_OF_RANGE,
                    "Matter code must not exceed " + MATTER_CODE_MAX_LENGTH + " characters"));
        }

        if (hoursValid && context.employeeActive()) {
            BigDecimal alreadyLogged = context.existingDailyHours().stream()
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal total = alreadyLogged.add(hours);
            if (total.compareTo(MAX_DAILY_HOURS) > 0) {
                violations.add(Violation.of("hours", ViolationCode.DAILY_LIMIT_EXCEEDED, String.format(
                        "Daily total would be %s hours (%s already logged on %s), maximum is %s",
                        total.setScale(2, RoundingMode.HALF_UP),
                        alreadyLogged.setScale(2, RoundingMode.HALF_UP),
                        draft.date(),
                        MAX_DAILY_HOURS)));
            }
        }

        if (!violations.isEmpty()) {
            return ValidationResult.rejected(violations);
        }

        return ValidationResult.accepted(new ValidatedTimeEntry(
                draft.employeeId(),
                draft.date(),
                hours.setScale(2, RoundingMode.UNNECESSARY),
                description,
                draft.billable(),
                matterCode));
    }
}
