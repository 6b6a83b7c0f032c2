package com.peopleanalytics.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TimeEntryValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);
    private static final LocalDate ENTRY_DATE = LocalDate.of(2024, 1, 10);

    private TimeEntryValidator validator;
    private UUID employeeId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T09:00:00Z"), ZoneOffset.UTC);
        validator = new TimeEntryValidator(clock);
        employeeId = UUID.randomUUID();
    }

    @Test
    void shouldRejectEntryThatPushesDailyTotalOverLimit() {
        // Arrange
        TimeEntryDraft draft = draft(new BigDecimal("5.00"));
        TimeEntryValidationContext context = active(List.of(new BigDecimal("20.00")));

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, context);

        // Assert
        assertFalse(result.isValid());
        assertEquals(1, result.getViolations().size());
        Violation violation = result.getViolations().get(0);
        assertEquals("hours", violation.field());
        assertEquals(ViolationCode.DAILY_LIMIT_EXCEEDED, violation.code());
        assertEquals(ViolationCategory.VALIDATION, violation.category());
    }

    @Test
    void shouldAcceptEntryThatStaysWithinDailyLimit() {
        // Arrange
        TimeEntryDraft draft = draft(new BigDecimal("3.00"));
        TimeEntryValidationContext context = active(List.of(new BigDecimal("20.00")));

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, context);

        // Assert
        assertTrue(result.isValid());
        assertEquals(new BigDecimal("3.00"), result.getValue().hours());
    }

    @Test
    void shouldAcceptEntryThatReachesExactlyTwentyFourHours() {
        // Arrange
        TimeEntryDraft draft = draft(new BigDecimal("4"));
        TimeEntryValidationContext context = active(List.of(new BigDecimal("12.50"), new BigDecimal("7.50")));

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, context);

        // Assert
        assertTrue(result.isValid());
        assertEquals(new BigDecimal("4.00"), result.getValue().hours());
    }

    @Test
    void shouldRejectHoursOutOfRange() {
        // Act
        ValidationResult<ValidatedTimeEntry> zero = validator.validate(draft(BigDecimal.ZERO), active(List.of()));
        ValidationResult<ValidatedTimeEntry> tooMany = validator.validate(draft(new BigDecimal("24.01")), active(List.of()));

        // Assert
        assertEquals(ViolationCode.OUT_OF_RANGE, zero.getViolations().get(0).code());
        assertEquals(ViolationCode.OUT_OF_RANGE, tooMany.getViolations().get(0).code());
    }

    @Test
    void shouldRejectHoursWithMoreThanTwoDecimals() {
        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft(new BigDecimal("1.255")), active(List.of()));

        // Assert
        assertFalse(result.isValid());
        assertEquals(ViolationCode.INVALID_FORMAT, result.getViolations().get(0).code());
    }

    @Test
    void shouldRejectFutureDateAndShortDescription() {
        // Arrange
        TimeEntryDraft draft = new TimeEntryDraft(employeeId, TODAY.plusDays(1), new BigDecimal("2.00"),
                "too short", true, null);

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, active(List.of()));

        // Assert
        assertFalse(result.isValid());
        assertTrue(result.getViolations().stream()
                .anyMatch(v -> v.field().equals("date") && v.code() == ViolationCode.FUTURE_DATE));
        assertTrue(result.getViolations().stream()
                .anyMatch(v -> v.field().equals("description") && v.code() == ViolationCode.TOO_SHORT));
    }

    @Test
    void shouldAcceptEntryDatedToday() {
        // Arrange
        TimeEntryDraft draft = new TimeEntryDraft(employeeId, TODAY, new BigDecimal("1.5"),
                "Reviewed the supply agreement", false, "  ");

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, active(List.of()));

        // Assert
        assertTrue(result.isValid());
        assertFalse(result.getValue().billable());
        assertNull(result.getValue().matterCode());
        assertEquals(new BigDecimal("1.50"), result.getValue().hours());
    }

    @Test
    void shouldReportMissingEmployeeAsNotFound() {
        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(
                draft(new BigDecimal("2.00")), TimeEntryValidationContext.missingEmployee());

        // Assert
        assertFalse(result.isValid());
        assertEquals(ViolationCode.EMPLOYEE_NOT_FOUND, result.getViolations().get(0).code());
        assertTrue(result.hasCategory(ViolationCategory.NOT_FOUND));
    }

    @Test
    void shouldRejectEntryForDeletedEmployee() {
        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(
                draft(new BigDecimal("2.00")), new TimeEntryValidationContext(true, false, List.of()));

        // Assert
        assertEquals(1, result.getViolations().size());
        assertEquals(ViolationCode.EMPLOYEE_INACTIVE, result.getViolations().get(0).code());
    }

    @Test
    void shouldRejectTooLongMatterCode() {
        // Arrange
        TimeEntryDraft draft = new TimeEntryDraft(employeeId, ENTRY_DATE, new BigDecimal("2.00"),
                "Prepared closing documents", true, "M".repeat(21));

        // Act
        ValidationResult<ValidatedTimeEntry> result = validator.validate(draft, active(List.of()));

        // Assert
        assertEquals("matter_code", result.getViolations().get(0).field());
    }

    private TimeEntryDraft draft(BigDecimal hours) {
        return new TimeEntryDraft(employeeId, ENTRY_DATE, hours, "Drafted the merger memorandum", true, "MTR-1");
    }

    private TimeEntryValidationContext active(List<BigDecimal> existing) {
        return new TimeEntryValidationContext(true, true, existing);
    }
}
