package com.peopleanalytics.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EmployeeValidatorTest {

    private EmployeeValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EmployeeValidator(Clock.fixed(Instant.parse("2024-01-15T09:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldNormalizeAcceptedEmployee() {
        // Arrange
        UUID departmentId = UUID.randomUUID();
        EmployeeDraft draft = new EmployeeDraft("  Jane   Smith ", " Jane.Smith@Example.COM ", departmentId,
                " Associate ", LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(true, false));

        // Assert
        assertTrue(result.isValid());
        ValidatedEmployee employee = result.getValue();
        assertEquals("Jane Smith", employee.name());
        assertEquals("jane.smith@example.com", employee.email());
        assertEquals("Associate", employee.position());
        assertEquals(departmentId, employee.departmentId());
    }

    @Test
    void shouldRequireFirstAndLastName() {
        // Arrange
        EmployeeDraft draft = new EmployeeDraft("Cher", "cher@example.com", null, null, LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, false));

        // Assert
        assertFalse(result.isValid());
        assertEquals("name", result.getViolations().get(0).field());
        assertEquals(ViolationCode.INVALID_FORMAT, result.getViolations().get(0).code());
    }

    @Test
    void shouldRejectInvalidEmailAndFutureHireDate() {
        // Arrange
        EmployeeDraft draft = new EmployeeDraft("Jane Smith", "not-an-email", null, null, LocalDate.of(2024, 1, 16));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, false));

        // Assert
        assertEquals(2, result.getViolations().size());
        assertEquals(ViolationCode.INVALID_FORMAT, result.getViolations().get(0).code());
        assertEquals(ViolationCode.FUTURE_DATE, result.getViolations().get(1).code());
    }

    @Test
    void shouldReportEmailInUseAsConflict() {
        // Arrange
        EmployeeDraft draft = new EmployeeDraft("Jane Smith", "jane@example.com", null, null, LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, true));

        // Assert
        assertEquals(ViolationCode.DUPLICATE_EMAIL, result.getViolations().get(0).code());
        assertTrue(result.hasCategory(ViolationCategory.CONFLICT));
    }

    @Test
    void shouldReportUnknownDepartment() {
        // Arrange
        EmployeeDraft draft = new EmployeeDraft("Jane Smith", "jane@example.com", UUID.randomUUID(), null,
                LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, false));

        // Assert
        assertEquals("department_id", result.getViolations().get(0).field());
        assertEquals(ViolationCategory.NOT_FOUND, result.getViolations().get(0).category());
    }

    @Test
    void shouldRequireEmailAndHireDate() {
        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(
                new EmployeeDraft("Jane Smith", " ", null, null, null), new EmployeeValidationContext(false, false));

        // Assert
        assertEquals(2, result.getViolations().size());
        assertTrue(result.getViolations().stream().allMatch(v -> v.code() == ViolationCode.REQUIRED));
        assertEquals("email: Email is required; hire_date: Hire date is required", result.describe());
    }

    @Test
    void shouldRejectPositionLongerThanColumn() {
        // Arrange
        EmployeeDraft draft = new EmployeeDraft("Jane Smith", "jane@example.com", null, "P".repeat(150),
                LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, false));

        // Assert
        assertFalse(result.isValid());
        assertEquals("position", result.getViolations().get(0).field());
        assertEquals(ViolationCode.OUT_OF_RANGE, result.getViolations().get(0).code());
    }

    @Test
    void shouldRejectEmailLongerThanColumn() {
        // Arrange
        String email = "a".repeat(60) + "@" + "b".repeat(60) + "." + "c".repeat(60) + "." + "d".repeat(60)
                + "." + "e".repeat(60) + ".com";
        EmployeeDraft draft = new EmployeeDraft("Jane Smith", email, null, null, LocalDate.of(2023, 5, 1));

        // Act
        ValidationResult<ValidatedEmployee> result = validator.validate(draft, new EmployeeValidationContext(false, false));

        // Assert
        assertFalse(result.isValid());
        assertEquals(1, result.getViolations().size());
        assertEquals("email", result.getViolations().get(0).field());
        assertEquals(ViolationCode.OUT_OF_RANGE, result.getViolations().get(0).code());
    }
}
