package com.peopleanalytics.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks an employee draft against the employee rules. Works only on the draft and the supplied
 * context; persisted state is never read here.
 */
@Component
@RequiredArgsConstructor
public class EmployeeValidator {

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
                    + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)+$");

    private static final int NAME_MAX_LENGTH = 100;
    private static final int EMAIL_MAX_LENGTH = 255;
    private static final int POSITION_MAX_LENGTH = 100;

    private final Clock clock;

    public ValidationResult<ValidatedEmployee> validate(EmployeeDraft draft, EmployeeValidationContext context) {
        List<Violation> violations = new ArrayList<>();

        String name = normalizeName(draft.name());
        if (name == null) {
            violations.add(Violation.of("name", ViolationCode.REQUIRED, "Name is required"));
        } else if (name.split(" ").length < 2) {
            violations.add(Violation.of("name", ViolationCode.INVALID_FORMAT,
                    "Name must contain first and last name"));
        } else if (name.length() > NAME_MAX_LENGTH) {
            violations.add(Violation.of("name", ViolationCode.OUT_OF_RANGE,
                    "Name must not exceed " + NAME_MAX_LENGTH + " characters"));
        }

        String email = normalizeEmail(draft.email());
        if (email == null) {
            violations.add(Violation.of("email", ViolationCode.REQUIRED, "Email is required"));
        } else if (email.length() > EMAIL_MAX_LENGTH) {
            violations.add(Violation.of("email", ViolationCode.OUT_OF_RANGE,
                    "Email must not exceed " + EMAIL_MAX_LENGTH + " characters"));
        } else if (!EMAIL_PATTERN.matcher(email).matches()) {
            violations.add(Violation.of("email", ViolationCode.INVALID_FORMAT, "Invalid email format"));
        } else if (context.emailInUse()) {
            violations.add(Violation.of("email", ViolationCode.DUPLICATE_EMAIL,
                    "Employee with email " + email + " already exists"));
        }

        LocalDate today = LocalDate.now(clock);
        if (draft.hireDate() == null) {
            violations.add(Violation.of("hire_date", ViolationCode.REQUIRED, "Hire date is required"));
        } else if (draft.hireDate().isAfter(today)) {
            violations.add(Violation.of("hire_date", ViolationCode.FUTURE_DATE, "Hire date cannot be in the future"));
        }

        String position = draft.position() == null || draft.position().isBlank() ? null : draft.position().trim();
        if (position != null && position.length() > POSITION_MAX_LENGTH) {
            violations.add(Violation.of("position", ViolationCode.OUT_OF_RANGE,
                    "Position must not exceed " + POSITION_MAX_LENGTH + " characters"));
        }

        if (draft.departmentId() != null && !context.departmentExists()) {
            violations.add(Violation.of("department_id", ViolationCode.DEPARTMENT_NOT_FOUND,
                    "Department with ID " + draft.departmentId() + " not found"));
        }

        if (!violations.isEmpty()) {
            return ValidationResult.rejected(violations);
        }

        return ValidationResult.accepted(
                new ValidatedEmployee(name, email, draft.departmentId(), position, draft.hireDate()));
    }

    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.trim().replaceAll("\\s+", " ");
    }
}
