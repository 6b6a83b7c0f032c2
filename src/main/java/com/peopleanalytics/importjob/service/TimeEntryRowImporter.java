package com.peopleanalytics.importjob.service;

import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.parser.ImportRow;
import com.peopleanalytics.lock.EmployeeLockService;
import com.peopleanalytics.timeentry.model.TimeEntry;
import com.peopleanalytics.timeentry.service.TimeEntryWriter;
import com.peopleanalytics.validation.EmployeeValidator;
import com.peopleanalytics.validation.TimeEntryDraft;
import com.peopleanalytics.validation.ValidationResult;
import com.peopleanalytics.validation.Violation;
import com.peopleanalytics.validation.ViolationCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Columns: date, hours, description, employee_id or employee_email, optional billable and
 * matter_code. An employee_id wins over an employee_email when both are filled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeEntryRowImporter implements RowImporter {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0");

    private final EmployeeRepository employeeRepository;
    private final TimeEntryWriter timeEntryWriter;
    private final EmployeeLockService lockService;

    @Override
    public ImportJobKind kind() {
        return ImportJobKind.TIME_ENTRIES;
    }

    @Override
    public RowOutcome importRow(ImportRow row, Set<String> batchKeys) {
        List<Violation> violations = new ArrayList<>();

        UUID employeeId = resolveEmployee(row, violations);

        LocalDate date = null;
        String dateValue = row.get("date");
        if (dateValue != null) {
            try {
                date = LocalDate.parse(dateValue);
            } catch (DateTimeParseException e) {
                violations.add(Violation.of("date", ViolationCode.INVALID_FORMAT, "Date must be in yyyy-MM-dd format"));
            }
        }

        BigDecimal hours = null;
        String hoursValue = row.get("hours");
        if (hoursValue != null) {
            try {
                hours = new BigDecimal(hoursValue);
            } catch (NumberFormatException e) {
                violations.add(Violation.of("hours", ViolationCode.INVALID_FORMAT, "Hours must be a number"));
            }
        }

        boolean billable = true;
        String billableValue = row.get("billable");
        if (billableValue != null) {
            String normalized = billableValue.toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(normalized)) {
                billable = true;
            } else if (FALSE_VALUES.contains(normalized)) {
                billable = false;
            } else {
                violations.add(Violation.of("billable", ViolationCode.INVALID_FORMAT,
                        "Billable must be one of true, false, yes, no, 1, 0"));
            }
        }

        if (!violations.isEmpty()) {
            return RowOutcome.rejected(violations);
        }

        String description = row.get("description");
        String batchKey = batchKey(employeeId, date, description);
        if (batchKey != null && batchKeys.contains(batchKey)) {
            return RowOutcome.rejected(List.of(Violation.of("description", ViolationCode.DUPLICATE_IN_BATCH,
                    "Same employee, date and description already appear earlier in this file")));
        }

        TimeEntryDraft draft = new TimeEntryDraft(employeeId, date, hours, description, billable, row.get("matter_code"));
        ValidationResult<TimeEntry> result = employeeId == null
                ? timeEntryWriter.create(draft)
                : lockService.withLock(EmployeeLockService.employeeKey(employeeId), () -> timeEntryWriter.create(draft));
        if (!result.isValid()) {
            return RowOutcome.rejected(result);
        }

        if (batchKey != null) {
            batchKeys.add(batchKey);
        }
        return RowOutcome.success();
    }

    private UUID resolveEmployee(ImportRow row, List<Violation> violations) {
        String idValue = row.get("employee_id");
        if (idValue != null) {
            try {
                return UUID.fromString(idValue);
            } catch (IllegalArgumentException e) {
                violations.add(Violation.of("employee_id", ViolationCode.INVALID_FORMAT, "Employee id must be a UUID"));
                return null;
            }
        }

        String email = EmployeeValidator.normalizeEmail(row.get("employee_email"));
        if (email == null) {
            violations.add(Violation.of("employee_id", ViolationCode.REQUIRED,
                    "Either employee_id or employee_email is required"));
            return null;
        }
        return employeeRepository.findByEmailAndDeletedAtIsNull(email)
                .map(Employee::getId)
                .orElseGet(() -> {
                    violations.add(Violation.of("employee_email", ViolationCode.EMPLOYEE_NOT_FOUND,
                            "No active employee with email " + email));
                    return null;
                });
    }

    private static String batchKey(UUID employeeId, LocalDate date, String description) {
        if (employeeId == null || date == null || description == null) {
            return null;
        }
        return employeeId + "|" + date + "|" + description.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
