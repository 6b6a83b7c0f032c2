package com.peopleanalytics.importjob.service;

import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.service.EmployeeWriter;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.parser.ImportRow;
import com.peopleanalytics.lock.EmployeeLockService;
import com.peopleanalytics.search.EmployeeIndexer;
import com.peopleanalytics.validation.EmployeeDraft;
import com.peopleanalytics.validation.EmployeeValidator;
import com.peopleanalytics.validation.ValidationResult;
import com.peopleanalytics.validation.Violation;
import com.peopleanalytics.validation.ViolationCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Columns: name, email, hire_date, optional department (name of an existing department) and
 * position.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmployeeRowImporter implements RowImporter {

    private final DepartmentRepository departmentRepository;
    private final EmployeeWriter employeeWriter;
    private final EmployeeLockService lockService;
    private final EmployeeIndexer employeeIndexer;

    @Override
    public ImportJobKind kind() {
        return ImportJobKind.EMPLOYEES;
    }

    @Override
    public RowOutcome importRow(ImportRow row, Set<String> batchKeys) {
        List<Violation> violations = new ArrayList<>();

        LocalDate hireDate = null;
        String hireDateValue = row.get("hire_date");
        if (hireDateValue != null) {
            try {
                hireDate = LocalDate.parse(hireDateValue);
            } catch (DateTimeParseException e) {
                violations.add(Violation.of("hire_date", ViolationCode.INVALID_FORMAT,
                        "Hire date must be in yyyy-MM-dd format"));
            }
        }

        UUID departmentId = null;
        String departmentName = row.get("department");
        if (departmentName != null) {
            Optional<Department> department = departmentRepository.findByNameIgnoreCase(departmentName);
            if (department.isPresent()) {
                departmentId = department.get().getId();
            } else {
                violations.add(Violation.of("department", ViolationCode.DEPARTMENT_NOT_FOUND,
                        "Department '" + departmentName + "' does not exist"));
            }
        }

        if (!violations.isEmpty()) {
            return RowOutcome.rejected(violations);
        }

        String email = EmployeeValidator.normalizeEmail(row.get("email"));
        if (email != null && batchKeys.contains(email)) {
            return RowOutcome.rejected(List.of(Violation.of("email", ViolationCode.DUPLICATE_IN_BATCH,
                    "Email " + email + " already appears earlier in this file")));
        }

        EmployeeDraft draft = new EmployeeDraft(row.get("name"), email, departmentId, row.get("position"), hireDate);
        ValidationResult<Employee> result = email == null
                ? employeeWriter.create(draft)
                : lockService.withLock(EmployeeLockService.emailKey(email), () -> employeeWriter.create(draft));
        if (!result.isValid()) {
            return RowOutcome.rejected(result);
        }

        batchKeys.add(email);
        employeeIndexer.indexQuietly(result.getValue());
        return RowOutcome.success();
    }
}
