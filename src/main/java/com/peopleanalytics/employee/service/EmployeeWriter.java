package com.peopleanalytics.employee.service;

import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.validation.EmployeeDraft;
import com.peopleanalytics.validation.EmployeeValidationContext;
import com.peopleanalytics.validation.EmployeeValidator;
import com.peopleanalytics.validation.ValidatedEmployee;
import com.peopleanalytics.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Validate-then-save for employees in one transaction. Callers hold the email lock around these
 * calls so the uniqueness check and the insert cannot interleave with another writer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmployeeWriter {

    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final EmployeeValidator employeeValidator;

    @Transactional
    public ValidationResult<Employee> create(EmployeeDraft draft) {
        String email = EmployeeValidator.normalizeEmail(draft.email());
        EmployeeValidationContext context = new EmployeeValidationContext(
                departmentExists(draft.departmentId()),
                email != null && employeeRepository.existsByEmailAndDeletedAtIsNull(email));

        ValidationResult<ValidatedEmployee> result = employeeValidator.validate(draft, context);
        if (!result.isValid()) {
            return result.asRejected();
        }

        ValidatedEmployee valid = result.getValue();
        Employee employee = Employee.builder()
                .name(valid.name())
                .email(valid.email())
                .departmentId(valid.departmentId())
                .position(valid.position())
                .hireDate(valid.hireDate())
                .build();
        Employee saved = employeeRepository.save(employee);
        log.info("Employee created: {} ({})", saved.getId(), saved.getEmail());
        return ValidationResult.accepted(saved);
    }

    @Transactional
    public ValidationResult<Employee> update(UUID employeeId, EmployeeDraft draft) {
        Employee existing = employeeRepository.findByIdAndDeletedAtIsNull(employeeId)
                .orElseThrow(() -> ResourceNotFoundException.of("Employee", employeeId));
        String email = EmployeeValidator.normalizeEmail(draft.email());
        EmployeeValidationContext context = new EmployeeValidationContext(
                departmentExists(draft.departmentId()),
                email != null && employeeRepository.existsByEmailAndDeletedAtIsNullAndIdNot(email, existing.getId()));

        ValidationResult<ValidatedEmployee> result = employeeValidator.validate(draft, context);
        if (!result.isValid()) {
            return result.asRejected();
        }

        ValidatedEmployee valid = result.getValue();
        existing.setName(valid.name());
        existing.setEmail(valid.email());
        existing.setDepartmentId(valid.departmentId());
        existing.setPosition(valid.position());
        existing.setHireDate(valid.hireDate());
        Employee saved = employeeRepository.save(existing);
        log.info("Employee updated: {}", saved.getId());
        return ValidationResult.accepted(saved);
    }

    private boolean departmentExists(UUID departmentId) {
        return departmentId != null && departmentRepository.existsById(departmentId);
    }
}
