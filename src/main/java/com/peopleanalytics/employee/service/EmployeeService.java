package com.peopleanalytics.employee.service;

import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.dto.request.CreateEmployeeRequest;
import com.peopleanalytics.employee.dto.request.UpdateEmployeeRequest;
import com.peopleanalytics.employee.dto.response.EmployeeResponse;
import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.exception.BusinessValidationException;
import com.peopleanalytics.exception.ConflictException;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.lock.EmployeeLockService;
import com.peopleanalytics.search.EmployeeDocument;
import com.peopleanalytics.search.EmployeeIndexer;
import com.peopleanalytics.search.EmployeeSearchIndex;
import com.peopleanalytics.search.ReindexResult;
import com.peopleanalytics.validation.EmployeeDraft;
import com.peopleanalytics.validation.EmployeeValidator;
import com.peopleanalytics.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final EmployeeWriter employeeWriter;
    private final EmployeeLockService lockService;
    private final EmployeeIndexer employeeIndexer;
    private final EmployeeSearchIndex searchIndex;
    private final Clock clock;

    public EmployeeResponse createEmployee(CreateEmployeeRequest request) {
        log.info("Creating employee: {}", request.email());
        EmployeeDraft draft = new EmployeeDraft(
                request.name(),
                request.email(),
                request.departmentId(),
                request.position(),
                request.hireDate()
        );

        String lockKey = EmployeeLockService.emailKey(EmployeeValidator.normalizeEmail(request.email()));
        ValidationResult<Employee> result = lockService.withLock(lockKey, () -> employeeWriter.create(draft));
        Employee employee = unwrap(result);

        employeeIndexer.indexQuietly(employee);
        return toResponse(employee, departmentName(employee.getDepartmentId()));
    }

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployee(UUID employeeId) {
        log.debug("Fetching employee {}", employeeId);
        Employee employee = findActive(employeeId);
        return toResponse(employee, departmentName(employee.getDepartmentId()));
    }

    @Transactional(readOnly = true)
    public Page<EmployeeResponse> getEmployees(UUID departmentId, String search, Pageable pageable) {
        log.debug("Listing employees: department={}, search={}", departmentId, search);
        String term = search == null || search.isBlank() ? null : search.trim();
        Map<UUID, String> departmentNames = departmentRepository.findAll().stream()
                .collect(Collectors.toMap(Department::getId, Department::getName));
        return employeeRepository.findActive(departmentId, term, pageable)
                .map(employee -> toResponse(employee, departmentNames.get(employee.getDepartmentId())));
    }

    public EmployeeResponse updateEmployee(UUID employeeId, UpdateEmployeeRequest request) {
        log.info("Updating employee {}", employeeId);
        boolean clearDepartment = Boolean.TRUE.equals(request.clearDepartment());
        if (clearDepartment && request.departmentId() != null) {
            throw new IllegalArgumentException("departmentId and clearDepartment cannot be combined");
        }

        Employee current = findActive(employeeId);
        UUID departmentId = clearDepartment ? null
                : request.departmentId() != null ? request.departmentId() : current.getDepartmentId();
        EmployeeDraft draft = new EmployeeDraft(
                request.name() != null ? request.name() : current.getName(),
                request.email() != null ? request.email() : current.getEmail(),
                departmentId,
                request.position() != null ? request.position() : current.getPosition(),
                request.hireDate() != null ? request.hireDate() : current.getHireDate()
        );

        String lockKey = EmployeeLockService.emailKey(EmployeeValidator.normalizeEmail(draft.email()));
        ValidationResult<Employee> result = lockService.withLock(lockKey,
                () -> employeeWriter.update(employeeId, draft));
        Employee employee = unwrap(result);

        employeeIndexer.indexQuietly(employee);
        return toResponse(employee, departmentName(employee.getDepartmentId()));
    }

    /**
     * Soft delete. Time entries of the employee are kept for historical reporting.
     */
    @Transactional
    public void deleteEmployee(UUID employeeId) {
        log.info("Deleting employee {}", employeeId);
        Employee employee = findActive(employeeId);
        employee.setDeletedAt(LocalDateTime.now(clock));
        employeeRepository.save(employee);
        employeeIndexer.removeQuietly(employeeId);
        log.info("Employee {} deleted", employeeId);
    }

    public EmployeeResponse restoreEmployee(UUID employeeId) {
        log.info("Restoring employee {}", employeeId);
        Employee deleted = employeeRepository.findById(employeeId)
                .filter(Employee::isDeleted)
                .orElseThrow(() -> new ResourceNotFoundException("Deleted employee with ID " + employeeId + " not found"));

        Employee restored = lockService.withLock(EmployeeLockService.emailKey(deleted.getEmail()), () -> {
            if (employeeRepository.existsByEmailAndDeletedAtIsNull(deleted.getEmail())) {
                throw new ConflictException("EMAIL_ALREADY_EXISTS",
                        "Another active employee already uses " + deleted.getEmail());
            }
            deleted.setDeletedAt(null);
            return employeeRepository.save(deleted);
        });

        employeeIndexer.indexQuietly(restored);
        return toResponse(restored, departmentName(restored.getDepartmentId()));
    }

    public List<EmployeeDocument> searchEmployees(String query, int limit) {
        if (query == null || query.trim().length() < 2) {
            throw new IllegalArgumentException("Search query must be at least 2 characters");
        }
        if (limit < 1 || limit > 50) {
            throw new IllegalArgumentException("Limit must be between 1 and 50");
        }
        log.debug("Searching employees: {}", query);
        return searchIndex.search(query, limit);
    }

    /**
     * Rebuilds the search index from the active employees in the database.
     */
    @Transactional(readOnly = true)
    public ReindexResult reindexSearch() {
        log.info("Rebuilding employee search index");
        return employeeIndexer.rebuild(employeeRepository.findAllByDeletedAtIsNull());
    }

    private Employee findActive(UUID employeeId) {
        return employeeRepository.findByIdAndDeletedAtIsNull(employeeId)
                .orElseThrow(() -> ResourceNotFoundException.of("Employee", employeeId));
    }

    private Employee unwrap(ValidationResult<Employee> result) {
        if (!result.isValid()) {
            throw new BusinessValidationException(result.getViolations());
        }
        return result.getValue();
    }

    private String departmentName(UUID departmentId) {
        if (departmentId == null) {
            return null;
        }
        return departmentRepository.findById(departmentId).map(Department::getName).orElse(null);
    }

    private EmployeeResponse toResponse(Employee employee, String departmentName) {
        return new EmployeeResponse(
                employee.getId(),
                employee.getName(),
                employee.getEmail(),
                employee.getDepartmentId(),
                departmentName,
                employee.getPosition(),
                employee.getHireDate(),
                !employee.isDeleted(),
                employee.getCreatedAt(),
                employee.getUpdatedAt()
        );
    }
}
