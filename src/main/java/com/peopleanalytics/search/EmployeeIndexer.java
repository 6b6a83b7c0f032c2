package com.peopleanalytics.search;

import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Pushes employee changes to the search index. Index failures are logged and swallowed so they
 * never roll back or fail the employee write that triggered them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmployeeIndexer {

    private final EmployeeSearchIndex searchIndex;
    private final DepartmentRepository departmentRepository;

    public void indexQuietly(Employee employee) {
        try {
            String departmentName = employee.getDepartmentId() == null ? null
                    : departmentRepository.findById(employee.getDepartmentId())
                    .map(Department::getName)
                    .orElse(null);
            searchIndex.upsert(toDocument(employee, departmentName));
        } catch (RuntimeException e) {
            log.warn("Failed to index employee {}: {}", employee.getId(), e.getMessage());
        }
    }

    /**
     * Replaces the whole index with the given employees. A failure to clear the index propagates;
     * a failure on a single document is counted and skipped.
     */
    public ReindexResult rebuild(List<Employee> employees) {
        searchIndex.clear();
        Map<UUID, String> departmentNames = departmentRepository.findAll().stream()
                .collect(Collectors.toMap(Department::getId, Department::getName));

        int indexed = 0;
        int failed = 0;
        for (Employee employee : employees) {
            try {
                searchIndex.upsert(toDocument(employee, departmentNames.get(employee.getDepartmentId())));
                indexed++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to reindex employee {}: {}", employee.getId(), e.getMessage());
            }
        }
        log.info("Rebuilt employee index: {} indexed, {} failed", indexed, failed);
        return new ReindexResult(indexed, failed);
    }

    public void removeQuietly(UUID employeeId) {
        try {
            searchIndex.remove(employeeId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove employee {} from index: {}", employeeId, e.getMessage());
        }
    }

    private static EmployeeDocument toDocument(Employee employee, String departmentName) {
        return new EmployeeDocument(
                employee.getId(),
                employee.getName(),
                employee.getEmail(),
                employee.getDepartmentId(),
                departmentName,
                employee.getPosition(),
                employee.getHireDate()
        );
    }
}
