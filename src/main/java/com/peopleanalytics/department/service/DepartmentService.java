package com.peopleanalytics.department.service;

import com.peopleanalytics.department.dto.request.DepartmentRequest;
import com.peopleanalytics.department.dto.response.DepartmentResponse;
import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.exception.ConflictException;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.search.EmployeeIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DepartmentService {

    private final DepartmentRepository departmentRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeIndexer employeeIndexer;

    @Transactional
    public DepartmentResponse createDepartment(DepartmentRequest request) {
        String name = request.name().trim();
        log.info("Creating department: {}", name);

        if (departmentRepository.existsByNameIgnoreCase(name)) {
            throw new ConflictException("DEPARTMENT_ALREADY_EXISTS", "Department " + name + " already exists");
        }

        Department department = Department.builder()
                .name(name)
                .description(request.description())
                .build();

        Department saved = departmentRepository.save(department);
        log.info("Department created: {}", saved.getId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<DepartmentResponse> getAllDepartments() {
        log.debug("Listing departments");
        return departmentRepository.findAllByOrderByNameAsc().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DepartmentResponse getDepartment(UUID departmentId) {
        return toResponse(findDepartment(departmentId));
    }

    @Transactional
    public DepartmentResponse updateDepartment(UUID departmentId, DepartmentRequest request) {
        log.info("Updating department {}", departmentId);
        Department department = findDepartment(departmentId);
        String name = request.name().trim();

        if (!department.getName().equalsIgnoreCase(name) && departmentRepository.existsByNameIgnoreCase(name)) {
            throw new ConflictException("DEPARTMENT_ALREADY_EXISTS", "Department " + name + " already exists");
        }

        boolean renamed = !department.getName().equals(name);
        department.setName(name);
        department.setDescription(request.description());
        Department saved = departmentRepository.save(department);

        if (renamed) {
            // indexed documents carry the department name
            List<Employee> members = employeeRepository.findAllByDepartmentIdAndDeletedAtIsNull(departmentId);
            log.info("Department {} renamed, reindexing {} employees", departmentId, members.size());
            members.forEach(employeeIndexer::indexQuietly);
        }
        return toResponse(saved);
    }

    @Transactional
    public void deleteDepartment(UUID departmentId) {
        log.info("Deleting department {}", departmentId);
        Department department = findDepartment(departmentId);

        long activeEmployees = employeeRepository.countByDepartmentIdAndDeletedAtIsNull(departmentId);
        if (activeEmployees > 0) {
            throw new ConflictException("DEPARTMENT_IN_USE",
                    "Department " + department.getName() + " still has " + activeEmployees + " active employees");
        }

        departmentRepository.delete(department);
        log.info("Department {} deleted", departmentId);
    }

    private Department findDepartment(UUID departmentId) {
        return departmentRepository.findById(departmentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Department", departmentId));
    }

    private DepartmentResponse toResponse(Department department) {
        return new DepartmentResponse(
                department.getId(),
                department.getName(),
                department.getDescription(),
                employeeRepository.countByDepartmentIdAndDeletedAtIsNull(department.getId()),
                department.getCreatedAt(),
                department.getUpdatedAt()
        );
    }
}
