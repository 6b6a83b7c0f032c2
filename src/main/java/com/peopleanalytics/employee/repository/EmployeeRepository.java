package com.peopleanalytics.employee.repository;

import com.peopleanalytics.employee.model.Employee;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

    Optional<Employee> findByIdAndDeletedAtIsNull(UUID id);

    Optional<Employee> findByEmailAndDeletedAtIsNull(String email);

    boolean existsByEmailAndDeletedAtIsNull(String email);

    boolean existsByEmailAndDeletedAtIsNullAndIdNot(String email, UUID id);

    long countByDepartmentIdAndDeletedAtIsNull(UUID departmentId);

    List<Employee> findAllByIdIn(Collection<UUID> ids);

    List<Employee> findAllByDepartmentId(UUID departmentId);

    List<Employee> findAllByDepartmentIdAndDeletedAtIsNull(UUID departmentId);

    List<Employee> findAllByDeletedAtIsNull();

    @Query("select e from Employee e where e.deletedAt is null "
            + "and (:departmentId is null or e.departmentId = :departmentId) "
            + "and (:search is null or lower(e.name) like lower(concat('%', :search, '%')) "
            + "or e.email like lower(concat('%', :search, '%')))")
    Page<Employee> findActive(@Param("departmentId") UUID departmentId,
                              @Param("search") String search,
                              Pageable pageable);
}
