package com.peopleanalytics.employee.dto.response;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

public record EmployeeResponse(
        UUID id,
        String name,
        String email,
        UUID departmentId,
        String departmentName,
        String position,
        LocalDate hireDate,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
