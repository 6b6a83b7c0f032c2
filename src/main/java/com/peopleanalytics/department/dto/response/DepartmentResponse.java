package com.peopleanalytics.department.dto.response;

import java.time.LocalDateTime;
import java.util.UUID;

public record DepartmentResponse(
        UUID id,
        String name,
        String description,
        long employeeCount,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
