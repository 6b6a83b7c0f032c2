package com.peopleanalytics.department.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record DepartmentRequest(
        @NotBlank(message = "Department name is required")
        @Size(max = 50, message = "Department name must not exceed 50 characters")
        String name,

        @Size(max = 200, message = "Description must not exceed 200 characters")
        String description
) {
}
