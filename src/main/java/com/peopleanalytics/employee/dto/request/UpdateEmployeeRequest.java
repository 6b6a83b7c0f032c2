package com.peopleanalytics.employee.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial update: null fields keep their current value. {@code clearDepartment} moves the
 * employee out of any department and cannot be combined with a {@code departmentId}.
 */
public record UpdateEmployeeRequest(
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,

        @Email(message = "Invalid email format")
        @Size(max = 255, message = "Email must not exceed 255 characters")
        String email,

        UUID departmentId,

        @Size(max = 100, message = "Position must not exceed 100 characters")
        String position,

        LocalDate hireDate,

        Boolean clearDepartment
) {
}
