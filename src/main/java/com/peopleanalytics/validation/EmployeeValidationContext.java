package com.peopleanalytics.validation;

/**
 * Persisted state the employee rules depend on, looked up by the caller beforehand.
 *
 * @param departmentExists whether the referenced department exists; ignored when the draft has no department
 * @param emailInUse       whether another active employee already uses the draft's email
 */
public record EmployeeValidationContext(
        boolean departmentExists,
        boolean emailInUse
) {
}
