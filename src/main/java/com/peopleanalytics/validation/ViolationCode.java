package com.peopleanalytics.validation;

public enum ViolationCode {
    REQUIRED(ViolationCategory.VALIDATION),
    INVALID_FORMAT(ViolationCategory.VALIDATION),
    OUT_OF_RANGE(ViolationCategory.VALIDATION),
    FUTURE_DATE(ViolationCategory.VALIDATION),
    TOO_SHORT(ViolationCategory.VALIDATION),
    DAILY_LIMIT_EXCEEDED(ViolationCategory.VALIDATION),
    EMPLOYEE_INACTIVE(ViolationCategory.VALIDATION),
    DUPLICATE_EMAIL(ViolationCategory.CONFLICT),
    DUPLICATE_IN_BATCH(ViolationCategory.CONFLICT),
    DEPARTMENT_NOT_FOUND(ViolationCategory.NOT_FOUND),
    EMPLOYEE_NOT_FOUND(ViolationCategory.NOT_FOUND);

    private final ViolationCategory category;

    ViolationCode(ViolationCategory category) {
        this.category = category;
    }

    public ViolationCategory getCategory() {
        return category;
    }
}
