package com.peopleanalytics.exception;

import com.peopleanalytics.validation.Violation;
import com.peopleanalytics.validation.ViolationCategory;

import java.util.List;

/**
 * Carries the violations of a rejected API write up to the exception handler. The import
 * pipeline never throws it; rejected rows become row errors instead.
 */
public class BusinessValidationException extends RuntimeException {

    private final List<Violation> violations;

    public BusinessValidationException(List<Violation> violations) {
        super(violations.isEmpty() ? "Validation failed" : violations.get(0).message());
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * The category that decides the response status: not-found wins over conflict, conflict over
     * plain validation.
     */
    public ViolationCategory getDominantCategory() {
        if (violations.stream().anyMatch(v -> v.category() == ViolationCategory.NOT_FOUND)) {
            return ViolationCategory.NOT_FOUND;
        }
        if (violations.stream().anyMatch(v -> v.category() == ViolationCategory.CONFLICT)) {
            return ViolationCategory.CONFLICT;
        }
        return ViolationCategory.VALIDATION;
    }
}
