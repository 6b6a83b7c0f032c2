package com.peopleanalytics.importjob.service;

import com.peopleanalytics.validation.ValidationResult;
import com.peopleanalytics.validation.Violation;

import java.util.List;

public record RowOutcome(boolean succeeded, String errorCode, String message) {

    private static final RowOutcome SUCCESS = new RowOutcome(true, null, null);

    public static RowOutcome success() {
        return SUCCESS;
    }

    public static RowOutcome failure(String errorCode, String message) {
        return new RowOutcome(false, errorCode, message);
    }

    /**
     * Row error for a rejected validation: the code of the first violation, and all violations
     * in the message.
     */
    public static RowOutcome rejected(ValidationResult<?> result) {
        return failure(result.getViolations().get(0).code().name(), result.describe());
    }

    public static RowOutcome rejected(List<Violation> violations) {
        return failure(violations.get(0).code().name(), ValidationResult.describe(violations));
    }
}
